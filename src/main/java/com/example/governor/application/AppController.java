package com.example.governor.application;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Rate Limiting 대상 샘플 엔드포인트
 */
@RestController
public class AppController {

    @GetMapping("/health")
    public String healthCheck() {
        return "Application is running";
    }

    @GetMapping("/api/hello")
    public String hello() {
        return "Hello, your request was within the rate limit";
    }
}
