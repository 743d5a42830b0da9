package com.example.governor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RequestGovernorApplication {

    public static void main(String[] args) {
        SpringApplication.run(RequestGovernorApplication.class, args);
    }
}
