package com.example.governor.ratelimiter.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Rate Limiter가 클라이언트에게 노출하는 에러 코드
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "Rate limit exceeded"),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Rate limit store unavailable");

    private final HttpStatus status;
    private final String message;
}
