package com.example.governor.ratelimiter.exception;

import com.example.governor.ratelimiter.store.CountingStoreException;
import com.example.governor.ratelimiter.util.ResponseUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * 컨트롤러 계층 예외 처리
 * 필터에서 발생하는 거부 응답은 ResponseUtil이 직접 작성합니다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    //상태 조회 중 저장소 장애 - 판정 경로가 아니므로 fail-open 하지 않고 503으로 알림
    @ExceptionHandler(CountingStoreException.class)
    public ResponseEntity<Map<String, Object>> handleCountingStoreException(CountingStoreException e) {
        log.error("Rate limit store lookup failed", e);

        ErrorCode errorCode = ErrorCode.STORE_UNAVAILABLE;
        return ResponseEntity.status(errorCode.getStatus())
                .body(ResponseUtil.createErrorBody(errorCode));
    }
}
