package com.example.governor.ratelimiter.store;

/**
 * 카운팅 저장소 트랜잭션 실패 (연결 실패, 타임아웃, 프로토콜 오류)
 */
public class CountingStoreException extends RuntimeException {

    public CountingStoreException(String message) {
        super(message);
    }

    public CountingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
