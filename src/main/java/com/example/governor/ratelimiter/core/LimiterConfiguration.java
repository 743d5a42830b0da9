package com.example.governor.ratelimiter.core;

import com.example.governor.ratelimiter.store.WindowCountingStore;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Objects;

/**
 * Sliding Window Rate Limiter 설정 값
 *
 * 서비스 기동 시 한 번 생성되고 이후에는 변경되지 않습니다.
 * 모든 요청 처리 스레드가 읽기 전용으로 공유합니다.
 */
@Getter
@ToString(exclude = "store")
public final class LimiterConfiguration {

    private final WindowCountingStore store; // 카운팅 저장소 (Redis)
    private final String keyPrefix;          // 키 네임스페이스 prefix
    private final int quota;                 // 윈도우당 허용 요청 수
    private final Duration window;           // 윈도우 크기

    public LimiterConfiguration(WindowCountingStore store, String keyPrefix, int quota, Duration window) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix must not be null");
        if (quota <= 0) {
            throw new IllegalArgumentException("Quota must be positive: " + quota);
        }
        // 윈도우 계산은 초 단위이므로 1초 미만의 윈도우는 허용하지 않음
        if (window == null || window.getSeconds() < 1) {
            throw new IllegalArgumentException("Window must be at least one second: " + window);
        }
        this.quota = quota;
        this.window = window;
    }

    public static LimiterConfiguration of(WindowCountingStore store, String keyPrefix, int quota, Duration window) {
        return new LimiterConfiguration(store, keyPrefix, quota, window);
    }

    //윈도우 크기를 초 단위로 반환
    public long getWindowSeconds() {
        return window.getSeconds();
    }
}
