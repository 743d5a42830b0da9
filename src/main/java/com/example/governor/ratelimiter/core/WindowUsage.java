package com.example.governor.ratelimiter.core;

import lombok.Builder;
import lombok.Getter;

/**
 * 현재 윈도우 사용량 (조회 전용, 요청을 기록하지 않음)
 */
@Getter
@Builder
public class WindowUsage {

    private final String key;
    private final long used;
    private final int limit;
    private final long remaining;
    private final long resetAtSeconds;
}
