package com.example.governor.ratelimiter.util;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * 시간 관련 유틸리티 클래스
 */
public final class TimeUtil {

    private static final DateTimeFormatter FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private TimeUtil() {
    }

    //현재 시간을 초로 반환 (소수점 이하 버림)
    public static long currentTimeSeconds(Clock clock) {
        return clock.instant().getEpochSecond();
    }

    //epoch 초를 사람이 읽기 쉬운 형태로 변환 (UTC)
    public static String formatEpochSeconds(long epochSeconds) {
        return FORMATTER.format(Instant.ofEpochSecond(epochSeconds));
    }

    //재시도 권장 시간 계산 (초 단위)
    public static long calculateRetryAfterSeconds(long resetAtSeconds, long nowSeconds) {
        return Math.max(1, resetAtSeconds - nowSeconds);
    }
}
