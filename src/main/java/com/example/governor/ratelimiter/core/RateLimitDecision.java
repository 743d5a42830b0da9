package com.example.governor.ratelimiter.core;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Rate Limiting 판정 결과
 *
 * 요청마다 새로 계산되며 저장되지 않습니다.
 * FAIL_OPEN 결과는 저장소 장애로 판정을 하지 못한 경우이며, 헤더 값을 갖지 않습니다.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class RateLimitDecision {

    public enum Outcome {
        ALLOWED,   // 한도 이내
        REJECTED,  // 한도 초과
        FAIL_OPEN  // 저장소 장애로 제한 없이 통과
    }

    private final Outcome outcome;
    private final String key;            // 사용된 Redis 키
    private final long observedCount;    // 현재 요청을 포함한 윈도우 내 요청 수
    private final int limit;             // 윈도우당 허용 요청 수
    private final long remaining;        // 남은 요청 수 (0 이상)
    private final long resetAtSeconds;   // 윈도우 리셋 시각 (epoch 초)

    public static RateLimitDecision allowed(String key, long count, int limit, long resetAtSeconds) {
        return new RateLimitDecision(Outcome.ALLOWED, key, count, limit, remaining(limit, count), resetAtSeconds);
    }

    public static RateLimitDecision rejected(String key, long count, int limit, long resetAtSeconds) {
        return new RateLimitDecision(Outcome.REJECTED, key, count, limit, remaining(limit, count), resetAtSeconds);
    }

    public static RateLimitDecision failOpen(String key, int limit) {
        return new RateLimitDecision(Outcome.FAIL_OPEN, key, 0, limit, 0, 0);
    }

    public boolean isAllowed() {
        return outcome != Outcome.REJECTED;
    }

    public boolean isRejected() {
        return outcome == Outcome.REJECTED;
    }

    //저장소 트랜잭션이 성공했을 때만 X-RateLimit-* 헤더를 내보냄
    public boolean hasHeaders() {
        return outcome != Outcome.FAIL_OPEN;
    }

    private static long remaining(int limit, long count) {
        return Math.max(0, limit - count);
    }
}
