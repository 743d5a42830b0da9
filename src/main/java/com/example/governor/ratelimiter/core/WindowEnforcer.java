package com.example.governor.ratelimiter.core;

import com.example.governor.ratelimiter.store.CountingStoreException;
import com.example.governor.ratelimiter.util.TimeUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Sliding Window 기반 요청 판정기
 *
 * 동작 원리:
 * - 요청 주체로부터 Client Key를 만들고 저장소에 원자적 트랜잭션을 한 번 실행
 * - 트랜잭션이 돌려준 윈도우 내 요청 수(현재 요청 포함)가 quota를 넘으면 거부
 * - 저장소 장애 시에는 재시도 없이 요청을 통과시킴 (fail-open)
 *
 * 요청 간 공유하는 가변 상태가 없으므로 여러 스레드에서 동시에 호출해도 안전합니다.
 */
@Slf4j
public class WindowEnforcer {

    @Getter
    private final LimiterConfiguration configuration;
    private final Clock clock;

    public WindowEnforcer(LimiterConfiguration configuration, Clock clock) {
        this.configuration = configuration;
        this.clock = clock;

        log.info("WindowEnforcer initialized - keyPrefix: '{}', quota: {}, window: {}s",
                configuration.getKeyPrefix(), configuration.getQuota(), configuration.getWindowSeconds());
    }

    /**
     * 요청 허용 여부를 판정합니다.
     *
     * @param identity 요청 주체
     * @return 판정 결과, 저장소 장애 시 FAIL_OPEN
     */
    public RateLimitDecision enforce(ClientIdentity identity) {
        String key = identity.toKey(configuration.getKeyPrefix());
        int quota = configuration.getQuota();

        long now = TimeUtil.currentTimeSeconds(clock);
        long windowStart = now - configuration.getWindowSeconds();

        long count;
        try {
            count = configuration.getStore().recordAndCount(key, now, windowStart, configuration.getWindow());
        } catch (CountingStoreException e) {
            log.warn("Rate limit store unavailable, allowing request - key: {}, cause: {}", key, e.getMessage());
            return RateLimitDecision.failOpen(key, quota);
        }

        long resetAt = now + configuration.getWindowSeconds();

        if (count > quota) {
            log.debug("Request rejected - key: {}, count: {}/{}", key, count, quota);
            return RateLimitDecision.rejected(key, count, quota, resetAt);
        }

        log.debug("Request allowed - key: {}, count: {}/{}", key, count, quota);
        return RateLimitDecision.allowed(key, count, quota, resetAt);
    }

    /**
     * 요청을 기록하지 않고 현재 윈도우 사용량을 조회합니다.
     *
     * @throws CountingStoreException 저장소 조회에 실패한 경우
     */
    public WindowUsage inspect(ClientIdentity identity) {
        String key = identity.toKey(configuration.getKeyPrefix());
        long now = TimeUtil.currentTimeSeconds(clock);
        long windowStart = now - configuration.getWindowSeconds();

        long used = configuration.getStore().countInWindow(key, windowStart);

        return WindowUsage.builder()
                .key(key)
                .used(used)
                .limit(configuration.getQuota())
                .remaining(Math.max(0, configuration.getQuota() - used))
                .resetAtSeconds(now + configuration.getWindowSeconds())
                .build();
    }
}
