package com.example.governor.ratelimiter.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;

/**
 * Redis Sorted Set 기반 Sliding Window 카운팅 저장소
 *
 * 동작 원리:
 * - 클라이언트 키마다 Sorted Set 하나를 사용하고, 요청 하나가 항목 하나 (score = 요청 시각, 초)
 * - Lua 스크립트로 제거/추가/조회/만료 설정을 한 번에 실행
 * - Redis는 스크립트 실행 중 다른 명령을 끼워 넣지 않으므로 같은 키에 대한 동시 요청이 직렬화됨
 *
 * 같은 초에 들어온 요청들이 하나로 합쳐지지 않도록 member에 랜덤 suffix를 붙입니다.
 */
@Slf4j
@Component
public class RedisWindowCountingStore implements WindowCountingStore {

    static final String SLIDING_WINDOW_SCRIPT = """
        local key = KEYS[1]
        local window_start = tonumber(ARGV[1])
        local now = tonumber(ARGV[2])
        local member = ARGV[3]
        local ttl = tonumber(ARGV[4])

        -- 1. 윈도우 밖의 오래된 요청 제거
        redis.call('ZREMRANGEBYSCORE', key, 0, window_start)

        -- 2. 현재 요청 기록 (카운트 전에 추가하므로 현재 요청도 포함됨)
        redis.call('ZADD', key, now, member)

        -- 3. 윈도우 내 요청 수
        local count = redis.call('ZCARD', key)

        -- 4. 유휴 키 정리를 위한 만료 시간 갱신
        redis.call('EXPIRE', key, ttl)

        return count
        """;

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> slidingWindowScript;

    public RedisWindowCountingStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.slidingWindowScript = RedisScript.of(SLIDING_WINDOW_SCRIPT, Long.class);
    }

    @Override
    public long recordAndCount(String key, long nowSeconds, long windowStartSeconds, Duration windowTtl) {
        String member = nowSeconds + "-" + UUID.randomUUID().toString().substring(0, 8);

        Long count;
        try {
            count = redisTemplate.execute(
                slidingWindowScript,
                Collections.singletonList(key),
                String.valueOf(windowStartSeconds),
                String.valueOf(nowSeconds),
                member,
                String.valueOf(windowTtl.getSeconds())
            );
        } catch (DataAccessException e) {
            throw new CountingStoreException("Sliding window transaction failed for key: " + key, e);
        }

        if (count == null) {
            throw new CountingStoreException("Sliding window transaction returned no reply for key: " + key);
        }

        log.trace("Sliding window recorded - key: {}, now: {}, count: {}", key, nowSeconds, count);
        return count;
    }

    @Override
    public long countInWindow(String key, long windowStartSeconds) {
        Long count;
        try {
            // score는 정수 초이므로 windowStart 초과 = windowStart + 1 이상
            count = redisTemplate.opsForZSet().count(key, windowStartSeconds + 1, Double.POSITIVE_INFINITY);
        } catch (DataAccessException e) {
            throw new CountingStoreException("Sliding window lookup failed for key: " + key, e);
        }
        return count != null ? count : 0;
    }
}
