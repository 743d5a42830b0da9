package com.example.governor.ratelimiter.core;

import com.example.governor.support.InMemoryWindowCountingStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LimiterConfiguration 테스트")
class LimiterConfigurationTest {

    private final InMemoryWindowCountingStore store = new InMemoryWindowCountingStore();

    @Test
    @DisplayName("정상 값으로 생성하면 그대로 보관되어야 함")
    void testValidConfiguration() {
        LimiterConfiguration configuration = LimiterConfiguration.of(store, "rl:", 5, Duration.ofSeconds(60));

        assertSame(store, configuration.getStore());
        assertEquals("rl:", configuration.getKeyPrefix());
        assertEquals(5, configuration.getQuota());
        assertEquals(Duration.ofSeconds(60), configuration.getWindow());
        assertEquals(60, configuration.getWindowSeconds());
    }

    @Test
    @DisplayName("빈 prefix는 허용되어야 함")
    void testEmptyPrefixAllowed() {
        LimiterConfiguration configuration = LimiterConfiguration.of(store, "", 1, Duration.ofSeconds(1));

        assertEquals("", configuration.getKeyPrefix());
    }

    @Test
    @DisplayName("0 이하의 quota는 거부되어야 함")
    void testNonPositiveQuotaRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> LimiterConfiguration.of(store, "rl:", 0, Duration.ofSeconds(60)));
        assertThrows(IllegalArgumentException.class,
                () -> LimiterConfiguration.of(store, "rl:", -3, Duration.ofSeconds(60)));
    }

    @Test
    @DisplayName("1초 미만이거나 음수인 윈도우는 거부되어야 함")
    void testInvalidWindowRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> LimiterConfiguration.of(store, "rl:", 5, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> LimiterConfiguration.of(store, "rl:", 5, Duration.ofMillis(999)));
        assertThrows(IllegalArgumentException.class,
                () -> LimiterConfiguration.of(store, "rl:", 5, Duration.ofSeconds(-60)));
        assertThrows(IllegalArgumentException.class,
                () -> LimiterConfiguration.of(store, "rl:", 5, null));
    }

    @Test
    @DisplayName("저장소와 prefix는 null일 수 없음")
    void testNullCollaboratorsRejected() {
        assertThrows(NullPointerException.class,
                () -> LimiterConfiguration.of(null, "rl:", 5, Duration.ofSeconds(60)));
        assertThrows(NullPointerException.class,
                () -> LimiterConfiguration.of(store, null, 5, Duration.ofSeconds(60)));
    }
}
