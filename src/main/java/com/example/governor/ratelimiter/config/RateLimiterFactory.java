package com.example.governor.ratelimiter.config;

import com.example.governor.ratelimiter.core.LimiterConfiguration;
import com.example.governor.ratelimiter.core.WindowEnforcer;
import com.example.governor.ratelimiter.store.WindowCountingStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WindowEnforcer 인스턴스를 생성하고 관리하는 팩토리 클래스
 *
 * 기본 설정과 URL 패턴별 설정마다 LimiterConfiguration을 한 번만 만들고 캐시합니다.
 */
@Slf4j
@Component
public class RateLimiterFactory {

    private static final String DEFAULT_KEY = "default";

    private final RateLimiterProperties properties;
    private final WindowCountingStore store;
    private final Clock clock;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();
    private final ConcurrentHashMap<String, WindowEnforcer> enforcerCache = new ConcurrentHashMap<>();

    public RateLimiterFactory(RateLimiterProperties properties, WindowCountingStore store, Clock clock) {
        this.properties = properties;
        this.store = store;
        this.clock = clock;
    }

    //잘못된 quota/window 설정이 첫 요청이 아닌 기동 시점에 실패하도록 모든 WindowEnforcer를 미리 생성
    @PostConstruct
    public void initialize() {
        getEnforcer();
        properties.getUrlPatterns().keySet().forEach(this::getEnforcerForPattern);
    }

    //기본 설정의 WindowEnforcer 반환
    public WindowEnforcer getEnforcer() {
        return enforcerCache.computeIfAbsent(DEFAULT_KEY, k -> createDefaultEnforcer());
    }

    //URL 패턴 설정의 WindowEnforcer 반환, 설정이 없으면 기본 WindowEnforcer
    public WindowEnforcer getEnforcerForPattern(String urlPattern) {
        RateLimiterProperties.UrlPatternConfig patternConfig = properties.getUrlPatterns().get(urlPattern);
        if (patternConfig == null) {
            return getEnforcer();
        }
        return enforcerCache.computeIfAbsent("pattern:" + urlPattern,
                k -> createPatternEnforcer(urlPattern, patternConfig));
    }

    //요청 경로에 맞는 WindowEnforcer 반환 (선언 순서상 첫 번째로 매칭되는 패턴)
    public WindowEnforcer getEnforcerForPath(String requestPath) {
        for (Map.Entry<String, RateLimiterProperties.UrlPatternConfig> entry :
                properties.getUrlPatterns().entrySet()) {

            if (pathMatcher.match(entry.getKey(), requestPath)) {
                log.debug("Matched pattern '{}' for path '{}'", entry.getKey(), requestPath);
                return getEnforcerForPattern(entry.getKey());
            }
        }
        return getEnforcer();
    }

    private WindowEnforcer createDefaultEnforcer() {
        LimiterConfiguration configuration = LimiterConfiguration.of(
                store, properties.getKeyPrefix(), properties.getLimit(), properties.getWindow());

        log.info("Creating default WindowEnforcer - {}", configuration);
        return new WindowEnforcer(configuration, clock);
    }

    private WindowEnforcer createPatternEnforcer(String urlPattern, RateLimiterProperties.UrlPatternConfig patternConfig) {
        // 패턴별 prefix가 없으면 기본 prefix에 패턴 이름을 덧붙여 다른 패턴과 카운트를 분리
        String keyPrefix = patternConfig.getKeyPrefix() != null
                ? patternConfig.getKeyPrefix()
                : properties.getKeyPrefix() + urlPattern + ":";
        int limit = patternConfig.getLimit() != null ? patternConfig.getLimit() : properties.getLimit();
        Duration window = patternConfig.getWindow() != null ? patternConfig.getWindow() : properties.getWindow();

        LimiterConfiguration configuration = LimiterConfiguration.of(store, keyPrefix, limit, window);

        log.info("Creating WindowEnforcer for pattern '{}' - {}", urlPattern, configuration);
        return new WindowEnforcer(configuration, clock);
    }
}
