package com.example.governor.ratelimiter.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rate Limiter 설정 프로퍼티
 */
@Data
@Validated
@ConfigurationProperties(prefix = "rate-limiter")
public class RateLimiterProperties {

    private boolean enabled = true; // Rate Limiter 활성화

    @NotNull
    private String keyPrefix = "rate_limit:"; // Redis 키 prefix

    @Positive
    private int limit = 100; // 윈도우당 허용 요청 수

    @NotNull
    private Duration window = Duration.ofMinutes(1); // 윈도우 크기

    @NotNull
    private String userIdAttribute = "user_id"; // 인증 단계에서 사용자 ID를 담는 request attribute 이름

    private int filterOrder = 0; // 필터 실행 순서 (인증 필터보다 뒤)

    private boolean trustForwardedHeaders = false; // X-Forwarded-For 헤더 신뢰 여부 (프록시 뒤에 있을 때만)

    private List<String> excludedPaths = new ArrayList<>(); // Rate Limiting 제외 경로 (Ant 패턴)

    @Valid
    private Map<String, UrlPatternConfig> urlPatterns = new LinkedHashMap<>(); // URL 패턴별 설정 (선언 순서대로 매칭)

    /**
     * URL 패턴별 설정
     * 비어있는 값은 기본 설정을 따릅니다.
     */
    @Data
    public static class UrlPatternConfig {
        private String keyPrefix;
        @Positive
        private Integer limit;
        private Duration window;
    }
}
