package com.example.governor.ratelimiter.filter;

import com.example.governor.ratelimiter.config.RateLimiterFactory;
import com.example.governor.ratelimiter.config.RateLimiterProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Rate Limit Filter 등록 및 설정
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class FilterConfiguration {

    private final RateLimiterFactory rateLimiterFactory;
    private final ClientIdentityResolver clientIdentityResolver;
    private final RateLimiterProperties rateLimiterProperties;
    private final Clock clock;

    //RateLimitFilter를 Spring Boot에 등록
    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration() {
        FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>();

        registration.setFilter(new RateLimitFilter(
                rateLimiterFactory, clientIdentityResolver, rateLimiterProperties, clock));

        // 모든 요청에 적용하고, 제외 경로는 필터의 shouldNotFilter에서 판단
        registration.addUrlPatterns("/*");
        registration.setName("rateLimitFilter");

        // user_id attribute를 채우는 인증 필터보다 뒤에서 실행되도록 순서를 설정으로 지정
        registration.setOrder(rateLimiterProperties.getFilterOrder());

        log.info("RateLimitFilter registered - order: {}, enabled: {}",
                rateLimiterProperties.getFilterOrder(), rateLimiterProperties.isEnabled());

        return registration;
    }
}
