package com.example.governor.ratelimiter.filter;

import com.example.governor.ratelimiter.config.RateLimiterFactory;
import com.example.governor.ratelimiter.config.RateLimiterProperties;
import com.example.governor.ratelimiter.core.ClientIdentity;
import com.example.governor.ratelimiter.core.RateLimitDecision;
import com.example.governor.ratelimiter.core.WindowEnforcer;
import com.example.governor.ratelimiter.util.ResponseUtil;
import com.example.governor.ratelimiter.util.TimeUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.util.List;

/**
 * Rate Limiting을 적용하는 서블릿 필터
 * OncePerRequestFilter를 상속받아 요청당 한 번만 실행되도록 보장
 */
@Slf4j
@RequiredArgsConstructor
public class RateLimitFilter extends OncePerRequestFilter {

    // 항상 Rate Limiting에서 제외되는 경로 (헬스 체크)
    // 사용량 조회도 Redis를 호출하므로 제외하지 않고 한도를 소모함
    private static final List<String> DEFAULT_EXCLUDED_PATHS = List.of("/actuator/**", "/health");

    private final RateLimiterFactory rateLimiterFactory;
    private final ClientIdentityResolver identityResolver;
    private final RateLimiterProperties properties;
    private final Clock clock;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        String requestPath = request.getRequestURI();

        // 1. 요청 주체 식별 (사용자 ID 또는 IP)
        ClientIdentity identity = identityResolver.resolve(request);

        // 2. 요청 경로에 따른 WindowEnforcer 선택
        WindowEnforcer enforcer = rateLimiterFactory.getEnforcerForPath(requestPath);

        // 3. Rate Limiting 판정 (저장소 장애 시 FAIL_OPEN)
        RateLimitDecision decision = enforcer.enforce(identity);

        // 4. 응답 헤더 설정
        ResponseUtil.setRateLimitHeaders(response, decision);

        // 5. 결과에 따른 처리
        if (decision.isRejected()) {
            ResponseUtil.logRejectedRequest(decision, requestPath);
            ResponseUtil.sendTooManyRequestsResponse(response, decision, TimeUtil.currentTimeSeconds(clock));
            return;
        }

        ResponseUtil.logAllowedRequest(decision, requestPath);
        filterChain.doFilter(request, response);
    }

    //비활성화 상태이거나 제외 경로이면 Rate Limiting을 적용하지 않음
    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) throws ServletException {
        if (!properties.isEnabled()) {
            return true;
        }

        String path = request.getRequestURI();
        return matchesAny(DEFAULT_EXCLUDED_PATHS, path) || matchesAny(properties.getExcludedPaths(), path);
    }

    private boolean matchesAny(List<String> patterns, String path) {
        for (String pattern : patterns) {
            if (pathMatcher.match(pattern, path)) {
                return true;
            }
        }
        return false;
    }
}
