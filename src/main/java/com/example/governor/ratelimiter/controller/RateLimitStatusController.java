package com.example.governor.ratelimiter.controller;

import com.example.governor.common.ApiResponse;
import com.example.governor.ratelimiter.config.RateLimiterFactory;
import com.example.governor.ratelimiter.controller.response.RateLimitStatusResponse;
import com.example.governor.ratelimiter.core.ClientIdentity;
import com.example.governor.ratelimiter.core.WindowUsage;
import com.example.governor.ratelimiter.filter.ClientIdentityResolver;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Rate Limit 사용량 조회 컨트롤러
 * 요청을 기록하지 않으므로 조회 자체는 한도를 소모하지 않습니다.
 */
@RestController
@RequestMapping("/api/rate-limit")
@RequiredArgsConstructor
public class RateLimitStatusController {

    private final RateLimiterFactory rateLimiterFactory;
    private final ClientIdentityResolver clientIdentityResolver;

    /**
     * 호출한 클라이언트의 현재 윈도우 사용량 조회
     *
     * @param path 조회할 경로 (URL 패턴별 설정 선택용), 없으면 기본 설정
     */
    @GetMapping("/status")
    public ApiResponse<RateLimitStatusResponse> status(
            @RequestParam(name = "path", required = false) String path,
            HttpServletRequest request) {

        ClientIdentity identity = clientIdentityResolver.resolve(request);
        WindowUsage usage = (path != null
                ? rateLimiterFactory.getEnforcerForPath(path)
                : rateLimiterFactory.getEnforcer()).inspect(identity);

        return ApiResponse.success(RateLimitStatusResponse.builder()
                .key(usage.getKey())
                .limit(usage.getLimit())
                .used(usage.getUsed())
                .remaining(usage.getRemaining())
                .resetAt(usage.getResetAtSeconds())
                .build());
    }
}
