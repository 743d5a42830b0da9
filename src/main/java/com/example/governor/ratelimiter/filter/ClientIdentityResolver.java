package com.example.governor.ratelimiter.filter;

import com.example.governor.ratelimiter.config.RateLimiterProperties;
import com.example.governor.ratelimiter.core.ClientIdentity;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 요청에서 Rate Limiting 주체를 추출
 *
 * 인증 단계에서 request attribute로 넣어 둔 사용자 ID를 우선 사용하고,
 * 없으면 클라이언트 IP 주소를 사용합니다. 인증 자체는 이 클래스의 책임이 아닙니다.
 */
@Component
@RequiredArgsConstructor
public class ClientIdentityResolver {

    private static final String HEADER_FORWARDED_FOR = "X-Forwarded-For";

    private final RateLimiterProperties properties;

    public ClientIdentity resolve(HttpServletRequest request) {
        String clientAddress = resolveClientAddress(request);

        Object userId = request.getAttribute(properties.getUserIdAttribute());
        if (userId != null && StringUtils.hasText(userId.toString())) {
            return ClientIdentity.ofUser(userId.toString(), clientAddress);
        }
        return ClientIdentity.ofAddress(clientAddress);
    }

    //클라이언트 IP 주소 추출 - 프록시 헤더는 설정으로 신뢰한 경우에만 사용
    private String resolveClientAddress(HttpServletRequest request) {
        if (properties.isTrustForwardedHeaders()) {
            // 빈 hop은 버리고 첫 번째 hop 사용, 남는 값이 없으면 원격 주소
            String[] hops = StringUtils.tokenizeToStringArray(request.getHeader(HEADER_FORWARDED_FOR), ",");
            if (hops.length > 0) {
                return hops[0];
            }
        }
        return request.getRemoteAddr();
    }
}
