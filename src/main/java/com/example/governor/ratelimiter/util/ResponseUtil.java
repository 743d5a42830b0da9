package com.example.governor.ratelimiter.util;

import com.example.governor.ratelimiter.core.RateLimitDecision;
import com.example.governor.ratelimiter.exception.ErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rate Limiting 응답 처리 유틸리티
 */
@Slf4j
public final class ResponseUtil {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    // Rate Limiting 관련 HTTP 헤더
    public static final String HEADER_RATE_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_RATE_LIMIT_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RATE_LIMIT_RESET = "X-RateLimit-Reset";
    public static final String HEADER_RETRY_AFTER = "Retry-After";

    private ResponseUtil() {
    }

    /**
     * Rate Limiting 응답 헤더 설정
     * 저장소 장애로 판정하지 못한 요청(FAIL_OPEN)에는 헤더를 쓰지 않습니다.
     */
    public static void setRateLimitHeaders(HttpServletResponse response, RateLimitDecision decision) {
        if (!decision.hasHeaders()) {
            return;
        }

        response.setHeader(HEADER_RATE_LIMIT, String.valueOf(decision.getLimit()));
        response.setHeader(HEADER_RATE_LIMIT_REMAINING, String.valueOf(decision.getRemaining()));
        response.setHeader(HEADER_RATE_LIMIT_RESET, String.valueOf(decision.getResetAtSeconds()));

        log.trace("Rate limit headers set - limit: {}, remaining: {}, reset: {}",
                decision.getLimit(), decision.getRemaining(), decision.getResetAtSeconds());
    }

    /**
     * 429 Too Many Requests 응답 생성
     */
    public static void sendTooManyRequestsResponse(HttpServletResponse response, RateLimitDecision decision,
                                                   long nowSeconds) throws IOException {

        ErrorCode errorCode = ErrorCode.RATE_LIMIT_EXCEEDED;
        long retryAfter = TimeUtil.calculateRetryAfterSeconds(decision.getResetAtSeconds(), nowSeconds);

        response.setStatus(errorCode.getStatus().value());
        response.setHeader(HEADER_RETRY_AFTER, String.valueOf(retryAfter));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");

        Map<String, Object> body = createErrorBody(errorCode);

        // Rate Limiting 상세 정보
        Map<String, Object> rateLimitInfo = new LinkedHashMap<>();
        rateLimitInfo.put("limit", decision.getLimit());
        rateLimitInfo.put("remaining", decision.getRemaining());
        rateLimitInfo.put("resetAt", decision.getResetAtSeconds());
        rateLimitInfo.put("resetAtFormatted", TimeUtil.formatEpochSeconds(decision.getResetAtSeconds()));
        rateLimitInfo.put("retryAfter", retryAfter);
        body.put("rateLimit", rateLimitInfo);

        response.getWriter().write(objectMapper.writeValueAsString(body));
        response.getWriter().flush();
    }

    /**
     * 에러 응답 JSON 객체 생성
     */
    public static Map<String, Object> createErrorBody(ErrorCode errorCode) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("status", errorCode.getStatus().value());
        error.put("error", errorCode.getStatus().getReasonPhrase());
        error.put("code", errorCode.name());
        error.put("message", errorCode.getMessage());
        error.put("timestamp", System.currentTimeMillis());
        return error;
    }

    /**
     * Rate Limiting 성공 응답 로깅
     */
    public static void logAllowedRequest(RateLimitDecision decision, String requestPath) {
        log.debug("Request allowed - key: {}, path: {}, outcome: {}, remaining: {}",
                decision.getKey(), requestPath, decision.getOutcome(), decision.getRemaining());
    }

    /**
     * Rate Limiting 거부 응답 로깅
     */
    public static void logRejectedRequest(RateLimitDecision decision, String requestPath) {
        log.warn("Request rejected - key: {}, path: {}, count: {}/{}",
                decision.getKey(), requestPath, decision.getObservedCount(), decision.getLimit());
    }
}
