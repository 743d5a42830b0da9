package com.example.governor.ratelimiter.controller.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 현재 윈도우 사용량 조회 응답 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitStatusResponse {
    private String key; // Redis 키
    private long limit; // 윈도우당 허용 요청 수
    private long used; // 현재 윈도우 내 요청 수
    private long remaining; // 남은 요청 수
    private long resetAt; // 리셋 시각 (epoch 초)
}
