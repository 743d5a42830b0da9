package com.example.governor.ratelimiter.store;

import java.time.Duration;

/**
 * Sliding Window 카운팅 저장소 인터페이스
 * 모든 서비스 인스턴스가 공유하는 단일 진실 공급원(Redis)을 추상화합니다.
 */
public interface WindowCountingStore {

    /**
     * 아래 네 단계를 하나의 원자적 단위로 실행하고 윈도우 내 요청 수를 반환합니다.
     * 1. score가 [0, windowStart] 범위인 항목 제거
     * 2. score = now 인 항목 추가
     * 3. 집합 크기 조회 (현재 요청 포함)
     * 4. 키 만료 시간을 windowTtl로 갱신
     *
     * @param key Client Key
     * @param nowSeconds 현재 시각 (epoch 초)
     * @param windowStartSeconds 윈도우 시작 시각 (epoch 초)
     * @param windowTtl 키 만료 시간
     * @return 현재 요청을 포함한 윈도우 내 요청 수
     * @throws CountingStoreException 트랜잭션 전체가 실패한 경우
     */
    long recordAndCount(String key, long nowSeconds, long windowStartSeconds, Duration windowTtl);

    /**
     * 요청을 기록하지 않고 윈도우 내 요청 수만 조회합니다.
     *
     * @param key Client Key
     * @param windowStartSeconds 윈도우 시작 시각 (epoch 초), 이 값 이하의 항목은 세지 않음
     * @throws CountingStoreException 저장소 조회에 실패한 경우
     */
    long countInWindow(String key, long windowStartSeconds);
}
