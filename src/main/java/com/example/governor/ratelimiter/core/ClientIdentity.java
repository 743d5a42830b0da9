package com.example.governor.ratelimiter.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 요청 주체 식별 정보
 * 인증된 사용자 ID가 있으면 사용자 기준, 없으면 네트워크 주소 기준으로 제한됩니다.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ClientIdentity {

    private final String userId;        // 인증된 사용자 ID (없으면 null)
    private final String clientAddress; // 클라이언트 네트워크 주소

    private ClientIdentity(String userId, String clientAddress) {
        this.userId = userId;
        this.clientAddress = clientAddress;
    }

    public static ClientIdentity ofUser(String userId, String clientAddress) {
        return new ClientIdentity(userId, clientAddress);
    }

    public static ClientIdentity ofAddress(String clientAddress) {
        return new ClientIdentity(null, clientAddress);
    }

    //사용자 ID 유무에 따라 Redis 키 생성
    public String toKey(String keyPrefix) {
        if (userId != null) {
            return keyPrefix + "user:" + userId;
        }
        return keyPrefix + "ip:" + clientAddress;
    }
}
