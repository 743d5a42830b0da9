package com.example.governor.common;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 공통 API 응답 포맷
 */
@Getter
@AllArgsConstructor
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final String message;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data, null);
    }
}
