package com.promptmenu.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 응답 래퍼.
 *
 * <p>성공: {@code {"success": true, "message": "Order created successfully", "data": {...}}}<br>
 * 실패: {@code {"success": false, "error": "Order not found"}}</p>
 *
 * <p>{@code @JsonInclude(NON_NULL)}로 사용하지 않는 필드는 JSON에서 제외된다.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, String message, T data, String error) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, null, data, null);
    }

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(true, message, data, null);
    }

    // no-op 결과처럼 data 없이 메시지만 돌려줄 때
    public static <T> ApiResponse<T> message(String message) {
        return new ApiResponse<>(true, message, null, null);
    }

    public static <T> ApiResponse<T> error(String error) {
        return new ApiResponse<>(false, null, null, error);
    }
}
