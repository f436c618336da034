package com.promptmenu.order.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 상태 변경 요청. 값 검증은 {@code OrderStatus.from}이 담당한다 (허용 값 목록을 에러 메시지에 포함).
 */
public record StatusChangeRequest(
        @NotBlank(message = "Status is required")
        String status
) {}
