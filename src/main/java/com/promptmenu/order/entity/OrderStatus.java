package com.promptmenu.order.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import com.promptmenu.common.exception.BusinessException;
import com.promptmenu.common.exception.ErrorCode;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 주문 상태.
 *
 * <pre>
 * pending → confirmed → preparing → ready → delivered → completed
 *    └──────────────────────────────────────────────────→ cancelled
 * </pre>
 *
 * <p>상태 간 순서는 강제하지 않는다. 어느 상태에서든 다른 상태로 바꿀 수 있으며,
 * 바뀔 때마다 해당 상태의 타임스탬프가 기록된다 ({@link Order#changeStatus}).</p>
 */
public enum OrderStatus {
    PENDING("pending"),
    CONFIRMED("confirmed"),
    PREPARING("preparing"),
    READY("ready"),
    DELIVERED("delivered"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static OrderStatus from(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_ORDER_STATUS,
                        "Invalid status. Must be one of: " + allowedValues()));
    }

    private static String allowedValues() {
        return Arrays.stream(values()).map(OrderStatus::value).collect(Collectors.joining(", "));
    }
}
