package com.promptmenu.order.entity;

import lombok.Builder;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 수정 시 변경 가능한 비금액 필드. null인 필드는 기존 값을 유지한다.
 */
@Builder
public record OrderDetails(
        String tableNumber,
        String orderType,
        String paymentStatus,
        String paymentMethod,
        String discountCode,
        DeliveryAddress deliveryAddress,
        String specialInstructions,
        List<String> allergies,
        LocalDateTime estimatedReadyTime,
        String notes,
        List<String> tags
) {
}
