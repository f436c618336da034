package com.promptmenu.order.repository;

import com.promptmenu.order.entity.OrderStatus;
import lombok.Builder;

import java.time.LocalDateTime;

/**
 * 주문 목록 검색 조건. null인 조건은 적용하지 않는다.
 *
 * @param startDate created_at 하한 (포함)
 * @param endDate   created_at 상한 (포함)
 */
@Builder
public record OrderSearchCondition(
        String customerId,
        String restaurantId,
        OrderStatus status,
        LocalDateTime startDate,
        LocalDateTime endDate
) {
}
