package com.promptmenu.order.dto;

import com.promptmenu.order.entity.Customization;
import com.promptmenu.order.entity.OrderItem;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;

import java.math.BigDecimal;
import java.util.List;

/**
 * 주문 항목 요청. subtotal은 서버가 계산하므로 받지 않는다.
 */
public record OrderItemRequest(
        String itemId,

        String name,

        @Min(value = 1, message = "quantity must be at least 1")
        Integer quantity,

        @DecimalMin(value = "0", message = "unit_price must not be negative")
        BigDecimal unitPrice,

        List<Customization> customizations,

        String specialInstructions
) {

    public OrderItem toEntity() {
        return OrderItem.builder()
                .itemId(itemId)
                .name(name)
                .quantity(quantity)
                .unitPrice(unitPrice)
                .customizations(customizations)
                .specialInstructions(specialInstructions)
                .build();
    }

    public static List<OrderItem> toEntities(List<OrderItemRequest> requests) {
        return requests == null ? null : requests.stream().map(OrderItemRequest::toEntity).toList();
    }
}
