package com.promptmenu.order.entity;

import java.math.BigDecimal;

/**
 * 주문 항목 옵션 (예: "Extra cheese", 1.50). 가격은 항목 단가에 더해진다.
 */
public record Customization(String name, BigDecimal price) {

    public Customization {
        price = price == null ? BigDecimal.ZERO : price;
    }
}
