package com.promptmenu.order.entity;

import java.math.BigDecimal;
import java.util.List;

/**
 * 가격 계산 결과. total = subtotal + tax + tip + serviceFee + deliveryFee - discount (0 미만 허용).
 *
 * @param items 소계가 채워진 주문 항목
 */
public record PricedOrder(
        List<OrderItem> items,
        BigDecimal subtotal,
        BigDecimal taxRate,
        BigDecimal tax,
        BigDecimal tipPercentage,
        BigDecimal tip,
        BigDecimal serviceFee,
        BigDecimal deliveryFee,
        BigDecimal discount,
        BigDecimal total
) {
}
