package com.promptmenu.order.dto;

import com.promptmenu.order.entity.DeliveryAddress;
import com.promptmenu.order.entity.OrderDetails;
import com.promptmenu.order.service.OrderPricingCalculator.PricingInput;
import jakarta.validation.Valid;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Stream;

/**
 * 주문 수정 요청 DTO (허용 목록).
 *
 * <p>restaurant_id, customer_id, order_number, status, 금액 파생 필드는 수정할 수 없다.
 * 상태 변경은 PUT /api/orders/{id}/status, 취소는 DELETE를 사용한다.</p>
 */
public record UpdateOrderRequest(
        List<@Valid OrderItemRequest> items,

        BigDecimal taxRate,
        BigDecimal tipPercentage,
        BigDecimal tax,
        BigDecimal tip,
        BigDecimal serviceFee,
        BigDecimal deliveryFee,
        BigDecimal discount,
        String discountCode,

        String tableNumber,
        String orderType,
        String paymentStatus,
        String paymentMethod,
        DeliveryAddress deliveryAddress,
        String specialInstructions,
        List<String> allergies,
        LocalDateTime estimatedReadyTime,
        String notes,
        List<String> tags
) {

    /** items 또는 금액 입력 중 하나라도 있으면 금액을 다시 계산해야 한다. */
    public boolean affectsPricing() {
        return items != null || Stream.of(taxRate, tipPercentage, tax, tip, serviceFee, deliveryFee, discount)
                .anyMatch(value -> value != null);
    }

    public PricingInput toPricingInput() {
        return PricingInput.builder()
                .items(OrderItemRequest.toEntities(items))
                .taxRate(taxRate)
                .tipPercentage(tipPercentage)
                .tax(tax)
                .tip(tip)
                .serviceFee(serviceFee)
                .deliveryFee(deliveryFee)
                .discount(discount)
                .build();
    }

    public OrderDetails toDetails() {
        return OrderDetails.builder()
                .tableNumber(tableNumber)
                .orderType(orderType)
                .paymentStatus(paymentStatus)
                .paymentMethod(paymentMethod)
                .discountCode(discountCode)
                .deliveryAddress(deliveryAddress)
                .specialInstructions(specialInstructions)
                .allergies(allergies)
                .estimatedReadyTime(estimatedReadyTime)
                .notes(notes)
                .tags(tags)
                .build();
    }
}
