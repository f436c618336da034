package com.promptmenu.order.dto;

import com.promptmenu.order.entity.DeliveryAddress;
import com.promptmenu.order.entity.OrderDetails;
import com.promptmenu.order.service.OrderPricingCalculator.PricingInput;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 생성 요청 DTO.
 *
 * <p>금액 파생 필드(subtotal, total)와 상태 필드는 받지 않는다. 알 수 없는 필드가 오면
 * 역직렬화 단계에서 400으로 거절된다.</p>
 */
public record CreateOrderRequest(
        @NotBlank(message = "restaurant_id is required")
        String restaurantId,

        @NotEmpty(message = "items must not be empty")
        List<@Valid OrderItemRequest> items,

        String customerId,
        String orderNumber,
        String tableNumber,
        String orderType,
        String source,

        BigDecimal taxRate,
        BigDecimal tipPercentage,
        BigDecimal tax,
        BigDecimal tip,
        BigDecimal serviceFee,
        BigDecimal deliveryFee,
        BigDecimal discount,
        String discountCode,

        String paymentStatus,
        String paymentMethod,
        DeliveryAddress deliveryAddress,
        String specialInstructions,
        List<String> allergies,
        LocalDateTime estimatedReadyTime,
        String notes,
        List<String> tags
) {

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
