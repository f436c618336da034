package com.promptmenu.order.service;

import com.promptmenu.order.entity.Customization;
import com.promptmenu.order.entity.Order;
import com.promptmenu.order.entity.OrderItem;
import com.promptmenu.order.entity.PricedOrder;
import com.promptmenu.order.service.OrderPricingCalculator.PricingInput;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 주문 금액 계산 단위 테스트 - 저장소 없이 계산 규칙만 검증한다.
 */
class OrderPricingCalculatorTest {

    private final OrderPricingCalculator calculator = new OrderPricingCalculator();

    private static OrderItem item(int quantity, String unitPrice, Customization... customizations) {
        return OrderItem.builder()
                .name("Burger")
                .quantity(quantity)
                .unitPrice(new BigDecimal(unitPrice))
                .customizations(List.of(customizations))
                .build();
    }

    private static OrderItem hundred() {
        return item(1, "100");
    }

    @Test
    @DisplayName("항목 소계 = (단가 + 옵션 가격 합) * 수량")
    void itemSubtotal_IncludesCustomizations() {
        OrderItem burger = item(2, "10", new Customization("Extra cheese", new BigDecimal("1.5")));

        PricedOrder priced = calculator.price(PricingInput.builder().items(List.of(burger)).build());

        assertThat(burger.getSubtotal()).isEqualByComparingTo("23.0");
        assertThat(priced.subtotal()).isEqualByComparingTo("23.0");
    }

    @Test
    @DisplayName("tax_rate가 있으면 tax = round(subtotal * tax_rate, 2)")
    void tax_DerivedFromRate() {
        PricedOrder priced = calculator.price(PricingInput.builder()
                .items(List.of(hundred()))
                .taxRate(new BigDecimal("0.08"))
                .build());

        assertThat(priced.tax()).isEqualByComparingTo("8.00");
        assertThat(priced.total()).isEqualByComparingTo("108.00");
    }

    @Test
    @DisplayName("tax_rate가 0이면 요청한 tax를 그대로 쓴다")
    void tax_CallerValueWhenRateZero() {
        PricedOrder priced = calculator.price(PricingInput.builder()
                .items(List.of(hundred()))
                .taxRate(BigDecimal.ZERO)
                .tax(new BigDecimal("5"))
                .build());

        assertThat(priced.tax()).isEqualByComparingTo("5");
    }

    @Test
    @DisplayName("tax_rate가 양수면 요청한 tax보다 우선한다")
    void tax_RateOverridesCallerValue() {
        PricedOrder priced = calculator.price(PricingInput.builder()
                .items(List.of(hundred()))
                .taxRate(new BigDecimal("0.1"))
                .tax(new BigDecimal("5"))
                .build());

        assertThat(priced.tax()).isEqualByComparingTo("10.00");
    }

    @Test
    @DisplayName("tip_percentage만 있으면 tip = round(subtotal * tip_percentage, 2)")
    void tip_DerivedFromPercentage() {
        PricedOrder priced = calculator.price(PricingInput.builder()
                .items(List.of(hundred()))
                .tipPercentage(new BigDecimal("0.15"))
                .build());

        assertThat(priced.tip()).isEqualByComparingTo("15.00");
    }

    @Test
    @DisplayName("tip을 직접 주면 tip_percentage가 있어도 그 값을 쓴다")
    void tip_ExplicitValueWins() {
        PricedOrder priced = calculator.price(PricingInput.builder()
                .items(List.of(hundred()))
                .tipPercentage(new BigDecimal("0.15"))
                .tip(new BigDecimal("3"))
                .build());

        assertThat(priced.tip()).isEqualByComparingTo("3");
    }

    @Test
    @DisplayName("total = subtotal + tax + tip + service_fee + delivery_fee - discount, 음수도 허용")
    void total_SumsAllComponents() {
        PricedOrder priced = calculator.price(PricingInput.builder()
                .items(List.of(item(1, "20")))
                .tax(new BigDecimal("1"))
                .tip(new BigDecimal("2"))
                .serviceFee(new BigDecimal("3"))
                .deliveryFee(new BigDecimal("4"))
                .discount(new BigDecimal("50"))
                .build());

        assertThat(priced.total()).isEqualByComparingTo("-20");
    }

    @Test
    @DisplayName("반올림은 HALF_UP, 소수 둘째 자리")
    void rounding_HalfUp() {
        PricedOrder priced = calculator.price(PricingInput.builder()
                .items(List.of(item(1, "10.05")))
                .taxRate(new BigDecimal("0.5"))
                .build());

        assertThat(priced.tax()).isEqualByComparingTo("5.03");
    }

    @Test
    @DisplayName("재계산 - 요청에 없는 금액 입력은 저장된 주문 값을 쓴다")
    void recalculate_FallsBackToStoredValues() {
        Order existing = Order.builder()
                .orderNumber("ORD-1")
                .restaurantId("507f1f77bcf86cd799439011")
                .createdAt(LocalDateTime.of(2024, 1, 1, 12, 0))
                .build();
        existing.applyPricing(calculator.price(PricingInput.builder()
                .items(List.of(hundred()))
                .taxRate(new BigDecimal("0.1"))
                .serviceFee(new BigDecimal("2"))
                .discount(new BigDecimal("1"))
                .tip(new BigDecimal("4"))
                .build()));

        PricedOrder priced = calculator.recalculate(existing, PricingInput.builder()
                .items(List.of(item(2, "100")))
                .build());

        assertThat(priced.subtotal()).isEqualByComparingTo("200");
        assertThat(priced.tax()).isEqualByComparingTo("20.00");
        assertThat(priced.tip()).isEqualByComparingTo("4");
        assertThat(priced.total()).isEqualByComparingTo("225.00");
    }

    @Test
    @DisplayName("재계산 - 저장된 tip_percentage가 양수면 tip을 새 subtotal로 다시 계산한다")
    void recalculate_RederivesTipFromPercentage() {
        Order existing = Order.builder()
                .orderNumber("ORD-2")
                .restaurantId("507f1f77bcf86cd799439011")
                .createdAt(LocalDateTime.of(2024, 1, 1, 12, 0))
                .build();
        existing.applyPricing(calculator.price(PricingInput.builder()
                .items(List.of(hundred()))
                .tipPercentage(new BigDecimal("0.1"))
                .build()));
        assertThat(existing.getTip()).isEqualByComparingTo("10.00");

        PricedOrder priced = calculator.recalculate(existing, PricingInput.builder()
                .items(List.of(item(3, "100")))
                .build());

        assertThat(priced.tip()).isEqualByComparingTo("30.00");
        assertThat(priced.total()).isEqualByComparingTo("330.00");
    }
}
