package com.promptmenu.order.service;

import com.promptmenu.order.entity.Order;
import com.promptmenu.order.entity.OrderItem;
import com.promptmenu.order.entity.PricedOrder;
import lombok.Builder;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 주문 금액 계산기 (순수 계산, 저장소 접근 없음).
 *
 * <h3>계산 규칙</h3>
 * <pre>
 * item.subtotal = (unit_price + 옵션 가격 합) * quantity
 * subtotal      = sum(item.subtotal)
 * tax           = tax_rate > 0 ? round(subtotal * tax_rate, 2) : (요청 tax 또는 0)
 * tip           = tip_percentage > 0 && 요청 tip 없음 ? round(subtotal * tip_percentage, 2) : (요청 tip 또는 0)
 * total         = subtotal + tax + tip + service_fee + delivery_fee - discount
 * </pre>
 *
 * <p>total은 0 미만이어도 잘라내지 않는다 (할인이 금액보다 큰 경우).</p>
 */
@Component
public class OrderPricingCalculator {

    private static final int MONEY_SCALE = 2;

    /**
     * 금액 계산 입력. null은 "값 없음"을 뜻한다.
     */
    @Builder
    public record PricingInput(
            List<OrderItem> items,
            BigDecimal taxRate,
            BigDecimal tipPercentage,
            BigDecimal tax,
            BigDecimal tip,
            BigDecimal serviceFee,
            BigDecimal deliveryFee,
            BigDecimal discount
    ) {
    }

    public PricedOrder price(PricingInput input) {
        List<OrderItem> items = input.items() == null ? List.of() : input.items();
        BigDecimal subtotal = items.stream()
                .map(OrderItem::applySubtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal taxRate = orZero(input.taxRate());
        BigDecimal tipPercentage = orZero(input.tipPercentage());

        BigDecimal tax = isPositive(taxRate)
                ? round(subtotal.multiply(taxRate))
                : orZero(input.tax());

        BigDecimal tip = isPositive(tipPercentage) && input.tip() == null
                ? round(subtotal.multiply(tipPercentage))
                : orZero(input.tip());

        BigDecimal serviceFee = orZero(input.serviceFee());
        BigDecimal deliveryFee = orZero(input.deliveryFee());
        BigDecimal discount = orZero(input.discount());

        BigDecimal total = subtotal.add(tax).add(tip)
                .add(serviceFee).add(deliveryFee)
                .subtract(discount);

        return new PricedOrder(items, subtotal, taxRate, tax, tipPercentage, tip,
                serviceFee, deliveryFee, discount, total);
    }

    /**
     * 수정 요청으로 다시 계산한다. 요청에 없는 값은 저장된 주문 값을 쓴다.
     * tip은 유효 tip_percentage가 0일 때만 저장된 값으로 대체된다 (양수면 다시 유도).
     * 요청에 items가 없으면 저장된 항목으로 계산한다.
     */
    public PricedOrder recalculate(Order existing, PricingInput patch) {
        BigDecimal tipPercentage = firstNonNull(patch.tipPercentage(), existing.getTipPercentage());
        BigDecimal tip = patch.tip();
        if (tip == null && !isPositive(orZero(tipPercentage))) {
            tip = existing.getTip();
        }

        return price(PricingInput.builder()
                .items(patch.items() != null ? patch.items() : existing.getItems())
                .taxRate(firstNonNull(patch.taxRate(), existing.getTaxRate()))
                .tipPercentage(tipPercentage)
                .tax(firstNonNull(patch.tax(), existing.getTax()))
                .tip(tip)
                .serviceFee(firstNonNull(patch.serviceFee(), existing.getServiceFee()))
                .deliveryFee(firstNonNull(patch.deliveryFee(), existing.getDeliveryFee()))
                .discount(firstNonNull(patch.discount(), existing.getDiscount()))
                .build());
    }

    private static BigDecimal round(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private static boolean isPositive(BigDecimal value) {
        return value.signum() > 0;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private static BigDecimal firstNonNull(BigDecimal preferred, BigDecimal fallback) {
        return preferred != null ? preferred : fallback;
    }
}
