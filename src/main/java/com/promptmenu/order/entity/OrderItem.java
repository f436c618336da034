package com.promptmenu.order.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 주문 항목 (orders 문서에 내장).
 *
 * <p>subtotal은 항상 파생값이다: {@code (unitPrice + 옵션 가격 합) * quantity}.
 * 호출자가 보낸 subtotal은 받지 않고 {@link #applySubtotal()}로만 채워진다.</p>
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItem {

    private String itemId;
    private String name;
    private int quantity;
    private BigDecimal unitPrice;
    private List<Customization> customizations = new ArrayList<>();
    private String specialInstructions;
    private BigDecimal subtotal;

    @Builder
    public OrderItem(String itemId, String name, Integer quantity, BigDecimal unitPrice,
                     List<Customization> customizations, String specialInstructions) {
        this.itemId = itemId;
        this.name = name;
        this.quantity = quantity == null ? 1 : quantity;
        this.unitPrice = unitPrice == null ? BigDecimal.ZERO : unitPrice;
        this.customizations = customizations == null ? new ArrayList<>() : new ArrayList<>(customizations);
        this.specialInstructions = specialInstructions;
        this.subtotal = BigDecimal.ZERO;
    }

    @JsonIgnore
    public BigDecimal getCustomizationTotal() {
        return customizations.stream()
                .map(Customization::price)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /** 항목 소계를 다시 계산해 저장하고 그 값을 반환한다. */
    public BigDecimal applySubtotal() {
        this.subtotal = unitPrice.add(getCustomizationTotal())
                .multiply(BigDecimal.valueOf(quantity));
        return subtotal;
    }
}
