package com.promptmenu.order.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 주문(Order) 문서 - 주문 도메인의 애그리거트 루트.
 *
 * <h3>역할</h3>
 * 한 가게에서의 한 건의 거래를 표현한다. 항목(OrderItem)과 금액 필드는 항상 함께 바뀐다:
 * 항목이 바뀌면 {@link #applyPricing}으로 subtotal, tax, tip, total이 다시 계산된 값으로 교체된다.
 *
 * <h3>설계 포인트</h3>
 * <ul>
 *   <li>@Version: 낙관적 락 - 상태 변경과 전체 수정이 경합하면 나중 쓰기가 실패한다 (409)</li>
 *   <li>삭제는 물리 삭제가 아니라 {@link #cancel}: status=cancelled, is_active=false</li>
 *   <li>상태마다 타임스탬프를 남긴다 (confirmed_at, ready_at 등)</li>
 * </ul>
 */
@Document(collection = "orders")
@CompoundIndex(name = "idx_order_restaurant_created", def = "{'restaurant_id': 1, 'created_at': -1}")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Order {

    @Id
    private String id;

    @Version
    private Long version;

    @Indexed(unique = true)
    private String orderNumber;

    private String restaurantId;

    // 비회원 주문이면 null
    @Indexed
    private String customerId;

    private String tableNumber;
    private String orderType;
    private OrderStatus status;

    private List<OrderItem> items = new ArrayList<>();

    private BigDecimal subtotal;
    private BigDecimal tax;
    private BigDecimal taxRate;
    private BigDecimal tip;
    private BigDecimal tipPercentage;
    private BigDecimal discount;
    private String discountCode;
    private BigDecimal serviceFee;
    private BigDecimal deliveryFee;
    private BigDecimal total;

    private String paymentStatus;
    private String paymentMethod;
    private DeliveryAddress deliveryAddress;

    private LocalDateTime confirmedAt;
    private LocalDateTime preparingAt;
    private LocalDateTime readyAt;
    private LocalDateTime deliveredAt;
    private LocalDateTime completedAt;
    private LocalDateTime cancelledAt;
    private LocalDateTime estimatedReadyTime;
    private LocalDateTime actualReadyTime;

    private String cancellationReason;
    private String cancelledBy;

    private String specialInstructions;
    private List<String> allergies = new ArrayList<>();
    private String notes;
    private String source;
    private List<String> tags = new ArrayList<>();

    @Field("is_active")
    @JsonProperty("is_active")
    private Boolean active;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private String createdBy;
    private String updatedBy;

    @Builder
    public Order(String orderNumber, String restaurantId, String customerId, String source,
                 OrderDetails details, String createdBy, LocalDateTime createdAt) {
        this.orderNumber = orderNumber;
        this.restaurantId = restaurantId;
        this.customerId = customerId;
        this.source = source == null ? "in-person" : source;
        this.status = OrderStatus.PENDING;
        this.orderType = "dine-in";
        this.paymentStatus = "unpaid";
        this.active = true;
        this.createdBy = createdBy;
        this.updatedBy = createdBy;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        if (details != null) {
            updateDetails(details);
        }
    }

    /** 가격 계산 결과로 항목과 금액 필드를 한 번에 교체한다. */
    public void applyPricing(PricedOrder priced) {
        this.items = new ArrayList<>(priced.items());
        this.subtotal = priced.subtotal();
        this.taxRate = priced.taxRate();
        this.tax = priced.tax();
        this.tipPercentage = priced.tipPercentage();
        this.tip = priced.tip();
        this.serviceFee = priced.serviceFee();
        this.deliveryFee = priced.deliveryFee();
        this.discount = priced.discount();
        this.total = priced.total();
    }

    public void updateDetails(OrderDetails details) {
        if (details.tableNumber() != null) this.tableNumber = details.tableNumber();
        if (details.orderType() != null) this.orderType = details.orderType();
        if (details.paymentStatus() != null) this.paymentStatus = details.paymentStatus();
        if (details.paymentMethod() != null) this.paymentMethod = details.paymentMethod();
        if (details.discountCode() != null) this.discountCode = details.discountCode();
        if (details.deliveryAddress() != null) this.deliveryAddress = details.deliveryAddress();
        if (details.specialInstructions() != null) this.specialInstructions = details.specialInstructions();
        if (details.allergies() != null) this.allergies = new ArrayList<>(details.allergies());
        if (details.estimatedReadyTime() != null) this.estimatedReadyTime = details.estimatedReadyTime();
        if (details.notes() != null) this.notes = details.notes();
        if (details.tags() != null) this.tags = new ArrayList<>(details.tags());
    }

    /**
     * 상태를 바꾸고 해당 상태의 타임스탬프를 기록한다.
     * ready는 ready_at과 actual_ready_time을 같은 시각으로 기록한다. pending은 추가 기록이 없다.
     */
    public void changeStatus(OrderStatus newStatus, LocalDateTime now, String actor) {
        this.status = newStatus;
        touch(now, actor);
        switch (newStatus) {
            case CONFIRMED -> this.confirmedAt = now;
            case PREPARING -> this.preparingAt = now;
            case READY -> {
                this.readyAt = now;
                this.actualReadyTime = now;
            }
            case DELIVERED -> this.deliveredAt = now;
            case COMPLETED -> this.completedAt = now;
            case CANCELLED -> this.cancelledAt = now;
            case PENDING -> {
            }
        }
    }

    /** 주문 취소(소프트 삭제). 이미 취소된 주문인지는 호출자가 {@link #isCancelled()}로 먼저 확인한다. */
    public void cancel(String reason, LocalDateTime now, String actor) {
        this.status = OrderStatus.CANCELLED;
        this.active = false;
        this.cancelledAt = now;
        this.cancelledBy = actor;
        this.cancellationReason = reason == null ? "" : reason;
        touch(now, actor);
    }

    @JsonIgnore
    public boolean isCancelled() {
        return status == OrderStatus.CANCELLED;
    }

    public void touch(LocalDateTime now, String actor) {
        this.updatedAt = now;
        this.updatedBy = actor;
    }
}
