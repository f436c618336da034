package com.promptmenu.order.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class OrderTest {

    private static final LocalDateTime CREATED = LocalDateTime.of(2024, 5, 1, 12, 0, 0);

    private Order newOrder() {
        return Order.builder()
                .orderNumber("ORD-20240501120000")
                .restaurantId("507f1f77bcf86cd799439011")
                .createdBy("alice")
                .createdAt(CREATED)
                .build();
    }

    @Test
    @DisplayName("새 주문의 기본값 - pending, unpaid, dine-in, 활성")
    void newOrder_Defaults() {
        Order order = newOrder();

        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getPaymentStatus()).isEqualTo("unpaid");
        assertThat(order.getOrderType()).isEqualTo("dine-in");
        assertThat(order.getSource()).isEqualTo("in-person");
        assertThat(order.getActive()).isTrue();
        assertThat(order.getUpdatedAt()).isEqualTo(CREATED);
    }

    @Test
    @DisplayName("ready 전환 - ready_at과 actual_ready_time을 같은 시각으로, 다른 타임스탬프는 그대로")
    void changeStatus_Ready_StampsBothFields() {
        Order order = newOrder();
        LocalDateTime now = CREATED.plusMinutes(20);

        order.changeStatus(OrderStatus.READY, now, "chef");

        assertThat(order.getStatus()).isEqualTo(OrderStatus.READY);
        assertThat(order.getReadyAt()).isEqualTo(now);
        assertThat(order.getActualReadyTime()).isEqualTo(now);
        assertThat(order.getConfirmedAt()).isNull();
        assertThat(order.getPreparingAt()).isNull();
        assertThat(order.getDeliveredAt()).isNull();
        assertThat(order.getCompletedAt()).isNull();
        assertThat(order.getCancelledAt()).isNull();
        assertThat(order.getUpdatedAt()).isEqualTo(now);
        assertThat(order.getUpdatedBy()).isEqualTo("chef");
    }

    @Test
    @DisplayName("상태 순서는 강제하지 않는다 - completed에서 confirmed로도 바꿀 수 있다")
    void changeStatus_NoAdjacencyCheck() {
        Order order = newOrder();
        order.changeStatus(OrderStatus.COMPLETED, CREATED.plusHours(1), "staff");

        order.changeStatus(OrderStatus.CONFIRMED, CREATED.plusHours(2), "staff");

        assertThat(order.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(order.getCompletedAt()).isEqualTo(CREATED.plusHours(1));
        assertThat(order.getConfirmedAt()).isEqualTo(CREATED.plusHours(2));
    }

    @Test
    @DisplayName("취소 - cancelled, 비활성, 사유 기본값은 빈 문자열")
    void cancel_SoftDeletes() {
        Order order = newOrder();
        LocalDateTime now = CREATED.plusMinutes(5);

        order.cancel(null, now, "alice");

        assertThat(order.isCancelled()).isTrue();
        assertThat(order.getActive()).isFalse();
        assertThat(order.getCancelledAt()).isEqualTo(now);
        assertThat(order.getCancelledBy()).isEqualTo("alice");
        assertThat(order.getCancellationReason()).isEmpty();
    }
}
