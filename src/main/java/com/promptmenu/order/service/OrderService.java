package com.promptmenu.order.service;

import com.promptmenu.common.exception.BusinessException;
import com.promptmenu.common.exception.ErrorCode;
import com.promptmenu.common.security.CallerIdentity;
import com.promptmenu.common.util.ObjectIds;
import com.promptmenu.order.dto.CreateOrderRequest;
import com.promptmenu.order.dto.UpdateOrderRequest;
import com.promptmenu.order.entity.Order;
import com.promptmenu.order.entity.OrderStatus;
import com.promptmenu.order.entity.PricedOrder;
import com.promptmenu.order.repository.OrderRepository;
import com.promptmenu.order.repository.OrderSearchCondition;
import com.promptmenu.restaurant.service.RestaurantService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * 주문 서비스 - 생성, 조회, 수정, 상태 전환, 취소.
 *
 * <h3>동시성</h3>
 * 트랜잭션 없이 읽기-계산-쓰기를 수행한다. Order의 @Version 덕분에 같은 주문을 동시에 수정하면
 * 나중 save()가 OptimisticLockingFailureException으로 실패하고 409로 응답된다.
 *
 * <h3>권한</h3>
 * <ul>
 *   <li>수정, 취소: 관리자, 주문한 고객, 가게 소유자</li>
 *   <li>상태 전환: 관리자, 가게 소유자</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

    private static final DateTimeFormatter NUMBER_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final OrderRepository orderRepository;
    private final OrderPricingCalculator pricingCalculator;
    private final RestaurantService restaurantService;
    private final Clock clock;

    /**
     * 주문 생성. 금액은 항목으로부터 계산되며, 주문 번호가 없으면 ORD-yyyyMMddHHmmss로 만든다.
     */
    public Order createOrder(CreateOrderRequest request, CallerIdentity caller) {
        ObjectIds.requireValid(request.restaurantId(), "restaurant");
        LocalDateTime now = LocalDateTime.now(clock);

        Order order = Order.builder()
                .orderNumber(request.orderNumber() != null ? request.orderNumber() : generateOrderNumber(now))
                .restaurantId(request.restaurantId())
                .customerId(request.customerId())
                .source(request.source())
                .details(request.toDetails())
                .createdBy(caller.preferredUsername())
                .createdAt(now)
                .build();

        PricedOrder priced = pricingCalculator.price(request.toPricingInput());
        order.applyPricing(priced);

        order = orderRepository.save(order);
        log.info("Order created: orderId={}, orderNumber={}, total={}",
                order.getId(), order.getOrderNumber(), order.getTotal());
        return order;
    }

    public Order getOrder(String orderId) {
        ObjectIds.requireValid(orderId, "order");
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
    }

    public Order getOrderByNumber(String orderNumber) {
        return orderRepository.findByOrderNumber(orderNumber)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
    }

    /** page는 1부터 시작한다. 결과는 created_at 내림차순. */
    public Page<Order> searchOrders(OrderSearchCondition condition, int page, int limit) {
        return orderRepository.search(condition, PageRequest.of(page - 1, limit));
    }

    /**
     * 허용된 필드만 수정한다. items나 금액 입력이 포함되면 금액을 다시 계산하고,
     * 요청에 없는 금액 입력은 저장된 값을 사용한다.
     */
    public Order updateOrder(String orderId, UpdateOrderRequest request, CallerIdentity caller) {
        Order order = getOrder(orderId);
        requireOrderParticipant(order, caller);

        order.updateDetails(request.toDetails());
        if (request.affectsPricing()) {
            order.applyPricing(pricingCalculator.recalculate(order, request.toPricingInput()));
        }
        order.touch(LocalDateTime.now(clock), caller.preferredUsername());

        order = orderRepository.save(order);
        log.info("Order updated: orderId={}, total={}", order.getId(), order.getTotal());
        return order;
    }

    /**
     * 상태 전환. 상태 간 순서는 검사하지 않으며 해당 상태의 타임스탬프를 기록한다.
     */
    public Order changeStatus(String orderId, String status, CallerIdentity caller) {
        OrderStatus newStatus = OrderStatus.from(status);
        Order order = getOrder(orderId);
        if (!caller.isAdmin() && !restaurantService.isOwner(order.getRestaurantId(), caller)) {
            throw new BusinessException(ErrorCode.FORBIDDEN,
                    "Unauthorized. Only restaurant staff or admins can update order status");
        }

        OrderStatus previous = order.getStatus();
        order.changeStatus(newStatus, LocalDateTime.now(clock), caller.preferredUsername());

        order = orderRepository.save(order);
        log.info("Order status changed: orderId={}, {} -> {}", order.getId(), previous, newStatus);
        return order;
    }

    /**
     * 주문 취소 (소프트 삭제). 이미 취소된 주문이면 아무것도 바꾸지 않는다.
     */
    public CancelResult cancelOrder(String orderId, String reason, CallerIdentity caller) {
        Order order = getOrder(orderId);
        requireOrderParticipant(order, caller);

        if (order.isCancelled()) {
            log.info("Order already cancelled: orderId={}", orderId);
            return new CancelResult(order, true);
        }

        order.cancel(reason, LocalDateTime.now(clock), caller.preferredUsername());
        order = orderRepository.save(order);
        log.info("Order cancelled: orderId={}, by={}", order.getId(), caller.preferredUsername());
        return new CancelResult(order, false);
    }

    private void requireOrderParticipant(Order order, CallerIdentity caller) {
        if (caller.isAdmin()
                || caller.isSubject(order.getCustomerId())
                || restaurantService.isOwner(order.getRestaurantId(), caller)) {
            return;
        }
        throw new BusinessException(ErrorCode.FORBIDDEN);
    }

    // 같은 초에 생성된 주문이 있으면 -2, -3 ... 접미사를 붙인다. 경합은 유니크 인덱스가 막는다.
    private String generateOrderNumber(LocalDateTime now) {
        String base = "ORD-" + now.format(NUMBER_FORMAT);
        String candidate = base;
        int suffix = 2;
        while (orderRepository.existsByOrderNumber(candidate)) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }

    /**
     * @param alreadyCancelled true면 이번 요청으로 바뀐 것이 없다
     */
    public record CancelResult(Order order, boolean alreadyCancelled) {}
}
