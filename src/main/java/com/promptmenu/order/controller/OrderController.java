package com.promptmenu.order.controller;

import com.promptmenu.common.dto.ApiResponse;
import com.promptmenu.common.dto.PageResponse;
import com.promptmenu.common.security.CallerIdentity;
import com.promptmenu.common.util.Paging;
import com.promptmenu.order.dto.CancelOrderRequest;
import com.promptmenu.order.dto.CreateOrderRequest;
import com.promptmenu.order.dto.StatusChangeRequest;
import com.promptmenu.order.dto.UpdateOrderRequest;
import com.promptmenu.order.entity.Order;
import com.promptmenu.order.entity.OrderStatus;
import com.promptmenu.order.repository.OrderSearchCondition;
import com.promptmenu.order.service.OrderService;
import com.promptmenu.order.service.OrderService.CancelResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;

/**
 * 주문 REST API 컨트롤러.
 *
 * <p>모든 경로는 {@code AuthenticationInterceptor}를 거치며, 검증된 호출자는
 * 요청 속성 {@link CallerIdentity#ATTRIBUTE}로 전달된다.</p>
 */
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<Order> createOrder(
            @RequestAttribute(CallerIdentity.ATTRIBUTE) CallerIdentity caller,
            @Valid @RequestBody CreateOrderRequest request) {
        return ApiResponse.ok("Order created successfully", orderService.createOrder(request, caller));
    }

    @GetMapping("/{id}")
    public ApiResponse<Order> getOrder(@PathVariable String id) {
        return ApiResponse.ok(orderService.getOrder(id));
    }

    @GetMapping("/number/{orderNumber}")
    public ApiResponse<Order> getOrderByNumber(@PathVariable String orderNumber) {
        return ApiResponse.ok(orderService.getOrderByNumber(orderNumber));
    }

    /** 주문 목록 (customer_id, restaurant_id, status, 기간 필터 + 페이지) */
    @GetMapping
    public ApiResponse<PageResponse<Order>> searchOrders(
            @RequestParam(name = "customer_id", required = false) String customerId,
            @RequestParam(name = "restaurant_id", required = false) String restaurantId,
            @RequestParam(required = false) String status,
            @RequestParam(name = "start_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startDate,
            @RequestParam(name = "end_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endDate,
            @RequestParam(defaultValue = Paging.DEFAULT_PAGE) int page,
            @RequestParam(defaultValue = Paging.DEFAULT_LIMIT) int limit) {
        Paging.validate(page, limit);
        OrderSearchCondition condition = OrderSearchCondition.builder()
                .customerId(customerId)
                .restaurantId(restaurantId)
                .status(status != null ? OrderStatus.from(status) : null)
                .startDate(startDate)
                .endDate(endDate)
                .build();
        return ApiResponse.ok(PageResponse.from(orderService.searchOrders(condition, page, limit)));
    }

    @PutMapping("/{id}")
    public ApiResponse<Order> updateOrder(
            @RequestAttribute(CallerIdentity.ATTRIBUTE) CallerIdentity caller,
            @PathVariable String id,
            @Valid @RequestBody UpdateOrderRequest request) {
        return ApiResponse.ok("Order updated successfully", orderService.updateOrder(id, request, caller));
    }

    @PutMapping("/{id}/status")
    public ApiResponse<Order> changeStatus(
            @RequestAttribute(CallerIdentity.ATTRIBUTE) CallerIdentity caller,
            @PathVariable String id,
            @Valid @RequestBody StatusChangeRequest request) {
        Order order = orderService.changeStatus(id, request.status(), caller);
        return ApiResponse.ok("Order status updated to " + order.getStatus().value() + " successfully", order);
    }

    /** 주문 취소. 본문은 선택이며 cancellation_reason만 받는다. */
    @DeleteMapping("/{id}")
    public ApiResponse<Order> cancelOrder(
            @RequestAttribute(CallerIdentity.ATTRIBUTE) CallerIdentity caller,
            @PathVariable String id,
            @RequestBody(required = false) CancelOrderRequest request) {
        String reason = request != null ? request.cancellationReason() : null;
        CancelResult result = orderService.cancelOrder(id, reason, caller);
        if (result.alreadyCancelled()) {
            return ApiResponse.message("Order is already cancelled");
        }
        return ApiResponse.ok("Order cancelled successfully", result.order());
    }
}
