package com.promptmenu.order.dto;

/** 주문 취소 요청 본문 (선택). */
public record CancelOrderRequest(String cancellationReason) {}
