package com.promptmenu.order.repository;

import com.promptmenu.order.entity.Order;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface OrderRepositoryCustom {

    /** 조건에 맞는 주문을 created_at 내림차순으로 조회한다. */
    Page<Order> search(OrderSearchCondition condition, Pageable pageable);
}
