package com.promptmenu.order.repository;

import com.promptmenu.order.entity.Order;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.support.PageableExecutionUtils;

import java.util.List;

/**
 * {@link OrderRepositoryCustom} 구현 - MongoTemplate으로 동적 조건 쿼리를 만든다.
 */
@RequiredArgsConstructor
public class OrderRepositoryImpl implements OrderRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Page<Order> search(OrderSearchCondition condition, Pageable pageable) {
        Query query = new Query(toCriteria(condition));

        long total = mongoTemplate.count(query, Order.class);

        query.with(pageable).with(Sort.by(Sort.Direction.DESC, "createdAt"));
        List<Order> orders = mongoTemplate.find(query, Order.class);

        return PageableExecutionUtils.getPage(orders, pageable, () -> total);
    }

    private Criteria toCriteria(OrderSearchCondition condition) {
        Criteria criteria = new Criteria();
        if (condition.customerId() != null) {
            criteria.and("customerId").is(condition.customerId());
        }
        if (condition.restaurantId() != null) {
            criteria.and("restaurantId").is(condition.restaurantId());
        }
        if (condition.status() != null) {
            criteria.and("status").is(condition.status().value());
        }
        if (condition.startDate() != null || condition.endDate() != null) {
            Criteria createdAt = criteria.and("createdAt");
            if (condition.startDate() != null) {
                createdAt.gte(condition.startDate());
            }
            if (condition.endDate() != null) {
                createdAt.lte(condition.endDate());
            }
        }
        return criteria;
    }
}
