package com.promptmenu.order.repository;

import com.promptmenu.order.entity.Order;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * 주문 저장소.
 *
 * <p>기본 CRUD는 {@link MongoRepository}가, 조건 검색은 {@link OrderRepositoryCustom}이 제공한다.
 * save()는 @Version을 검사하므로 오래된 문서로 저장하면 OptimisticLockingFailureException이 발생한다.</p>
 */
public interface OrderRepository extends MongoRepository<Order, String>, OrderRepositoryCustom {

    Optional<Order> findByOrderNumber(String orderNumber);

    boolean existsByOrderNumber(String orderNumber);
}
