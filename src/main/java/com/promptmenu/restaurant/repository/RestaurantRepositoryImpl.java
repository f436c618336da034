package com.promptmenu.restaurant.repository;

import com.promptmenu.restaurant.entity.Restaurant;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * {@link RestaurantRepositoryCustom} 구현.
 *
 * <p>전체 문서 save가 아닌 대상 필드만 $set 하므로 가게 정보 수정과 경합해도
 * 다른 필드를 덮어쓰지 않는다. version을 함께 올려 오래된 전체 저장은 실패하게 한다.</p>
 */
@RequiredArgsConstructor
public class RestaurantRepositoryImpl implements RestaurantRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean updateRating(String restaurantId, BigDecimal avgRating, int reviewCount, LocalDateTime now) {
        Query query = new Query(Criteria.where("id").is(restaurantId));
        Update update = new Update()
                .set("avgRating", avgRating)
                .set("reviewCount", reviewCount)
                .set("updatedAt", now)
                .inc("version", 1);
        return mongoTemplate.updateFirst(query, update, Restaurant.class).getMatchedCount() > 0;
    }
}
