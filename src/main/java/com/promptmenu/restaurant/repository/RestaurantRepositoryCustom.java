package com.promptmenu.restaurant.repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public interface RestaurantRepositoryCustom {

    /**
     * 평점 캐시만 부분 갱신한다 ($set avg_rating, review_count, updated_at + $inc version).
     *
     * @return 갱신된 문서가 있으면 true (가게가 없으면 false)
     */
    boolean updateRating(String restaurantId, BigDecimal avgRating, int reviewCount, LocalDateTime now);
}
