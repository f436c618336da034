package com.promptmenu.review.service;

import com.promptmenu.common.config.CacheConfig;
import com.promptmenu.restaurant.repository.RestaurantRepository;
import com.promptmenu.review.repository.ReviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 가게 평점 집계 서비스.
 *
 * <h3>집계 규칙</h3>
 * <pre>
 * 대상        = restaurant_id 일치 AND is_active = true AND status = published
 * avg_rating   = round(평균, 1)  (대상이 없으면 0)
 * review_count = 대상 개수
 * </pre>
 *
 * <p>매번 현재 리뷰 전체로 다시 계산하므로 몇 번을 호출해도 결과가 같다.
 * 저장 후 restaurants 캐시의 해당 키를 비운다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RestaurantRatingService {

    private final ReviewRepository reviewRepository;
    private final RestaurantRepository restaurantRepository;
    private final Clock clock;

    @CacheEvict(value = CacheConfig.RESTAURANTS, key = "#restaurantId")
    public RatingSummary recompute(String restaurantId) {
        List<Integer> ratings = reviewRepository.findPublishedRatings(restaurantId);
        RatingSummary summary = RatingSummary.of(ratings);

        boolean updated = restaurantRepository.updateRating(
                restaurantId, summary.avgRating(), summary.reviewCount(), LocalDateTime.now(clock));
        if (!updated) {
            log.warn("Rating not stored, restaurant missing: restaurantId={}", restaurantId);
        } else {
            log.info("Restaurant rating recomputed: restaurantId={}, avgRating={}, reviewCount={}",
                    restaurantId, summary.avgRating(), summary.reviewCount());
        }
        return summary;
    }

    public record RatingSummary(BigDecimal avgRating, int reviewCount) {

        static RatingSummary of(List<Integer> ratings) {
            if (ratings.isEmpty()) {
                return new RatingSummary(BigDecimal.ZERO, 0);
            }
            int sum = ratings.stream().mapToInt(Integer::intValue).sum();
            BigDecimal average = BigDecimal.valueOf(sum)
                    .divide(BigDecimal.valueOf(ratings.size()), 1, RoundingMode.HALF_UP);
            return new RatingSummary(average, ratings.size());
        }
    }
}
