package com.promptmenu.review.repository;

import com.promptmenu.review.entity.Review;
import com.promptmenu.review.entity.ReviewStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.data.support.PageableExecutionUtils;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ReviewRepositoryCustom} 구현.
 *
 * <p>조회 후 갱신(read-modify-write) 대신 findAndModify 한 번으로 증가와 조회를 함께 처리한다.
 * 같은 리뷰에 동시에 신고가 들어와도 flag_count는 정확히 요청 수만큼 증가한다.</p>
 */
@RequiredArgsConstructor
public class ReviewRepositoryImpl implements ReviewRepositoryCustom {

    private static final FindAndModifyOptions RETURN_NEW = FindAndModifyOptions.options().returnNew(true);

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<Review> incrementViewCountById(String id) {
        Query query = new Query(Criteria.where("id").is(id).and("active").is(true));
        return increment(query, "viewCount");
    }

    @Override
    public Optional<Review> incrementViewCountByNumber(String reviewNumber) {
        Query query = new Query(Criteria.where("reviewNumber").is(reviewNumber).and("active").is(true));
        return increment(query, "viewCount");
    }

    @Override
    public Optional<Review> incrementHelpfulness(String id, boolean helpful) {
        Query query = new Query(Criteria.where("id").is(id));
        return increment(query, helpful ? "helpfulCount" : "unhelpfulCount");
    }

    @Override
    public Optional<Review> addFlag(String id, String reason, LocalDateTime now) {
        Query query = new Query(Criteria.where("id").is(id));
        Update update = new Update()
                .addToSet("flaggedReason", reason)
                .inc("flagCount", 1)
                .inc("version", 1)
                .set("updatedAt", now);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update, RETURN_NEW, Review.class));
    }

    @Override
    public boolean escalateToUnderReview(String id, LocalDateTime now) {
        Query query = new Query(Criteria.where("id").is(id)
                .and("status").is(ReviewStatus.PUBLISHED.value()));
        Update update = new Update()
                .set("status", ReviewStatus.UNDER_REVIEW.value())
                .set("featured", false)
                .set("updatedAt", now)
                .inc("version", 1);
        return mongoTemplate.updateFirst(query, update, Review.class).getModifiedCount() > 0;
    }

    @Override
    public List<Integer> findPublishedRatings(String restaurantId) {
        Query query = new Query(publishedCriteria().and("restaurantId").is(restaurantId));
        query.fields().include("rating");
        return mongoTemplate.find(query, Review.class).stream()
                .map(Review::getRating)
                .toList();
    }

    @Override
    public Map<String, Long> countByRating(String restaurantId) {
        Map<String, Long> distribution = new LinkedHashMap<>();
        for (int rating = 1; rating <= 5; rating++) {
            Query query = new Query(publishedCriteria()
                    .and("restaurantId").is(restaurantId)
                    .and("rating").is(rating));
            distribution.put(String.valueOf(rating), mongoTemplate.count(query, Review.class));
        }
        return distribution;
    }

    @Override
    public Page<Review> search(ReviewSearchCondition condition, Pageable pageable) {
        Criteria criteria = publishedCriteria();
        if (condition.restaurantId() != null) {
            criteria.and("restaurantId").is(condition.restaurantId());
        }
        if (condition.customerId() != null) {
            criteria.and("customerId").is(condition.customerId());
        }
        if (condition.minRating() != null || condition.maxRating() != null) {
            Criteria rating = criteria.and("rating");
            if (condition.minRating() != null) {
                rating.gte(condition.minRating());
            }
            if (condition.maxRating() != null) {
                rating.lte(condition.maxRating());
            }
        }

        Query query = new Query(criteria);
        long total = mongoTemplate.count(query, Review.class);

        query.with(pageable).with(Sort.by(Sort.Direction.DESC, condition.sortOrDefault().property()));
        List<Review> reviews = mongoTemplate.find(query, Review.class);

        return PageableExecutionUtils.getPage(reviews, pageable, () -> total);
    }

    private Optional<Review> increment(Query query, String counter) {
        Update update = new Update().inc(counter, 1).inc("version", 1);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update, RETURN_NEW, Review.class));
    }

    private Criteria publishedCriteria() {
        return Criteria.where("active").is(true)
                .and("status").is(ReviewStatus.PUBLISHED.value());
    }
}
