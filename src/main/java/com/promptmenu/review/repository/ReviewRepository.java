package com.promptmenu.review.repository;

import com.promptmenu.review.entity.Review;
import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * 리뷰 저장소.
 *
 * <p>전체 문서 save()는 @Version 낙관적 락을 따르고, 카운터와 신고는
 * {@link ReviewRepositoryCustom}의 원자적 연산으로만 갱신한다.</p>
 */
public interface ReviewRepository extends MongoRepository<Review, String>, ReviewRepositoryCustom {

    boolean existsByReviewNumber(String reviewNumber);
}
