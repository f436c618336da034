package com.promptmenu.review.repository;

import com.promptmenu.review.entity.Review;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MongoTemplate 기반 원자적 갱신과 조건 검색.
 *
 * <p>모든 갱신은 version도 1 올린다. 카운터가 바뀐 뒤 이전 버전으로 전체 문서를 저장하면
 * 낙관적 락 충돌이 나므로 카운터 값이 덮어써지지 않는다.</p>
 */
public interface ReviewRepositoryCustom {

    /** 활성 리뷰의 view_count를 1 올리고 갱신된 문서를 반환한다. */
    Optional<Review> incrementViewCountById(String id);

    Optional<Review> incrementViewCountByNumber(String reviewNumber);

    /** helpful이면 helpful_count, 아니면 unhelpful_count를 1 올린다. */
    Optional<Review> incrementHelpfulness(String id, boolean helpful);

    /**
     * flagged_reason에 사유를 (중복 없이) 추가하고 flag_count를 1 올린다 ($addToSet + $inc).
     */
    Optional<Review> addFlag(String id, String reason, LocalDateTime now);

    /**
     * 아직 published인 경우에만 under_review로 바꾸고 추천을 해제한다.
     *
     * @return 상태가 바뀌었으면 true
     */
    boolean escalateToUnderReview(String id, LocalDateTime now);

    /** 가게의 집계 대상(published, 활성) 리뷰 평점 목록 */
    List<Integer> findPublishedRatings(String restaurantId);

    /** 가게의 집계 대상 리뷰를 평점별로 센다. 키는 "1" ~ "5". */
    Map<String, Long> countByRating(String restaurantId);

    Page<Review> search(ReviewSearchCondition condition, Pageable pageable);
}
