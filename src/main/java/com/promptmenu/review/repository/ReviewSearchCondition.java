package com.promptmenu.review.repository;

import lombok.Builder;

/**
 * 리뷰 목록 검색 조건. 항상 status=published, is_active=true인 리뷰만 조회한다.
 */
@Builder
public record ReviewSearchCondition(
        String restaurantId,
        String customerId,
        Integer minRating,
        Integer maxRating,
        ReviewSort sort
) {

    public ReviewSort sortOrDefault() {
        return sort == null ? ReviewSort.DATE : sort;
    }
}
