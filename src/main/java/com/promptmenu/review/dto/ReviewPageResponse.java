package com.promptmenu.review.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.promptmenu.review.entity.Review;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.Map;

/**
 * 리뷰 목록 응답. 가게별 조회일 때만 rating_distribution({"1": n, ..., "5": n})이 포함된다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReviewPageResponse(
        List<Review> items,
        int count,
        long totalCount,
        int page,
        int totalPages,
        Map<String, Long> ratingDistribution
) {

    public static ReviewPageResponse from(Page<Review> page, Map<String, Long> ratingDistribution) {
        return new ReviewPageResponse(
                page.getContent(),
                page.getNumberOfElements(),
                page.getTotalElements(),
                page.getNumber() + 1,
                page.getTotalPages(),
                ratingDistribution);
    }
}
