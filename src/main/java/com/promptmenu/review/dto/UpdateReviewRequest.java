package com.promptmenu.review.dto;

import com.promptmenu.review.entity.ReviewMedia;
import com.promptmenu.review.entity.SubRatings;

import java.util.List;

/**
 * 리뷰 수정 요청 (허용 목록). 그 밖의 필드는 모두 거절된다.
 */
public record UpdateReviewRequest(
        String title,
        String text,
        Integer rating,
        SubRatings subRatings,
        ReviewMedia media,
        List<String> tags
) {}
