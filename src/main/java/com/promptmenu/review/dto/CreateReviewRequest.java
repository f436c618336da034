package com.promptmenu.review.dto;

import com.promptmenu.review.entity.ReviewMedia;
import com.promptmenu.review.entity.SubRatings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * 리뷰 작성 요청 DTO.
 *
 * <p>rating 범위(1~5)는 서비스에서 검사한다. 카운터(helpful_count 등), status, response는
 * 서버가 관리하므로 포함되면 역직렬화 단계에서 400으로 거절된다.</p>
 */
public record CreateReviewRequest(
        @NotBlank(message = "restaurant_id is required")
        String restaurantId,

        @NotNull(message = "rating is required")
        Integer rating,

        @NotBlank(message = "text is required")
        String text,

        String reviewNumber,
        String customerId,
        String orderId,
        String menuItemId,
        String staffId,
        String title,
        SubRatings subRatings,
        ReviewMedia media,
        List<String> tags
) {}
