package com.promptmenu.review.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.LocalDateTime;

/**
 * 리뷰에 대한 가게 측 답변.
 *
 * @param edited 이전 답변 텍스트가 있는 상태에서 다시 답변했으면 true
 */
public record ReviewResponse(
        String text,
        String authorId,
        String authorTitle,
        LocalDateTime date,
        @Field("is_edited") @JsonProperty("is_edited") boolean edited
) {

    public static ReviewResponse empty() {
        return new ReviewResponse("", "", "", null, false);
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }
}
