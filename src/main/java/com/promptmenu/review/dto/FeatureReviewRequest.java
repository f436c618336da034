package com.promptmenu.review.dto;

/** featured가 없으면 true(추천 지정)로 처리한다. */
public record FeatureReviewRequest(Boolean featured) {

    public boolean isFeatured() {
        return featured == null || featured;
    }
}
