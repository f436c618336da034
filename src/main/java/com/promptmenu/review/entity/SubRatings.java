package com.promptmenu.review.entity;

/**
 * 항목별 세부 평점. 입력하지 않은 항목은 0.
 */
public record SubRatings(int food, int service, int ambiance, int value, int cleanliness) {

    public static SubRatings empty() {
        return new SubRatings(0, 0, 0, 0, 0);
    }
}
