package com.promptmenu.review.repository;

/**
 * 리뷰 목록 정렬 기준 (모두 내림차순). 알 수 없는 값은 date로 처리한다.
 */
public enum ReviewSort {
    DATE("date"),
    HELPFUL("helpfulCount");

    private final String property;

    ReviewSort(String property) {
        this.property = property;
    }

    public String property() {
        return property;
    }

    public static ReviewSort from(String value) {
        return "helpful".equals(value) ? HELPFUL : DATE;
    }
}
