package com.promptmenu.review.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import com.promptmenu.common.exception.BusinessException;
import com.promptmenu.common.exception.ErrorCode;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 리뷰 상태.
 *
 * <pre>
 * published ──(신고 누적)──→ under_review
 *     ↕ (관리자 중재: published / hidden / deleted)
 * hidden, deleted
 * </pre>
 *
 * <p>평점 집계에는 published이면서 is_active=true인 리뷰만 포함된다.</p>
 */
public enum ReviewStatus {
    DRAFT("draft"),
    PUBLISHED("published"),
    HIDDEN("hidden"),
    DELETED("deleted"),
    UNDER_REVIEW("under_review");

    /** 관리자 중재로 지정할 수 있는 상태 */
    public static final Set<ReviewStatus> MODERATION_TARGETS = EnumSet.of(PUBLISHED, HIDDEN, DELETED);

    private final String value;

    ReviewStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static ReviewStatus from(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_REVIEW_STATUS,
                        "Invalid status: " + value));
    }

    public static ReviewStatus moderationTarget(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value) && MODERATION_TARGETS.contains(status))
                .findFirst()
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_REVIEW_STATUS,
                        "Invalid status. Must be one of: " + MODERATION_TARGETS.stream()
                                .map(ReviewStatus::value)
                                .collect(Collectors.joining(", "))));
    }
}
