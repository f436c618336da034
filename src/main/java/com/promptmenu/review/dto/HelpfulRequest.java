package com.promptmenu.review.dto;

/** helpful이 없거나 true면 helpful_count, false면 unhelpful_count를 올린다. */
public record HelpfulRequest(Boolean helpful) {

    public boolean isHelpful() {
        return helpful == null || helpful;
    }
}
