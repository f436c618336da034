package com.promptmenu.review.dto;

import jakarta.validation.constraints.NotBlank;

public record ModerateReviewRequest(
        @NotBlank(message = "Status is required")
        String status,

        String moderationNotes
) {}
