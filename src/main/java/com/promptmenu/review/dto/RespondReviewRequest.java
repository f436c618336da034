package com.promptmenu.review.dto;

import jakarta.validation.constraints.NotBlank;

public record RespondReviewRequest(
        @NotBlank(message = "Response text is required")
        String responseText,

        String authorTitle
) {}
