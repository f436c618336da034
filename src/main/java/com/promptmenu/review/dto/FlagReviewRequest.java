package com.promptmenu.review.dto;

public record FlagReviewRequest(String flagReason) {}
