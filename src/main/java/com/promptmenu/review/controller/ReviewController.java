package com.promptmenu.review.controller;

import com.promptmenu.common.dto.ApiResponse;
import com.promptmenu.common.security.CallerIdentity;
import com.promptmenu.common.util.Paging;
import com.promptmenu.review.dto.CreateReviewRequest;
import com.promptmenu.review.dto.FeatureReviewRequest;
import com.promptmenu.review.dto.FlagReviewRequest;
import com.promptmenu.review.dto.HelpfulRequest;
import com.promptmenu.review.dto.ModerateReviewRequest;
import com.promptmenu.review.dto.RespondReviewRequest;
import com.promptmenu.review.dto.ReviewPageResponse;
import com.promptmenu.review.dto.UpdateReviewRequest;
import com.promptmenu.review.entity.Review;
import com.promptmenu.review.repository.ReviewSearchCondition;
import com.promptmenu.review.repository.ReviewSort;
import com.promptmenu.review.service.ReviewService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

/**
 * 리뷰 REST API 컨트롤러.
 *
 * <p>helpful, flag, feature의 본문은 선택이며 없으면 기본값(helpful=true, 기본 신고 사유, featured=true)을 쓴다.</p>
 */
@RestController
@RequestMapping("/api/reviews")
@RequiredArgsConstructor
public class ReviewController {

    private final ReviewService reviewService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<Review> createReview(
            @RequestAttribute(CallerIdentity.ATTRIBUTE) CallerIdentity caller,
            @Valid @RequestBody CreateReviewRequest request) {
        return ApiResponse.ok("Review created successfully", reviewService.createReview(request, caller));
    }

    @GetMapping("/{id}")
    public ApiResponse<Review> getReview(@PathVariable String id) {
        return ApiResponse.ok(reviewService.getReview(id));
    }

    @GetMapping("/number/{reviewNumber}")
    public ApiResponse<Review> getReviewByNumber(@PathVariable String reviewNumber) {
        return ApiResponse.ok(reviewService.getReviewByNumber(reviewNumber));
    }

    /** 리뷰 목록 (가게별: 평점 범위, 정렬, 평점 분포 / 고객별 / 전체) */
    @GetMapping
    public ApiResponse<ReviewPageResponse> searchReviews(
            @RequestParam(name = "restaurant_id", required = false) String restaurantId,
            @RequestParam(name = "customer_id", required = false) String customerId,
            @RequestParam(name = "min_rating", required = false) Integer minRating,
            @RequestParam(name = "max_rating", required = false) Integer maxRating,
            @RequestParam(name = "sort_by", defaultValue = "date") String sortBy,
            @RequestParam(defaultValue = Paging.DEFAULT_PAGE) int page,
            @RequestParam(defaultValue = Paging.DEFAULT_LIMIT) int limit) {
        Paging.validate(page, limit);
        ReviewSearchCondition condition = ReviewSearchCondition.builder()
                .restaurantId(restaurantId)
                .customerId(customerId)
                .minRating(minRating)
                .maxRating(maxRating)
                .sort(ReviewSort.from(sortBy))
                .build();
        return ApiResponse.ok(reviewService.searchReviews(condition, page, limit));
    }

    @PutMapping("/{id}")
    public ApiResponse<Review> updateReview(
            @RequestAttribute(CallerIdentity.ATTRIBUTE) CallerIdentity caller,
            @PathVariable String id,
            @Valid @RequestBody UpdateReviewRequest request) {
        return ApiResponse.ok("Review updated successfully", reviewService.updateReview(id, request, caller));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> deleteReview(
            @RequestAttribute(CallerIdentity.ATTRIBUTE) CallerIdentity caller,
            @PathVariable String id) {
        boolean deleted = reviewService.deleteReview(id, caller);
        return ApiResponse.message(deleted ? "Review deleted successfully" : "Review was already marked as deleted");
    }

    @PutMapping("/{id}/respond")
    public ApiResponse<Review> respondToReview(
            @RequestAttribute(CallerIdentity.ATTRIBUTE) CallerIdentity caller,
            @PathVariable String id,
            @Valid @RequestBody RespondReviewRequest request) {
        Review review = reviewService.respondToReview(id, request.responseText(), request.authorTitle(), caller);
        return ApiResponse.ok("Response added successfully", review);
    }

    @PostMapping("/{id}/helpful")
    public ApiResponse<Review> markHelpful(
            @PathVariable String id,
            @RequestBody(required = false) HelpfulRequest request) {
        boolean helpful = request == null || request.isHelpful();
        return ApiResponse.ok("Review marked as " + (helpful ? "helpful" : "unhelpful"),
                reviewService.markHelpful(id, helpful));
    }

    @PostMapping("/{id}/flag")
    public ApiResponse<Review> flagReview(
            @PathVariable String id,
            @RequestBody(required = false) FlagReviewRequest request) {
        String reason = request != null ? request.flagReason() : null;
        return ApiResponse.ok("Review flagged successfully", reviewService.flagReview(id, reason));
    }

    @PutMapping("/{id}/moderate")
    public ApiResponse<Review> moderateReview(
            @RequestAttribute(CallerIdentity.ATTRIBUTE) CallerIdentity caller,
            @PathVariable String id,
            @Valid @RequestBody ModerateReviewRequest request) {
        Review review = reviewService.moderateReview(id, request.status(), request.moderationNotes(), caller);
        return ApiResponse.ok("Review moderated successfully. Status set to " + review.getStatus().value(), review);
    }

    @PutMapping("/{id}/feature")
    public ApiResponse<Review> featureReview(
            @RequestAttribute(CallerIdentity.ATTRIBUTE) CallerIdentity caller,
            @PathVariable String id,
            @RequestBody(required = false) FeatureReviewRequest request) {
        boolean featured = request == null || request.isFeatured();
        return ApiResponse.ok("Review " + (featured ? "featured" : "unfeatured") + " successfully",
                reviewService.featureReview(id, featured, caller));
    }
}
