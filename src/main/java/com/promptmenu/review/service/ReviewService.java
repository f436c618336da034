package com.promptmenu.review.service;

import com.promptmenu.common.config.PromptMenuProperties;
import com.promptmenu.common.exception.BusinessException;
import com.promptmenu.common.exception.ErrorCode;
import com.promptmenu.common.security.CallerIdentity;
import com.promptmenu.common.util.ObjectIds;
import com.promptmenu.restaurant.service.RestaurantService;
import com.promptmenu.review.dto.CreateReviewRequest;
import com.promptmenu.review.dto.ReviewPageResponse;
import com.promptmenu.review.dto.UpdateReviewRequest;
import com.promptmenu.review.entity.Review;
import com.promptmenu.review.entity.ReviewStatus;
import com.promptmenu.review.repository.ReviewRepository;
import com.promptmenu.review.repository.ReviewSearchCondition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * 리뷰 서비스 - 작성, 조회, 수정, 삭제와 신고/중재/답변/추천.
 *
 * <h3>평점 재계산</h3>
 * 집계 대상(published, 활성)이 바뀔 수 있는 작업 뒤에는 {@link RestaurantRatingService#recompute}를 호출한다:
 * 작성, rating이 바뀐 수정, 삭제, 상태가 바뀐 중재, 신고 누적으로 인한 under_review 전환.
 * 재계산 실패는 경고 로그만 남기고 이미 저장된 리뷰 변경은 되돌리지 않는다.
 *
 * <h3>권한</h3>
 * <ul>
 *   <li>수정: 작성자, 관리자</li>
 *   <li>삭제: 작성자, 가게 소유자, 관리자</li>
 *   <li>답변, 추천: 가게 소유자, 관리자</li>
 *   <li>중재: 관리자</li>
 *   <li>도움됨 표시, 신고: 인증된 누구나</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewService {

    private static final DateTimeFormatter NUMBER_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final String DEFAULT_FLAG_REASON = "Inappropriate content";
    private static final String DEFAULT_AUTHOR_TITLE = "Restaurant Representative";

    private final ReviewRepository reviewRepository;
    private final RestaurantService restaurantService;
    private final RestaurantRatingService ratingService;
    private final PromptMenuProperties properties;
    private final Clock clock;

    public Review createReview(CreateReviewRequest request, CallerIdentity caller) {
        validateRating(request.rating());
        ObjectIds.requireValid(request.restaurantId(), "restaurant");
        if (!restaurantService.exists(request.restaurantId())) {
            throw new BusinessException(ErrorCode.RESTAURANT_NOT_FOUND);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Review review = Review.builder()
                .reviewNumber(request.reviewNumber() != null ? request.reviewNumber() : generateReviewNumber(now))
                .restaurantId(request.restaurantId())
                .customerId(request.customerId() != null ? request.customerId() : caller.subjectId())
                .orderId(request.orderId())
                .menuItemId(request.menuItemId())
                .staffId(request.staffId())
                .title(request.title())
                .text(request.text())
                .rating(request.rating())
                .subRatings(request.subRatings())
                .media(request.media())
                .tags(request.tags())
                .createdBy(caller.preferredUsername())
                .createdAt(now)
                .build();

        review = reviewRepository.save(review);
        log.info("Review created: reviewId={}, restaurantId={}, rating={}",
                review.getId(), review.getRestaurantId(), review.getRating());

        refreshRestaurantRating(review.getRestaurantId());
        return review;
    }

    /** 활성 리뷰 조회. 조회할 때마다 view_count가 1 증가한다. */
    public Review getReview(String reviewId) {
        ObjectIds.requireValid(reviewId, "review");
        return reviewRepository.incrementViewCountById(reviewId)
                .orElseThrow(() -> new BusinessException(ErrorCode.REVIEW_NOT_FOUND));
    }

    public Review getReviewByNumber(String reviewNumber) {
        return reviewRepository.incrementViewCountByNumber(reviewNumber)
                .orElseThrow(() -> new BusinessException(ErrorCode.REVIEW_NOT_FOUND));
    }

    /**
     * 리뷰 목록. restaurant_id가 있으면 평점 분포도 함께 반환한다.
     */
    public ReviewPageResponse searchReviews(ReviewSearchCondition condition, int page, int limit) {
        Map<String, Long> distribution = condition.restaurantId() != null
                ? reviewRepository.countByRating(condition.restaurantId())
                : null;
        return ReviewPageResponse.from(
                reviewRepository.search(condition, PageRequest.of(page - 1, limit)),
                distribution);
    }

    public Review updateReview(String reviewId, UpdateReviewRequest request, CallerIdentity caller) {
        Review review = findReview(reviewId);
        if (!caller.isAdmin() && !caller.isSubject(review.getCustomerId())) {
            throw new BusinessException(ErrorCode.FORBIDDEN,
                    "Unauthorized. Only the review author or admins can update this review");
        }
        if (request.rating() != null) {
            validateRating(request.rating());
        }

        int previousRating = review.getRating();
        review.edit(request.title(), request.text(), request.rating(), request.subRatings(),
                request.media(), request.tags(), LocalDateTime.now(clock), caller.preferredUsername());

        review = reviewRepository.save(review);
        log.info("Review updated: reviewId={}", review.getId());

        if (review.getRating() != previousRating) {
            refreshRestaurantRating(review.getRestaurantId());
        }
        return review;
    }

    /**
     * 소프트 삭제. 이미 삭제된 리뷰면 바꾸지 않고 false를 반환한다.
     */
    public boolean deleteReview(String reviewId, CallerIdentity caller) {
        Review review = findReview(reviewId);
        if (!caller.isAdmin()
                && !caller.isSubject(review.getCustomerId())
                && !restaurantService.isOwner(review.getRestaurantId(), caller)) {
            throw new BusinessException(ErrorCode.FORBIDDEN,
                    "Unauthorized. Only the review author, restaurant owner, or admins can delete this review");
        }
        if (review.isDeleted()) {
            return false;
        }

        review.softDelete(LocalDateTime.now(clock), caller.preferredUsername());
        reviewRepository.save(review);
        log.info("Review deleted: reviewId={}, by={}", reviewId, caller.preferredUsername());

        refreshRestaurantRating(review.getRestaurantId());
        return true;
    }

    public Review respondToReview(String reviewId, String responseText, String authorTitle, CallerIdentity caller) {
        Review review = findReview(reviewId);
        requireRestaurantStaff(review, caller,
                "Unauthorized. Only the restaurant owner or admins can respond to this review");

        review.respond(responseText, caller.subjectId(),
                authorTitle != null ? authorTitle : DEFAULT_AUTHOR_TITLE,
                LocalDateTime.now(clock));

        review = reviewRepository.save(review);
        log.info("Review response saved: reviewId={}, edited={}", review.getId(), review.getResponse().edited());
        return review;
    }

    public Review markHelpful(String reviewId, boolean helpful) {
        ObjectIds.requireValid(reviewId, "review");
        return reviewRepository.incrementHelpfulness(reviewId, helpful)
                .orElseThrow(() -> new BusinessException(ErrorCode.REVIEW_NOT_FOUND));
    }

    /**
     * 신고. flag_count가 임계값(promptmenu.review.flag-threshold) 이상이 되고 아직 published면
     * under_review로 바꾸고 가게 평점을 다시 계산한다.
     */
    public Review flagReview(String reviewId, String reason) {
        ObjectIds.requireValid(reviewId, "review");
        String flagReason = reason != null ? reason : DEFAULT_FLAG_REASON;
        LocalDateTime now = LocalDateTime.now(clock);

        Review flagged = reviewRepository.addFlag(reviewId, flagReason, now)
                .orElseThrow(() -> new BusinessException(ErrorCode.REVIEW_NOT_FOUND));
        log.info("Review flagged: reviewId={}, flagCount={}", reviewId, flagged.getFlagCount());

        int threshold = properties.review().flagThreshold();
        if (flagged.getFlagCount() >= threshold && flagged.isPublished()
                && reviewRepository.escalateToUnderReview(reviewId, now)) {
            log.warn("Review escalated to under_review: reviewId={}, flagCount={}",
                    reviewId, flagged.getFlagCount());
            refreshRestaurantRating(flagged.getRestaurantId());
            return reviewRepository.findById(reviewId).orElse(flagged);
        }
        return flagged;
    }

    /** 관리자 중재. 상태가 실제로 바뀌면 가게 평점을 다시 계산한다. */
    public Review moderateReview(String reviewId, String status, String notes, CallerIdentity caller) {
        ReviewStatus newStatus = ReviewStatus.moderationTarget(status);
        Review review = findReview(reviewId);
        if (!caller.isAdmin()) {
            throw new BusinessException(ErrorCode.FORBIDDEN, "Unauthorized. Only admins can moderate reviews");
        }

        boolean changed = review.moderate(newStatus, notes, LocalDateTime.now(clock), caller.preferredUsername());
        review = reviewRepository.save(review);
        log.info("Review moderated: reviewId={}, status={}, changed={}", review.getId(), newStatus, changed);

        if (changed) {
            refreshRestaurantRating(review.getRestaurantId());
        }
        return review;
    }

    public Review featureReview(String reviewId, boolean featured, CallerIdentity caller) {
        Review review = findReview(reviewId);
        requireRestaurantStaff(review, caller,
                "Unauthorized. Only the restaurant owner or admins can feature this review");
        if (featured && !review.isPublished()) {
            throw new BusinessException(ErrorCode.REVIEW_NOT_PUBLISHED);
        }

        review.feature(featured, LocalDateTime.now(clock), caller.preferredUsername());
        review = reviewRepository.save(review);
        log.info("Review {}: reviewId={}", featured ? "featured" : "unfeatured", review.getId());
        return review;
    }

    private Review findReview(String reviewId) {
        ObjectIds.requireValid(reviewId, "review");
        return reviewRepository.findById(reviewId)
                .orElseThrow(() -> new BusinessException(ErrorCode.REVIEW_NOT_FOUND));
    }

    private void requireRestaurantStaff(Review review, CallerIdentity caller, String message) {
        if (!caller.isAdmin() && !restaurantService.isOwner(review.getRestaurantId(), caller)) {
            throw new BusinessException(ErrorCode.FORBIDDEN, message);
        }
    }

    private void validateRating(Integer rating) {
        if (rating == null || rating < 1 || rating > 5) {
            throw new BusinessException(ErrorCode.INVALID_RATING);
        }
    }

    // 리뷰 변경은 이미 저장되었으므로 재계산 실패로 요청을 실패시키지 않는다
    private void refreshRestaurantRating(String restaurantId) {
        try {
            ratingService.recompute(restaurantId);
        } catch (RuntimeException e) {
            log.warn("Restaurant rating recompute failed: restaurantId={}, error={}", restaurantId, e.getMessage(), e);
        }
    }

    private String generateReviewNumber(LocalDateTime now) {
        String base = "REV-" + now.format(NUMBER_FORMAT);
        String candidate = base;
        int suffix = 2;
        while (reviewRepository.existsByReviewNumber(candidate)) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }
}
