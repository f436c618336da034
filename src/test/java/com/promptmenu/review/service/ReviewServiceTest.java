package com.promptmenu.review.service;

import com.promptmenu.common.config.PromptMenuProperties;
import com.promptmenu.common.exception.BusinessException;
import com.promptmenu.common.exception.ErrorCode;
import com.promptmenu.common.security.CallerIdentity;
import com.promptmenu.restaurant.service.RestaurantService;
import com.promptmenu.review.dto.CreateReviewRequest;
import com.promptmenu.review.dto.UpdateReviewRequest;
import com.promptmenu.review.entity.Review;
import com.promptmenu.review.entity.ReviewStatus;
import com.promptmenu.review.repository.ReviewRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ReviewServiceTest {

    private static final String REVIEW_ID = "65f0c0ffee0000000000beef";
    private static final String RESTAURANT_ID = "507f1f77bcf86cd799439011";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private static final CallerIdentity AUTHOR = new CallerIdentity("cust-1", "alice", List.of());
    private static final CallerIdentity OWNER = new CallerIdentity("owner-1", "bob", List.of());
    private static final CallerIdentity ADMIN = new CallerIdentity("admin-1", "root", List.of("admin"));
    private static final CallerIdentity STRANGER = new CallerIdentity("someone", "eve", List.of());

    @Mock
    private ReviewRepository reviewRepository;
    @Mock
    private RestaurantService restaurantService;
    @Mock
    private RestaurantRatingService ratingService;

    private ReviewService reviewService;

    @BeforeEach
    void setUp() {
        PromptMenuProperties properties = new PromptMenuProperties(
                new PromptMenuProperties.Review(5),
                new PromptMenuProperties.Mongo(Duration.ofSeconds(30)));
        reviewService = new ReviewService(reviewRepository, restaurantService, ratingService, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static CreateReviewRequest createRequest(int rating) {
        return new CreateReviewRequest(RESTAURANT_ID, rating, "Great pasta", null, null,
                null, null, null, "Dinner", null, null, List.of("pasta"));
    }

    private static Review publishedReview(int rating) {
        return Review.builder()
                .reviewNumber("REV-20240501110000")
                .restaurantId(RESTAURANT_ID)
                .customerId("cust-1")
                .text("Nice")
                .rating(rating)
                .createdBy("alice")
                .createdAt(LocalDateTime.of(2024, 5, 1, 11, 0))
                .build();
    }

    @ParameterizedTest(name = "rating={0}")
    @ValueSource(ints = {0, 6, -1})
    @DisplayName("rating이 1~5 밖이면 INVALID_RATING, 저장하지 않는다")
    void createReview_RatingOutOfRange(int rating) {
        assertThatThrownBy(() -> reviewService.createReview(createRequest(rating), AUTHOR))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Rating must be between 1 and 5");

        verifyNoInteractions(reviewRepository, ratingService);
    }

    @ParameterizedTest(name = "rating={0}")
    @ValueSource(ints = {1, 5})
    @DisplayName("rating 1과 5는 허용되고 기본값이 채워진 뒤 가게 평점이 다시 계산된다")
    void createReview_BoundaryRatingsAccepted(int rating) {
        // Given
        given(restaurantService.exists(RESTAURANT_ID)).willReturn(true);
        given(reviewRepository.existsByReviewNumber("REV-20240501120000")).willReturn(false);
        given(reviewRepository.save(any(Review.class))).willAnswer(inv -> inv.getArgument(0));

        // When
        Review review = reviewService.createReview(createRequest(rating), AUTHOR);

        // Then
        assertThat(review.getRating()).isEqualTo(rating);
        assertThat(review.getStatus()).isEqualTo(ReviewStatus.PUBLISHED);
        assertThat(review.getActive()).isTrue();
        assertThat(review.getCustomerId()).isEqualTo("cust-1");
        assertThat(review.getReviewNumber()).isEqualTo("REV-20240501120000");
        assertThat(review.getHelpfulCount()).isZero();
        assertThat(review.getFlagCount()).isZero();
        assertThat(review.getMedia().images()).isEmpty();
        assertThat(review.getResponse().text()).isEmpty();
        assertThat(review.getSubRatings().food()).isZero();
        verify(ratingService).recompute(RESTAURANT_ID);
    }

    @Test
    @DisplayName("존재하지 않는 가게에 리뷰를 쓰면 RESTAURANT_NOT_FOUND")
    void createReview_UnknownRestaurant() {
        given(restaurantService.exists(RESTAURANT_ID)).willReturn(false);

        assertThatThrownBy(() -> reviewService.createReview(createRequest(4), AUTHOR))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.RESTAURANT_NOT_FOUND));

        verify(reviewRepository, never()).save(any());
    }

    @Test
    @DisplayName("평점 재계산이 실패해도 리뷰 작성은 성공한다")
    void createReview_RecomputeFailure_DoesNotFail() {
        given(restaurantService.exists(RESTAURANT_ID)).willReturn(true);
        given(reviewRepository.existsByReviewNumber(anyString())).willReturn(false);
        given(reviewRepository.save(any(Review.class))).willAnswer(inv -> inv.getArgument(0));
        willThrow(new IllegalStateException("store down")).given(ratingService).recompute(RESTAURANT_ID);

        Review review = reviewService.createReview(createRequest(4), AUTHOR);

        assertThat(review.getRating()).isEqualTo(4);
    }

    @Test
    @DisplayName("잘못된 리뷰 ID 형식은 INVALID_ID_FORMAT")
    void getReview_MalformedId() {
        assertThatThrownBy(() -> reviewService.getReview("xyz"))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Invalid review ID format");

        verifyNoInteractions(reviewRepository);
    }

    @Test
    @DisplayName("임계값(5) 신고 - 5번째 신고에서만 under_review로 바뀐다")
    void flagReview_FifthFlagEscalates() {
        // Given
        AtomicInteger flags = new AtomicInteger();
        given(reviewRepository.addFlag(eq(REVIEW_ID), eq("Spam"), any(LocalDateTime.class)))
                .willAnswer(inv -> {
                    Review review = publishedReview(4);
                    ReflectionTestUtils.setField(review, "flagCount", flags.incrementAndGet());
                    return Optional.of(review);
                });

        // When: 4번 신고
        for (int i = 0; i < 4; i++) {
            Review flagged = reviewService.flagReview(REVIEW_ID, "Spam");
            assertThat(flagged.getStatus()).isEqualTo(ReviewStatus.PUBLISHED);
        }

        // Then
        verify(reviewRepository, never()).escalateToUnderReview(anyString(), any());
        verifyNoInteractions(ratingService);

        // When: 5번째 신고
        Review escalated = publishedReview(4);
        ReflectionTestUtils.setField(escalated, "status", ReviewStatus.UNDER_REVIEW);
        given(reviewRepository.escalateToUnderReview(eq(REVIEW_ID), any(LocalDateTime.class))).willReturn(true);
        given(reviewRepository.findById(REVIEW_ID)).willReturn(Optional.of(escalated));

        Review fifth = reviewService.flagReview(REVIEW_ID, "Spam");

        // Then
        assertThat(fifth.getStatus()).isEqualTo(ReviewStatus.UNDER_REVIEW);
        verify(reviewRepository, times(1)).escalateToUnderReview(eq(REVIEW_ID), any(LocalDateTime.class));
        verify(ratingService).recompute(RESTAURANT_ID);
    }

    @Test
    @DisplayName("신고 사유가 없으면 'Inappropriate content'")
    void flagReview_DefaultReason() {
        given(reviewRepository.addFlag(eq(REVIEW_ID), eq("Inappropriate content"), any(LocalDateTime.class)))
                .willReturn(Optional.of(publishedReview(3)));

        reviewService.flagReview(REVIEW_ID, null);

        verify(reviewRepository).addFlag(eq(REVIEW_ID), eq("Inappropriate content"), any(LocalDateTime.class));
    }

    @Test
    @DisplayName("관리자가 아니면 중재할 수 없다")
    void moderateReview_NonAdmin_Forbidden() {
        given(reviewRepository.findById(REVIEW_ID)).willReturn(Optional.of(publishedReview(4)));

        assertThatThrownBy(() -> reviewService.moderateReview(REVIEW_ID, "hidden", null, OWNER))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.FORBIDDEN));
    }

    @Test
    @DisplayName("중재 가능한 상태는 published, hidden, deleted뿐이다")
    void moderateReview_InvalidTarget() {
        assertThatThrownBy(() -> reviewService.moderateReview(REVIEW_ID, "under_review", null, ADMIN))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Invalid status. Must be one of: published, hidden, deleted");
    }

    @Test
    @DisplayName("중재로 상태가 바뀌면 가게 평점을 다시 계산하고, deleted면 비활성화한다")
    void moderateReview_StatusChanged_Recomputes() {
        given(reviewRepository.findById(REVIEW_ID)).willReturn(Optional.of(publishedReview(4)));
        given(reviewRepository.save(any(Review.class))).willAnswer(inv -> inv.getArgument(0));

        Review review = reviewService.moderateReview(REVIEW_ID, "deleted", "abusive", ADMIN);

        assertThat(review.getStatus()).isEqualTo(ReviewStatus.DELETED);
        assertThat(review.getActive()).isFalse();
        assertThat(review.getModeratedBy()).isEqualTo("root");
        assertThat(review.getModerationNotes()).isEqualTo("abusive");
        assertThat(review.getDeletedBy()).isEqualTo("root");
        verify(ratingService).recompute(RESTAURANT_ID);
    }

    @Test
    @DisplayName("같은 상태로 중재하면 평점을 다시 계산하지 않는다")
    void moderateReview_SameStatus_NoRecompute() {
        given(reviewRepository.findById(REVIEW_ID)).willReturn(Optional.of(publishedReview(4)));
        given(reviewRepository.save(any(Review.class))).willAnswer(inv -> inv.getArgument(0));

        reviewService.moderateReview(REVIEW_ID, "published", null, ADMIN);

        verifyNoInteractions(ratingService);
    }

    @Test
    @DisplayName("published가 아닌 리뷰는 추천할 수 없다")
    void featureReview_NotPublished() {
        Review hidden = publishedReview(4);
        ReflectionTestUtils.setField(hidden, "status", ReviewStatus.HIDDEN);
        given(reviewRepository.findById(REVIEW_ID)).willReturn(Optional.of(hidden));

        assertThatThrownBy(() -> reviewService.featureReview(REVIEW_ID, true, ADMIN))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Only published reviews can be featured");
    }

    @Test
    @DisplayName("가게 소유자가 추천하면 featured_at, featured_by가 기록된다")
    void featureReview_Owner() {
        given(reviewRepository.findById(REVIEW_ID)).willReturn(Optional.of(publishedReview(5)));
        given(restaurantService.isOwner(RESTAURANT_ID, OWNER)).willReturn(true);
        given(reviewRepository.save(any(Review.class))).willAnswer(inv -> inv.getArgument(0));

        Review review = reviewService.featureReview(REVIEW_ID, true, OWNER);

        assertThat(review.isFeatured()).isTrue();
        assertThat(review.getFeaturedBy()).isEqualTo("bob");
        assertThat(review.getFeaturedAt()).isEqualTo(LocalDateTime.of(2024, 5, 1, 12, 0));
    }

    @Test
    @DisplayName("rating이 바뀐 수정만 평점을 다시 계산한다")
    void updateReview_RatingChanged_Recomputes() {
        given(reviewRepository.findById(REVIEW_ID)).willReturn(Optional.of(publishedReview(4)));
        given(reviewRepository.save(any(Review.class))).willAnswer(inv -> inv.getArgument(0));

        Review review = reviewService.updateReview(REVIEW_ID,
                new UpdateReviewRequest(null, "Even better", 5, null, null, null), AUTHOR);

        assertThat(review.getRating()).isEqualTo(5);
        assertThat(review.getText()).isEqualTo("Even better");
        verify(ratingService).recompute(RESTAURANT_ID);
    }

    @Test
    @DisplayName("rating이 그대로인 수정은 평점을 다시 계산하지 않는다")
    void updateReview_SameRating_NoRecompute() {
        given(reviewRepository.findById(REVIEW_ID)).willReturn(Optional.of(publishedReview(4)));
        given(reviewRepository.save(any(Review.class))).willAnswer(inv -> inv.getArgument(0));

        reviewService.updateReview(REVIEW_ID, new UpdateReviewRequest("Title", null, 4, null, null, null), AUTHOR);

        verifyNoInteractions(ratingService);
    }

    @Test
    @DisplayName("작성자나 관리자가 아니면 수정할 수 없다 (가게 소유자 포함)")
    void updateReview_Owner_Forbidden() {
        given(reviewRepository.findById(REVIEW_ID)).willReturn(Optional.of(publishedReview(4)));

        assertThatThrownBy(() -> reviewService.updateReview(REVIEW_ID,
                new UpdateReviewRequest(null, "x", null, null, null, null), OWNER))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.FORBIDDEN));
    }

    @Test
    @DisplayName("가게 소유자는 리뷰를 소프트 삭제할 수 있고 평점이 다시 계산된다")
    void deleteReview_Owner_SoftDeletes() {
        Review review = publishedReview(3);
        given(reviewRepository.findById(REVIEW_ID)).willReturn(Optional.of(review));
        given(restaurantService.isOwner(RESTAURANT_ID, OWNER)).willReturn(true);
        given(reviewRepository.save(any(Review.class))).willAnswer(inv -> inv.getArgument(0));

        boolean deleted = reviewService.deleteReview(REVIEW_ID, OWNER);

        assertThat(deleted).isTrue();
        assertThat(review.getStatus()).isEqualTo(ReviewStatus.DELETED);
        assertThat(review.getActive()).isFalse();
        assertThat(review.getDeletedBy()).isEqualTo("bob");
        verify(ratingService).recompute(RESTAURANT_ID);
    }

    @Test
    @DisplayName("이미 삭제된 리뷰를 다시 삭제하면 아무것도 바꾸지 않는다")
    void deleteReview_AlreadyDeleted() {
        Review review = publishedReview(3);
        review.softDelete(LocalDateTime.of(2024, 5, 1, 11, 30), "alice");
        given(reviewRepository.findById(REVIEW_ID)).willReturn(Optional.of(review));

        boolean deleted = reviewService.deleteReview(REVIEW_ID, AUTHOR);

        assertThat(deleted).isFalse();
        verify(reviewRepository, never()).save(any());
        verifyNoInteractions(ratingService);
    }

    @Test
    @DisplayName("답변을 다시 작성하면 is_edited가 true가 된다")
    void respondToReview_SecondResponseIsEdited() {
        Review review = publishedReview(4);
        given(reviewRepository.findById(REVIEW_ID)).willReturn(Optional.of(review));
        given(restaurantService.isOwner(RESTAURANT_ID, OWNER)).willReturn(true);
        given(reviewRepository.save(any(Review.class))).willAnswer(inv -> inv.getArgument(0));

        Review first = reviewService.respondToReview(REVIEW_ID, "Thanks!", null, OWNER);
        assertThat(first.getResponse().edited()).isFalse();
        assertThat(first.getResponse().authorTitle()).isEqualTo("Restaurant Representative");
        assertThat(first.getResponse().authorId()).isEqualTo("owner-1");

        Review second = reviewService.respondToReview(REVIEW_ID, "Thanks again!", "Chef", OWNER);
        assertThat(second.getResponse().edited()).isTrue();
        assertThat(second.getResponse().text()).isEqualTo("Thanks again!");
    }

    @Test
    @DisplayName("가게 소유자가 아니면 답변할 수 없다")
    void respondToReview_Stranger_Forbidden() {
        given(reviewRepository.findById(REVIEW_ID)).willReturn(Optional.of(publishedReview(4)));
        given(restaurantService.isOwner(RESTAURANT_ID, STRANGER)).willReturn(false);

        assertThatThrownBy(() -> reviewService.respondToReview(REVIEW_ID, "hi", null, STRANGER))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.FORBIDDEN));
    }

    @Test
    @DisplayName("도움됨 표시 대상 리뷰가 없으면 REVIEW_NOT_FOUND")
    void markHelpful_NotFound() {
        given(reviewRepository.incrementHelpfulness(REVIEW_ID, false)).willReturn(Optional.empty());

        assertThatThrownBy(() -> reviewService.markHelpful(REVIEW_ID, false))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.REVIEW_NOT_FOUND));
    }
}
