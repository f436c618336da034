package com.promptmenu.review.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 리뷰(Review) 문서.
 *
 * <h3>카운터</h3>
 * helpful_count, unhelpful_count, view_count, flag_count는 저장소의 $inc로만 바뀐다
 * ({@code ReviewRepositoryCustom}). 이 클래스에는 카운터를 바꾸는 메서드가 없고,
 * 요청 DTO에도 카운터 필드가 없다.
 *
 * <h3>평점 집계 대상</h3>
 * status=published 이고 is_active=true인 리뷰만 가게의 avg_rating, review_count에 반영된다.
 * 그 조건을 바꾸는 메서드(rating 수정, 삭제, 중재)를 호출한 쪽은 가게 평점을 다시 계산해야 한다.
 */
@Document(collection = "reviews")
@CompoundIndex(name = "idx_review_restaurant_status", def = "{'restaurant_id': 1, 'status': 1, 'is_active': 1}")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Review {

    @Id
    private String id;

    @Version
    private Long version;

    @Indexed(unique = true)
    private String reviewNumber;

    private String restaurantId;

    @Indexed
    private String customerId;

    private String orderId;
    private String menuItemId;
    private String staffId;

    private String title;
    private String text;
    private int rating;
    private SubRatings subRatings;
    private ReviewMedia media;
    private ReviewResponse response;
    private List<String> tags = new ArrayList<>();

    private int helpfulCount;
    private int unhelpfulCount;
    private int viewCount;
    private int flagCount;
    private List<String> flaggedReason = new ArrayList<>();

    private ReviewStatus status;
    private String moderatedBy;
    private LocalDateTime moderatedAt;
    private String moderationNotes;
    private String deletedBy;
    private LocalDateTime deletedAt;

    private boolean featured;
    private LocalDateTime featuredAt;
    private String featuredBy;

    @Field("is_active")
    @JsonProperty("is_active")
    private Boolean active;

    private LocalDateTime date;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private String createdBy;
    private String updatedBy;

    @Builder
    public Review(String reviewNumber, String restaurantId, String customerId, String orderId,
                  String menuItemId, String staffId, String title, String text, int rating,
                  SubRatings subRatings, ReviewMedia media, List<String> tags,
                  String createdBy, LocalDateTime createdAt) {
        this.reviewNumber = reviewNumber;
        this.restaurantId = restaurantId;
        this.customerId = customerId;
        this.orderId = orderId;
        this.menuItemId = menuItemId;
        this.staffId = staffId;
        this.title = title;
        this.text = text;
        this.rating = rating;
        this.subRatings = subRatings == null ? SubRatings.empty() : subRatings;
        this.media = media == null ? ReviewMedia.empty() : media;
        this.response = ReviewResponse.empty();
        this.tags = tags == null ? new ArrayList<>() : new ArrayList<>(tags);
        this.status = ReviewStatus.PUBLISHED;
        this.active = true;
        this.createdBy = createdBy;
        this.updatedBy = createdBy;
        this.date = createdAt;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    /** 작성자 수정. null인 값은 기존 값을 유지한다. */
    public void edit(String title, String text, Integer rating, SubRatings subRatings,
                     ReviewMedia media, List<String> tags, LocalDateTime now, String actor) {
        if (title != null) this.title = title;
        if (text != null) this.text = text;
        if (rating != null) this.rating = rating;
        if (subRatings != null) this.subRatings = subRatings;
        if (media != null) this.media = media;
        if (tags != null) this.tags = new ArrayList<>(tags);
        touch(now, actor);
    }

    /** 소프트 삭제: status=deleted, is_active=false, featured=false */
    public void softDelete(LocalDateTime now, String actor) {
        this.status = ReviewStatus.DELETED;
        this.active = false;
        this.featured = false;
        this.deletedBy = actor;
        this.deletedAt = now;
        touch(now, actor);
    }

    /**
     * 관리자 중재. deleted면 소프트 삭제 필드까지 기록하고, 그 밖의 상태면 다시 활성화한다
     * (deleted에서 published로 복구된 리뷰가 평점 집계에 다시 포함된다).
     * published가 아니게 되면 추천도 해제된다.
     *
     * @return 상태가 실제로 바뀌었으면 true
     */
    public boolean moderate(ReviewStatus newStatus, String notes, LocalDateTime now, String moderator) {
        boolean changed = this.status != newStatus;
        this.status = newStatus;
        this.moderatedBy = moderator;
        this.moderatedAt = now;
        this.moderationNotes = notes == null ? "" : notes;
        if (newStatus == ReviewStatus.DELETED) {
            this.active = false;
            this.deletedBy = moderator;
            this.deletedAt = now;
        } else {
            this.active = true;
        }
        if (newStatus != ReviewStatus.PUBLISHED) {
            this.featured = false;
        }
        touch(now, moderator);
        return changed;
    }

    public void respond(String text, String authorId, String authorTitle, LocalDateTime now) {
        boolean edited = response != null && response.hasText();
        this.response = new ReviewResponse(text, authorId, authorTitle, now, edited);
        this.updatedAt = now;
    }

    /** 추천 지정/해제. published 여부는 호출자가 먼저 확인한다. */
    public void feature(boolean featured, LocalDateTime now, String actor) {
        this.featured = featured;
        if (featured) {
            this.featuredAt = now;
            this.featuredBy = actor;
        }
        touch(now, actor);
    }

    @JsonIgnore
    public boolean isDeleted() {
        return status == ReviewStatus.DELETED && !Boolean.TRUE.equals(active);
    }

    @JsonIgnore
    public boolean isPublished() {
        return status == ReviewStatus.PUBLISHED;
    }

    private void touch(LocalDateTime now, String actor) {
        this.updatedAt = now;
        this.updatedBy = actor;
    }
}
