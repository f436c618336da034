package com.promptmenu.restaurant.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 가게(Restaurant) 문서.
 *
 * <p>avg_rating, review_count는 리뷰 집계의 캐시값이다. 리뷰 엔진만
 * {@code RestaurantRepositoryCustom#updateRating}으로 갱신하며, 이 클래스에는 setter가 없다.</p>
 */
@Document(collection = "restaurants")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Restaurant {

    @Id
    private String id;

    @Version
    private Long version;

    private String name;
    private String description;

    @Indexed
    private String ownerId;

    private List<String> cuisineTypes = new ArrayList<>();
    private String priceRange;

    private BigDecimal avgRating;
    private int reviewCount;

    @Field("is_active")
    @JsonProperty("is_active")
    private Boolean active;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private String createdBy;

    @Builder
    public Restaurant(String name, String description, String ownerId, List<String> cuisineTypes,
                      String priceRange, String createdBy, LocalDateTime createdAt) {
        this.name = name;
        this.description = description;
        this.ownerId = ownerId;
        this.cuisineTypes = cuisineTypes == null ? new ArrayList<>() : new ArrayList<>(cuisineTypes);
        this.priceRange = priceRange;
        this.avgRating = BigDecimal.ZERO;
        this.reviewCount = 0;
        this.active = true;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }
}
