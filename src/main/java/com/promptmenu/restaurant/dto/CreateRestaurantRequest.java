package com.promptmenu.restaurant.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * 가게 등록 요청. owner_id가 없으면 호출자의 subject가 소유자가 된다.
 * avg_rating, review_count는 리뷰 집계로만 채워지므로 받지 않는다.
 */
public record CreateRestaurantRequest(
        @NotBlank(message = "name is required")
        String name,

        String description,
        String ownerId,
        List<String> cuisineTypes,
        String priceRange
) {}
