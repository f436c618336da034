package com.promptmenu.restaurant.controller;

import com.promptmenu.common.dto.ApiResponse;
import com.promptmenu.common.security.CallerIdentity;
import com.promptmenu.restaurant.dto.CreateRestaurantRequest;
import com.promptmenu.restaurant.entity.Restaurant;
import com.promptmenu.restaurant.service.RestaurantService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/restaurants")
@RequiredArgsConstructor
public class RestaurantController {

    private final RestaurantService restaurantService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<Restaurant> createRestaurant(
            @RequestAttribute(CallerIdentity.ATTRIBUTE) CallerIdentity caller,
            @Valid @RequestBody CreateRestaurantRequest request) {
        return ApiResponse.ok("Restaurant created successfully",
                restaurantService.createRestaurant(request, caller));
    }

    /** 가게 조회 (avg_rating, review_count 포함, 캐시됨) */
    @GetMapping("/{id}")
    public ApiResponse<Restaurant> getRestaurant(@PathVariable String id) {
        return ApiResponse.ok(restaurantService.getRestaurant(id));
    }
}
