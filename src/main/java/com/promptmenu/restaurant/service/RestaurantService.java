package com.promptmenu.restaurant.service;

import com.promptmenu.common.config.CacheConfig;
import com.promptmenu.common.exception.BusinessException;
import com.promptmenu.common.exception.ErrorCode;
import com.promptmenu.common.security.CallerIdentity;
import com.promptmenu.common.util.ObjectIds;
import com.promptmenu.restaurant.dto.CreateRestaurantRequest;
import com.promptmenu.restaurant.entity.Restaurant;
import com.promptmenu.restaurant.repository.RestaurantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 가게 서비스 - 등록, 조회, 소유자 확인.
 *
 * <p>getRestaurant()는 Caffeine 로컬 캐시(restaurants)를 사용한다.
 * 평점이 다시 계산되면 {@code RestaurantRatingService}가 해당 키를 비운다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RestaurantService {

    private final RestaurantRepository restaurantRepository;
    private final Clock clock;

    public Restaurant createRestaurant(CreateRestaurantRequest request, CallerIdentity caller) {
        Restaurant restaurant = Restaurant.builder()
                .name(request.name())
                .description(request.description())
                .ownerId(request.ownerId() != null ? request.ownerId() : caller.subjectId())
                .cuisineTypes(request.cuisineTypes())
                .priceRange(request.priceRange())
                .createdBy(caller.preferredUsername())
                .createdAt(LocalDateTime.now(clock))
                .build();

        restaurant = restaurantRepository.save(restaurant);
        log.info("Restaurant created: restaurantId={}, ownerId={}", restaurant.getId(), restaurant.getOwnerId());
        return restaurant;
    }

    @Cacheable(value = CacheConfig.RESTAURANTS, key = "#id")
    public Restaurant getRestaurant(String id) {
        ObjectIds.requireValid(id, "restaurant");
        return restaurantRepository.findById(id)
                .orElseThrow(() -> new BusinessException(ErrorCode.RESTAURANT_NOT_FOUND));
    }

    public boolean exists(String id) {
        return restaurantRepository.existsById(id);
    }

    public Optional<String> findOwnerId(String restaurantId) {
        if (restaurantId == null || !ObjectId.isValid(restaurantId)) {
            return Optional.empty();
        }
        return restaurantRepository.findById(restaurantId).map(Restaurant::getOwnerId);
    }

    /** 호출자가 해당 가게의 소유자인지 확인한다. 가게가 없으면 false. */
    public boolean isOwner(String restaurantId, CallerIdentity caller) {
        return findOwnerId(restaurantId).map(caller::isSubject).orElse(false);
    }
}
