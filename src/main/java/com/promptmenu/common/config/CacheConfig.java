package com.promptmenu.common.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Caffeine 로컬 캐시.
 *
 * <p>restaurants 캐시는 평점 집계가 다시 쓰일 때마다 evict된다
 * ({@code RestaurantRatingService#recompute}).</p>
 */
@Configuration
public class CacheConfig {

    public static final String RESTAURANTS = "restaurants";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(RESTAURANTS);
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(500)
                .expireAfterWrite(Duration.ofMinutes(10)));
        return cacheManager;
    }
}
