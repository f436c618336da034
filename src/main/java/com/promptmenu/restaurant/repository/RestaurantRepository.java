package com.promptmenu.restaurant.repository;

import com.promptmenu.restaurant.entity.Restaurant;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface RestaurantRepository extends MongoRepository<Restaurant, String>, RestaurantRepositoryCustom {
}
