package io.chariot.foodtruck;

import jakarta.persistence.DiscriminatorValue;

@DiscriminatorValue("food_truck")
public record PlainFoodTruck(Long id, String name) implements FoodTruck {
}
