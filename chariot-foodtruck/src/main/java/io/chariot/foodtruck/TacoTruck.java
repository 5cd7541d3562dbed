package io.chariot.foodtruck;

import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Table;

/**
 * A food truck specialization stored in {@code taco_truck}, keyed by the {@code food_truck} id.
 */
@DiscriminatorValue("taco_truck")
@Table(name = "taco_truck")
public record TacoTruck(Long id, String name) implements FoodTruck {
}
