package io.chariot.foodtruck;

import io.chariot.query.Attribute;
import io.chariot.query.Relationship;
import io.chariot.schema.Discriminators;
import jakarta.persistence.Column;
import jakarta.persistence.DiscriminatorColumn;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Inheritance;
import jakarta.persistence.InheritanceType;
import jakarta.persistence.Table;

/**
 * A business selling menu items. Rows of every variant live in {@code food_truck}, tagged by
 * {@code type}.
 */
@Entity
@Table(name = "food_truck")
@Inheritance(strategy = InheritanceType.JOINED)
@DiscriminatorColumn(name = "type")
public sealed interface FoodTruck permits PlainFoodTruck, TacoTruck {

    Attribute<FoodTruck, String> NAME = Attribute.of(FoodTruck.class, "name", String.class);
    Relationship<FoodTruck, MenuItem> MENU_ITEMS =
            Relationship.inverse(FoodTruck.class, "menuItems", MenuItem.FOOD_TRUCK);
    Relationship<FoodTruck, Employee> EMPLOYEES =
            Relationship.inverse(FoodTruck.class, "employees", Employee.FOOD_TRUCK);

    @Id
    @GeneratedValue
    Long id();

    @Column(unique = true, nullable = false)
    String name();

    /**
     * The discriminator tag, {@code food_truck} or {@code taco_truck}.
     */
    default String type() {
        return Discriminators.valueOf(getClass());
    }
}
