package io.chariot.foodtruck;

import io.chariot.query.Attribute;
import io.chariot.query.Relationship;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * An item sold by one food truck.
 *
 * @param price price in cents
 */
@Entity
@Table(name = "menu_item")
public record MenuItem(@Id @GeneratedValue Long id,
                       Integer price,
                       String name,
                       @ManyToOne(targetEntity = FoodTruck.class) @JoinColumn(name = "food_truck_id") Long foodTruckId) {

    public static final Attribute<MenuItem, Integer> PRICE = Attribute.of(MenuItem.class, "price", Integer.class);
    public static final Attribute<MenuItem, String> NAME = Attribute.of(MenuItem.class, "name", String.class);
    public static final Relationship<MenuItem, FoodTruck> FOOD_TRUCK =
            Relationship.toOne(MenuItem.class, "foodTruckId", FoodTruck.class);
    public static final Relationship<MenuItem, Order> ORDERS =
            Relationship.inverse(MenuItem.class, "orders", Order.MENU_ITEMS);

    public static MenuItem of(String name, int price, FoodTruck foodTruck) {
        return new MenuItem(null, price, name, foodTruck.id());
    }
}
