package io.chariot.foodtruck;

import io.chariot.core.ChariotConfiguration;
import io.chariot.session.Chariot;

/**
 * Entity families of the food-truck application.
 */
public final class FoodTruckSchema {

    public static final Class<?>[] ENTITIES = { FoodTruck.class, Person.class, MenuItem.class, Order.class };

    private FoodTruckSchema() {
    }

    public static Chariot open(ChariotConfiguration configuration) {
        return Chariot.open(configuration, ENTITIES);
    }
}
