package io.chariot.foodtruck;

import java.util.List;

/**
 * Entities created by {@link FixtureBuilder}, ids assigned.
 */
public record Fixture(TacoTruck foodTruck,
                      List<MenuItem> menuItems,
                      List<Employee> employees,
                      Customer customer,
                      List<Order> orders) {

    public Fixture {
        if (foodTruck == null) {
            throw new IllegalArgumentException("foodTruck required");
        }
        if (customer == null) {
            throw new IllegalArgumentException("customer required");
        }
        menuItems = List.copyOf(menuItems);
        employees = List.copyOf(employees);
        orders = List.copyOf(orders);
    }
}
