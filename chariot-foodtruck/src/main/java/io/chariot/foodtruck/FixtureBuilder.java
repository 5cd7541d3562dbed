package io.chariot.foodtruck;

import io.chariot.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Populates a store with one taco truck, its menu and staff, a customer and two orders.
 * <p>
 * Commits three times: the truck with its items and employees, the customer, the orders.
 * Constraint violations propagate from {@link Session#commit()}.
 */
public final class FixtureBuilder {
    private static final Logger log = LoggerFactory.getLogger(FixtureBuilder.class);

    private final Session session;

    public FixtureBuilder(Session session) {
        this.session = session;
    }

    public Fixture build() {
        TacoTruck foodTruck = session.add(new TacoTruck(null, "Hell's Chariot"));
        List<MenuItem> menuItems = session.addAll(List.of(
                MenuItem.of("Super Burrito", 10_00, foodTruck),
                MenuItem.of("California Burrito", 7_00, foodTruck),
                MenuItem.of("Shrimp Burrito", 8_00, foodTruck)));
        List<Employee> employees = session.addAll(List.of(
                Employee.of("Danny", "Zuko", foodTruck),
                Employee.of("Sandra", "Dee", foodTruck)));
        session.commit();

        Customer customer = session.add(new Customer(null, "Frenchy", null));
        session.commit();

        List<Order> orders = session.addAll(List.of(
                Order.of(employees.get(0), customer, menuItems.get(0), menuItems.get(1)),
                Order.of(employees.get(1), customer, menuItems.get(1))));
        session.commit();

        log.debug("Built fixture for {} with {} menu item(s) and {} order(s)", foodTruck.name(), menuItems.size(),
                orders.size());
        return new Fixture(foodTruck, menuItems, employees, customer, orders);
    }
}
