package io.chariot.foodtruck;

import io.chariot.query.EntityGraph;
import io.chariot.query.QueryResult;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flattens fetched orders into one line per order item.
 * <p>
 * A fetched relationship without a target (no customer, no employee, an employee without a
 * truck) renders as {@code NA}. Reading a relationship the query did not fetch raises
 * {@link io.chariot.core.RelationshipAbsentException}.
 */
public final class OrderRenderer {

    private static final String NA = Person.MISSING_NAME;

    private final PrintStream out;

    public OrderRenderer(PrintStream out) {
        this.out = out;
    }

    public List<OrderLine> render(QueryResult<Order> result) {
        EntityGraph graph = result.graph();
        List<OrderLine> lines = new ArrayList<>();
        for (Order order : result.roots()) {
            String customer = graph.one(order, Order.CUSTOMER).map(Person::displayName).orElse(NA);
            Optional<FoodTruck> foodTruck = graph.one(order, Order.EMPLOYEE)
                    .flatMap(employee -> graph.one(employee, Employee.FOOD_TRUCK));
            String truckName = foodTruck.map(FoodTruck::name).orElse(NA);
            String truckType = foodTruck.map(FoodTruck::type).orElse(NA);
            for (MenuItem item : graph.many(order, Order.MENU_ITEMS)) {
                lines.add(new OrderLine(customer, item.name() == null ? NA : item.name(), item.price(), truckName,
                        truckType));
            }
        }
        return lines;
    }

    public void print(List<OrderLine> lines) {
        for (OrderLine line : lines) {
            out.println(line);
        }
    }
}
