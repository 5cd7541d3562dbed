package io.chariot.foodtruck;

import io.chariot.query.Fetch;
import io.chariot.query.Query;
import io.chariot.session.Session;

/**
 * Builds the order query: orders containing an item at a given price, joined through the item to
 * its food truck, with the items, customer, and employee plus the employee's truck fetched eagerly.
 */
public final class OrderQueryComposer {

    /**
     * How each order's menu items are fetched.
     */
    public enum ItemLoading {
        /**
         * Every item of each order, whether it matched the price or not.
         */
        ALL_ITEMS,
        /**
         * Only the items the join and filter kept.
         */
        MATCHING_ITEMS
    }

    private final Session session;

    public OrderQueryComposer(Session session) {
        this.session = session;
    }

    public Query<Order> compose(int price) {
        return compose(price, ItemLoading.ALL_ITEMS);
    }

    public Query<Order> compose(int price, ItemLoading itemLoading) {
        Fetch items = itemLoading == ItemLoading.MATCHING_ITEMS
                ? Fetch.containsEager(Order.MENU_ITEMS)
                : Fetch.joined(Order.MENU_ITEMS);
        return session.query(Order.class)
                .join(Order.MENU_ITEMS)
                .join(MenuItem.FOOD_TRUCK)
                .filter(MenuItem.PRICE.eq(price))
                .options(
                        items,
                        Fetch.joined(Order.CUSTOMER),
                        Fetch.joined(Order.EMPLOYEE).then(Employee.FOOD_TRUCK));
    }
}
