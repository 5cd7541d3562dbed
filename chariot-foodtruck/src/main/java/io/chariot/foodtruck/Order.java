package io.chariot.foodtruck;

import io.chariot.query.Relationship;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import java.util.ArrayList;
import java.util.List;

/**
 * A transaction: menu items requested by a customer and served by an employee. Both people are
 * optional. Items are linked through {@code menu_item_orders}.
 */
@Entity
@Table(name = "order")
public record Order(@Id @GeneratedValue Long id,
                    @ManyToOne(targetEntity = Employee.class) @JoinColumn(name = "employee_id") Long employeeId,
                    @ManyToOne(targetEntity = Customer.class) @JoinColumn(name = "customer_id") Long customerId,
                    @ManyToMany(targetEntity = MenuItem.class)
                    @JoinTable(name = "menu_item_orders",
                            joinColumns = @JoinColumn(name = "order_id"),
                            inverseJoinColumns = @JoinColumn(name = "menu_item_id"))
                    List<Long> menuItemIds) {

    public static final Relationship<Order, MenuItem> MENU_ITEMS =
            Relationship.toMany(Order.class, "menuItemIds", MenuItem.class);
    public static final Relationship<Order, Employee> EMPLOYEE =
            Relationship.toOne(Order.class, "employeeId", Employee.class);
    public static final Relationship<Order, Customer> CUSTOMER =
            Relationship.toOne(Order.class, "customerId", Customer.class);

    public Order {
        menuItemIds = menuItemIds == null ? List.of() : List.copyOf(menuItemIds);
    }

    public static Order of(Employee employee, Customer customer, MenuItem... menuItems) {
        List<Long> ids = new ArrayList<>(menuItems.length);
        for (MenuItem menuItem : menuItems) {
            ids.add(menuItem.id());
        }
        return new Order(null, employee == null ? null : employee.id(), customer == null ? null : customer.id(), ids);
    }
}
