package io.chariot.foodtruck;

import io.chariot.query.Relationship;
import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Staff of at most one food truck.
 */
@DiscriminatorValue("employee")
@Table(name = "employee")
public record Employee(Long id,
                       String firstName,
                       String lastName,
                       @ManyToOne(targetEntity = FoodTruck.class) @JoinColumn(name = "food_truck_id") Long foodTruckId)
        implements Person {

    public static final Relationship<Employee, FoodTruck> FOOD_TRUCK =
            Relationship.toOne(Employee.class, "foodTruckId", FoodTruck.class);
    public static final Relationship<Employee, Order> ORDERS_SERVED =
            Relationship.inverse(Employee.class, "ordersServed", Order.EMPLOYEE);

    public static Employee of(String firstName, String lastName, FoodTruck foodTruck) {
        return new Employee(null, firstName, lastName, foodTruck == null ? null : foodTruck.id());
    }
}
