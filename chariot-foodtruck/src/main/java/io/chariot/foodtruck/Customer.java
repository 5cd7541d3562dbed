package io.chariot.foodtruck;

import io.chariot.query.Relationship;
import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Table;

@DiscriminatorValue("customer")
@Table(name = "customer")
public record Customer(Long id, String firstName, String lastName) implements Person {

    public static final Relationship<Customer, Order> ORDERS_REQUESTED =
            Relationship.inverse(Customer.class, "ordersRequested", Order.CUSTOMER);
}
