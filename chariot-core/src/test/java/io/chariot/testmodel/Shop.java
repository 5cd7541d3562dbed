package io.chariot.testmodel;

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

@Entity
@Table(name = "shop")
@Inheritance(strategy = InheritanceType.JOINED)
@DiscriminatorColumn(name = "kind")
public sealed interface Shop permits Kiosk, Bakery {

    Attribute<Shop, String> NAME = Attribute.of(Shop.class, "name", String.class);
    Relationship<Shop, Product> PRODUCTS = Relationship.inverse(Shop.class, "products", Product.SHOP);
    Relationship<Shop, Clerk> CLERKS = Relationship.inverse(Shop.class, "clerks", Clerk.SHOP);

    @Id
    @GeneratedValue
    Long id();

    @Column(unique = true, nullable = false)
    String name();

    default String kind() {
        return Discriminators.valueOf(getClass());
    }
}
