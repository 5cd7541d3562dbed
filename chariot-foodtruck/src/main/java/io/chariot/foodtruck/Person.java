package io.chariot.foodtruck;

import io.chariot.query.Attribute;
import io.chariot.schema.Discriminators;
import jakarta.persistence.DiscriminatorColumn;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Inheritance;
import jakarta.persistence.InheritanceType;
import jakarta.persistence.Table;

/**
 * An individual: staff or patron. Both name parts are optional.
 */
@Entity
@Table(name = "person")
@Inheritance(strategy = InheritanceType.JOINED)
@DiscriminatorColumn(name = "type")
public sealed interface Person permits PlainPerson, Employee, Customer {

    String MISSING_NAME = "NA";

    Attribute<Person, String> FIRST_NAME = Attribute.of(Person.class, "firstName", String.class);
    Attribute<Person, String> LAST_NAME = Attribute.of(Person.class, "lastName", String.class);

    @Id
    @GeneratedValue
    Long id();

    String firstName();

    String lastName();

    /**
     * {@code "<last>, <first>"} with {@code NA} for a missing part. Not stored.
     */
    default String displayName() {
        return (lastName() == null ? MISSING_NAME : lastName()) + ", "
                + (firstName() == null ? MISSING_NAME : firstName());
    }

    default String type() {
        return Discriminators.valueOf(getClass());
    }
}
