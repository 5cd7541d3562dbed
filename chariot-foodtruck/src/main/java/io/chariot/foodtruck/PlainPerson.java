package io.chariot.foodtruck;

import jakarta.persistence.DiscriminatorValue;

@DiscriminatorValue("person")
public record PlainPerson(Long id, String firstName, String lastName) implements Person {
}
