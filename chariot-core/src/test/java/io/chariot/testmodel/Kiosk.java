package io.chariot.testmodel;

import jakarta.persistence.DiscriminatorValue;

@DiscriminatorValue("kiosk")
public record Kiosk(Long id, String name) implements Shop {
}
