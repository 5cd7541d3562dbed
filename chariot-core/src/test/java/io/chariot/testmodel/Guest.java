package io.chariot.testmodel;

import jakarta.persistence.DiscriminatorValue;

@DiscriminatorValue("guest")
public record Guest(Long id, String nickname) implements Member {
}
