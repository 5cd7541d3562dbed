package io.chariot.schema;

import io.chariot.core.ChariotException;
import jakarta.persistence.DiscriminatorValue;

/**
 * Discriminator tags of variant records, for the {@code type()} default method of entity families.
 */
public final class Discriminators {

    private static final ClassValue<String> VALUES = new ClassValue<>() {
        @Override
        protected String computeValue(Class<?> type) {
            DiscriminatorValue value = type.getAnnotation(DiscriminatorValue.class);
            if (value == null) {
                throw new ChariotException(type.getName() + " declares no @DiscriminatorValue");
            }
            return value.value();
        }
    };

    private Discriminators() {
    }

    public static String valueOf(Class<?> variantType) {
        return VALUES.get(variantType);
    }
}
