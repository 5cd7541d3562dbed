package io.chariot.storage;

public record ColumnDefinition(String name, Class<?> type, boolean nullable, boolean unique) {
    public ColumnDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name required");
        }
        if (type == null) {
            throw new IllegalArgumentException("type required");
        }
    }
}
