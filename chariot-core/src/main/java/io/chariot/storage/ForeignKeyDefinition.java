package io.chariot.storage;

public record ForeignKeyDefinition(String column, String referencedTable, String referencedColumn) {
    public ForeignKeyDefinition {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column required");
        }
        if (referencedTable == null || referencedTable.isBlank()) {
            throw new IllegalArgumentException("referencedTable required");
        }
        if (referencedColumn == null || referencedColumn.isBlank()) {
            throw new IllegalArgumentException("referencedColumn required");
        }
    }
}
