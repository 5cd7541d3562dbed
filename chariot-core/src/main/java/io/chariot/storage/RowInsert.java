package io.chariot.storage;

import java.util.Arrays;

/**
 * One pending row, values in the table's column order.
 */
public record RowInsert(String table, Object[] values) {
    public RowInsert {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table required");
        }
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        values = values.clone();
    }

    @Override
    public Object[] values() {
        return values.clone();
    }

    @Override
    public String toString() {
        return "RowInsert{" + table + " " + Arrays.toString(values) + "}";
    }
}
