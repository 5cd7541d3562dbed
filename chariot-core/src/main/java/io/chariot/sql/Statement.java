package io.chariot.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SQL text with {@code ?} placeholders and the values bound to them, in order.
 */
public record Statement(String sql, List<Object> parameters) {

    public Statement {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("sql required");
        }
        // bound values may be null
        parameters = parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    @Override
    public String toString() {
        return parameters.isEmpty() ? sql : sql + " " + parameters;
    }
}
