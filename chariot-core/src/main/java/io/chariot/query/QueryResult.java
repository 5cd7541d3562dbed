package io.chariot.query;

import java.util.List;

/**
 * Result of an executed query: distinct root entities in store order plus the fetched graph.
 */
public record QueryResult<T>(List<T> roots, EntityGraph graph) {

    public QueryResult {
        if (roots == null) {
            throw new IllegalArgumentException("roots required");
        }
        if (graph == null) {
            throw new IllegalArgumentException("graph required");
        }
        roots = List.copyOf(roots);
    }

    public boolean isEmpty() {
        return roots.isEmpty();
    }
}
