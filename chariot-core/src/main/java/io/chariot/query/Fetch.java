package io.chariot.query;

import io.chariot.core.QueryConstructionException;

import java.util.ArrayList;
import java.util.List;

/**
 * An eager-fetch directive: a path of relationships, starting at the query root, whose targets
 * are materialized with the query result.
 *
 * @param strategy how the path is populated
 * @param path     relationships, each starting where the previous one ends
 */
public record Fetch(Strategy strategy, List<Relationship<?, ?>> path) {

    public enum Strategy {
        /**
         * Load the complete related collection, independent of joins and filters.
         */
        JOINED,
        /**
         * Populate from the rows the query already joined and filtered. Every relationship on the
         * path must also be a join of the query.
         */
        CONTAINS_EAGER
    }

    public Fetch {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy required");
        }
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("path required");
        }
        path = List.copyOf(path);
    }

    public static Fetch joined(Relationship<?, ?> relationship) {
        return new Fetch(Strategy.JOINED, List.of(relationship));
    }

    public static Fetch containsEager(Relationship<?, ?> relationship) {
        return new Fetch(Strategy.CONTAINS_EAGER, List.of(relationship));
    }

    /**
     * Extend the path by one relationship starting at the current end.
     *
     * @throws QueryConstructionException if the relationship does not start at the current end
     */
    public Fetch then(Relationship<?, ?> next) {
        Relationship<?, ?> last = last();
        if (!next.source().isAssignableFrom(last.target())) {
            throw new QueryConstructionException("Cannot fetch " + next + " after " + last + ": "
                    + last.target().getSimpleName() + " is not a " + next.source().getSimpleName());
        }
        List<Relationship<?, ?>> extended = new ArrayList<>(path);
        extended.add(next);
        return new Fetch(strategy, extended);
    }

    public Relationship<?, ?> first() {
        return path.get(0);
    }

    public Relationship<?, ?> last() {
        return path.get(path.size() - 1);
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder(strategy == Strategy.JOINED ? "joined(" : "containsEager(");
        for (int i = 0; i < path.size(); i++) {
            if (i > 0) {
                out.append(" -> ");
            }
            out.append(path.get(i));
        }
        return out.append(')').toString();
    }
}
