package io.chariot.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable structured query plan. Nodes nest as
 * {@code Eager*(Filter?(Join*(Scan)))}: the scan of the root type, inner joins in declaration
 * order, at most one filter over the joined rows, then eager-fetch directives.
 */
public sealed interface QueryPlan permits QueryPlan.Scan, QueryPlan.Join, QueryPlan.Filter, QueryPlan.Eager {

    record Scan(Class<?> entityType) implements QueryPlan {
        public Scan {
            if (entityType == null) {
                throw new IllegalArgumentException("entityType required");
            }
        }
    }

    record Join(QueryPlan child, Relationship<?, ?> relationship) implements QueryPlan {
        public Join {
            if (child == null) {
                throw new IllegalArgumentException("child required");
            }
            if (relationship == null) {
                throw new IllegalArgumentException("relationship required");
            }
        }
    }

    record Filter(QueryPlan child, Condition condition) implements QueryPlan {
        public Filter {
            if (child == null) {
                throw new IllegalArgumentException("child required");
            }
            if (condition == null) {
                throw new IllegalArgumentException("condition required");
            }
        }
    }

    record Eager(QueryPlan child, Fetch fetch) implements QueryPlan {
        public Eager {
            if (child == null) {
                throw new IllegalArgumentException("child required");
            }
            if (fetch == null) {
                throw new IllegalArgumentException("fetch required");
            }
        }
    }

    default Class<?> rootType() {
        QueryPlan node = this;
        while (!(node instanceof Scan)) {
            node = child(node);
        }
        return ((Scan) node).entityType();
    }

    /**
     * Inner joins, in the order they were added.
     */
    default List<Relationship<?, ?>> joins() {
        List<Relationship<?, ?>> joins = new ArrayList<>();
        for (QueryPlan node = this; !(node instanceof Scan); node = child(node)) {
            if (node instanceof Join join) {
                joins.add(join.relationship());
            }
        }
        Collections.reverse(joins);
        return joins;
    }

    /**
     * The filter condition, or null when the plan has none.
     */
    default Condition condition() {
        for (QueryPlan node = this; !(node instanceof Scan); node = child(node)) {
            if (node instanceof Filter filter) {
                return filter.condition();
            }
        }
        return null;
    }

    /**
     * Eager-fetch directives, in the order they were added.
     */
    default List<Fetch> fetches() {
        List<Fetch> fetches = new ArrayList<>();
        for (QueryPlan node = this; !(node instanceof Scan); node = child(node)) {
            if (node instanceof Eager eager) {
                fetches.add(eager.fetch());
            }
        }
        Collections.reverse(fetches);
        return fetches;
    }

    private static QueryPlan child(QueryPlan node) {
        if (node instanceof Join join) {
            return join.child();
        }
        if (node instanceof Filter filter) {
            return filter.child();
        }
        if (node instanceof Eager eager) {
            return eager.child();
        }
        throw new IllegalStateException("Scan has no child");
    }
}
