package io.chariot.query;

import io.chariot.core.RelationshipAbsentException;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relationships materialized by a query, keyed by source entity instance.
 * <p>
 * Reading a relationship that was fetched for an entity returns its targets, possibly none.
 * Reading one that was not fetched raises {@link RelationshipAbsentException}; nothing is loaded
 * lazily.
 */
public final class EntityGraph {

    private final Map<Relationship<?, ?>, Map<Object, List<Object>>> fetched = new HashMap<>();

    void put(Relationship<?, ?> relationship, Object source, List<Object> targets) {
        fetched.computeIfAbsent(relationship, ignored -> new IdentityHashMap<>())
                .putIfAbsent(source, List.copyOf(targets));
    }

    public boolean isFetched(Object source, Relationship<?, ?> relationship) {
        Map<Object, List<Object>> bySource = fetched.get(relationship);
        return bySource != null && bySource.containsKey(source);
    }

    /**
     * The target of a to-one relationship.
     *
     * @return the target, or empty when the fetched relationship has none
     * @throws RelationshipAbsentException if the relationship was not fetched for the source
     */
    public <S, T> Optional<T> one(S source, Relationship<S, T> relationship) {
        if (relationship.isCollection()) {
            throw new IllegalArgumentException(relationship + " is a collection, use many()");
        }
        List<Object> targets = targets(source, relationship);
        return targets.isEmpty() ? Optional.empty() : Optional.of(relationship.target().cast(targets.get(0)));
    }

    /**
     * The targets of a relationship, in store order.
     *
     * @throws RelationshipAbsentException if the relationship was not fetched for the source
     */
    @SuppressWarnings("unchecked")
    public <S, T> List<T> many(S source, Relationship<S, T> relationship) {
        return (List<T>) targets(source, relationship);
    }

    private List<Object> targets(Object source, Relationship<?, ?> relationship) {
        Map<Object, List<Object>> bySource = fetched.get(relationship);
        List<Object> targets = bySource == null ? null : bySource.get(source);
        if (targets == null) {
            throw new RelationshipAbsentException(relationship.toString(),
                    "Relationship " + relationship + " was not fetched for " + source);
        }
        return targets;
    }
}
