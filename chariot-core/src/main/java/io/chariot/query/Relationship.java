package io.chariot.query;

import io.chariot.core.QueryConstructionException;
import io.chariot.schema.EntityMetadata;
import io.chariot.schema.RelationshipMapping;
import io.chariot.schema.Schema;
import io.chariot.util.NamingUtils;

/**
 * A typed, navigable relationship between two entity types.
 * <p>
 * {@link Direction#TO_ONE} and {@link Direction#TO_MANY} name an owning property (a foreign-key
 * id or a junction id list) of the source type. {@link Direction#INVERSE} walks an owning
 * relationship backwards, through the foreign-key index or the junction table.
 *
 * @param source    the type navigated from
 * @param name      the relationship name, e.g. {@code menuItems}
 * @param target    the type navigated to
 * @param direction how the relationship is stored
 * @param property  the owning property for TO_ONE and TO_MANY, null for INVERSE
 * @param owning    the walked-back relationship for INVERSE, null otherwise
 * @param <S>       source type
 * @param <T>       target type
 */
public record Relationship<S, T>(Class<S> source,
                                 String name,
                                 Class<T> target,
                                 Direction direction,
                                 String property,
                                 Relationship<T, S> owning) {

    public enum Direction {
        TO_ONE,
        TO_MANY,
        INVERSE
    }

    public Relationship {
        if (source == null || target == null) {
            throw new IllegalArgumentException("source and target required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name required");
        }
        if (direction == null) {
            throw new IllegalArgumentException("direction required");
        }
        if (direction == Direction.INVERSE) {
            if (owning == null || owning.direction() == Direction.INVERSE) {
                throw new IllegalArgumentException("owning relationship required for " + direction);
            }
        } else if (property == null || property.isBlank()) {
            throw new IllegalArgumentException("property required for " + direction);
        }
    }

    /**
     * Many-to-one through a foreign-key property of the source, named after the property
     * ({@code foodTruckId} becomes {@code foodTruck}).
     */
    public static <S, T> Relationship<S, T> toOne(Class<S> source, String property, Class<T> target) {
        return new Relationship<>(source, NamingUtils.relationshipName(property), target, Direction.TO_ONE,
                property, null);
    }

    /**
     * Many-to-many through a junction id-list property of the source.
     */
    public static <S, T> Relationship<S, T> toMany(Class<S> source, String property, Class<T> target) {
        return new Relationship<>(source, NamingUtils.relationshipName(property), target, Direction.TO_MANY,
                property, null);
    }

    /**
     * The reverse of an owning relationship: from its target back to every source referencing it.
     */
    public static <S, T> Relationship<S, T> inverse(Class<S> source, String name, Relationship<T, S> owning) {
        return new Relationship<>(source, name, owning.source(), Direction.INVERSE, null, owning);
    }

    public boolean isCollection() {
        return direction != Direction.TO_ONE;
    }

    /**
     * The stored mapping behind this relationship.
     *
     * @throws QueryConstructionException if no matching owning property is mapped
     */
    public RelationshipMapping mapping(Schema schema) {
        Relationship<?, ?> stored = direction == Direction.INVERSE ? owning : this;
        EntityMetadata metadata = schema.find(stored.source())
                .orElseThrow(() -> new QueryConstructionException(stored.source().getName()
                        + " is not a mapped entity (" + this + ")"));
        RelationshipMapping mapping = metadata.relationship(stored.property())
                .orElseThrow(() -> new QueryConstructionException("No relationship mapped on "
                        + stored.source().getSimpleName() + "." + stored.property()));
        RelationshipMapping.Kind expected = stored.direction() == Direction.TO_ONE
                ? RelationshipMapping.Kind.MANY_TO_ONE
                : RelationshipMapping.Kind.MANY_TO_MANY;
        if (mapping.kind() != expected) {
            throw new QueryConstructionException(this + " expects " + expected + " but "
                    + stored.source().getSimpleName() + "." + stored.property() + " is " + mapping.kind());
        }
        if (!mapping.declaringType().isAssignableFrom(stored.source())) {
            throw new QueryConstructionException(stored.source().getSimpleName() + " has no property "
                    + stored.property() + " (declared on " + mapping.declaringType().getSimpleName() + ")");
        }
        if (!stored.target().isAssignableFrom(mapping.targetType())
                && !mapping.targetType().isAssignableFrom(stored.target())) {
            throw new QueryConstructionException(this + " targets " + stored.target().getSimpleName()
                    + " but the mapping targets " + mapping.targetType().getSimpleName());
        }
        return mapping;
    }

    @Override
    public String toString() {
        return source.getSimpleName() + "." + name;
    }
}
