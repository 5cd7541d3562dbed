package io.chariot.query;

import io.chariot.schema.EntityMetadata;
import io.chariot.schema.Schema;
import io.chariot.storage.Store;

/**
 * What a query reads from: the committed rows of a store, materialized into identity-mapped
 * entity instances.
 */
public interface EntitySource {

    Schema schema();

    Store store();

    /**
     * The single instance for a committed row of an entity family.
     *
     * @param family the family metadata
     * @param id     the row id
     * @return the entity, or null if no row has the id
     */
    Object load(EntityMetadata family, Object id);

    /**
     * Called before a plan runs.
     */
    default void executing(QueryPlan plan) {
    }
}
