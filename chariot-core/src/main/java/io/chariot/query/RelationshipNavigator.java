package io.chariot.query;

import io.chariot.schema.EntityMetadata;
import io.chariot.schema.RelationshipMapping;
import io.chariot.schema.RelationshipMapping.JoinTableMapping;
import io.chariot.storage.HeapTable;
import io.chariot.storage.Store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks relationships over committed rows using the store's primary-key and foreign-key indexes.
 * Works on ids only; nothing is materialized here.
 */
final class RelationshipNavigator {

    private final EntitySource source;

    RelationshipNavigator(EntitySource source) {
        this.source = source;
    }

    /**
     * Target ids for a batch of source ids, one indexed lookup per source, in source order.
     */
    Map<Object, List<Object>> targets(Relationship<?, ?> relationship,
                                      RelationshipMapping mapping,
                                      Collection<Object> sourceIds) {
        Map<Object, List<Object>> targets = new LinkedHashMap<>();
        for (Object sourceId : sourceIds) {
            targets.put(sourceId, targets(relationship, mapping, sourceId));
        }
        return targets;
    }

    /**
     * Ids of the entities a source reaches through the relationship, restricted to instances of
     * the relationship's target type, in store order.
     */
    List<Object> targets(Relationship<?, ?> relationship, RelationshipMapping mapping, Object sourceId) {
        Store store = source.store();
        List<Object> ids = new ArrayList<>();
        switch (relationship.direction()) {
            case TO_ONE -> {
                HeapTable table = store.table(mapping.table());
                int row = table.findById(sourceId);
                Object key = row < 0 ? null : table.value(row, mapping.column());
                if (key != null) {
                    ids.add(key);
                }
            }
            case TO_MANY -> {
                JoinTableMapping joinTable = mapping.joinTable();
                HeapTable junction = store.table(joinTable.name());
                for (int row : junction.lookup(joinTable.joinColumn(), sourceId)) {
                    ids.add(junction.value(row, joinTable.inverseJoinColumn()));
                }
            }
            case INVERSE -> {
                if (mapping.kind() == RelationshipMapping.Kind.MANY_TO_ONE) {
                    HeapTable table = store.table(mapping.table());
                    String idColumn = source.schema().metadata(mapping.declaringType()).id().column();
                    for (int row : table.lookup(mapping.column(), sourceId)) {
                        ids.add(table.value(row, idColumn));
                    }
                } else {
                    JoinTableMapping joinTable = mapping.joinTable();
                    HeapTable junction = store.table(joinTable.name());
                    for (int row : junction.lookup(joinTable.inverseJoinColumn(), sourceId)) {
                        ids.add(junction.value(row, joinTable.joinColumn()));
                    }
                }
            }
        }
        ids.removeIf(id -> !isInstance(relationship.target(), id));
        return ids;
    }

    /**
     * Whether a committed row with the id exists and holds an instance of the type.
     */
    boolean isInstance(Class<?> type, Object id) {
        EntityMetadata metadata = source.schema().metadata(type);
        HeapTable base = source.store().table(metadata.table());
        int row = base.findById(id);
        return row >= 0 && holds(metadata, type, base, row);
    }

    /**
     * Whether a base-table row holds an instance of the type, judged by its discriminator.
     */
    static boolean holds(EntityMetadata metadata, Class<?> type, HeapTable base, int row) {
        if (!metadata.isPolymorphic() || type == metadata.entityType()) {
            return true;
        }
        Object tag = base.value(row, metadata.discriminatorColumn());
        return metadata.variantFor((String) tag)
                .map(variant -> type.isAssignableFrom(variant.type()))
                .orElse(false);
    }
}
