package io.chariot.session;

import io.chariot.core.ChariotException;
import io.chariot.schema.EntityMetadata;
import io.chariot.schema.PropertyMapping;
import io.chariot.schema.RelationshipMapping;
import io.chariot.schema.VariantMapping;
import io.chariot.storage.HeapTable;
import io.chariot.storage.Store;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds entity records from committed rows: the base row selects the variant by discriminator,
 * the specialization row and junction rows fill in the rest.
 */
final class EntityMaterializer {

    private final Store store;

    EntityMaterializer(Store store) {
        this.store = store;
    }

    /**
     * @return the entity, or null when the base table has no row with the id
     */
    Object materialize(EntityMetadata metadata, Object id) {
        HeapTable base = store.table(metadata.table());
        int row = base.findById(id);
        if (row < 0) {
            return null;
        }
        VariantMapping variant = variantOf(metadata, base, row);
        Map<String, Object> values = new HashMap<>();
        for (PropertyMapping property : metadata.baseProperties()) {
            values.put(property.property(), base.value(row, property.column()));
        }
        if (variant.hasTable()) {
            HeapTable specialization = store.table(variant.table());
            int variantRow = specialization.findById(id);
            if (variantRow < 0) {
                throw new ChariotException("No " + variant.table() + " row for " + metadata.table() + " id " + id);
            }
            for (PropertyMapping property : variant.properties()) {
                values.put(property.property(), specialization.value(variantRow, property.column()));
            }
        }
        for (RelationshipMapping relationship : metadata.relationships()) {
            if (relationship.isCollection() && owns(metadata, variant, relationship)) {
                values.put(relationship.property(), junctionTargets(relationship, id));
            }
        }
        return variant.instantiate(values);
    }

    private List<Object> junctionTargets(RelationshipMapping relationship, Object id) {
        RelationshipMapping.JoinTableMapping joinTable = relationship.joinTable();
        HeapTable junction = store.table(joinTable.name());
        List<Object> targets = new ArrayList<>();
        for (int row : junction.lookup(joinTable.joinColumn(), id)) {
            targets.add(junction.value(row, joinTable.inverseJoinColumn()));
        }
        return targets;
    }

    private static VariantMapping variantOf(EntityMetadata metadata, HeapTable base, int row) {
        if (!metadata.isPolymorphic()) {
            return metadata.variants().get(0);
        }
        Object tag = base.value(row, metadata.discriminatorColumn());
        return metadata.variantFor((String) tag)
                .orElseThrow(() -> new ChariotException("Unknown " + metadata.discriminatorColumn() + " '" + tag
                        + "' in " + metadata.table()));
    }

    /**
     * Whether a relationship is a property of the variant: declared on the family root or on the
     * variant itself.
     */
    static boolean owns(EntityMetadata metadata, VariantMapping variant, RelationshipMapping relationship) {
        return relationship.declaringType() == metadata.entityType() || relationship.declaringType() == variant.type();
    }
}
