package io.chariot.schema;

import io.chariot.core.ChariotException;
import io.chariot.storage.TableDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The set of mapped entity families a store is created from.
 * <p>
 * Resolves any variant class to its family and checks that every relationship targets a mapped
 * entity and that no two families claim the same table.
 */
public final class Schema {

    private final Map<Class<?>, EntityMetadata> families;
    private final Map<Class<?>, EntityMetadata> byType;

    private Schema(Map<Class<?>, EntityMetadata> families) {
        this.families = Collections.unmodifiableMap(families);
        Map<Class<?>, EntityMetadata> types = new LinkedHashMap<>();
        Map<String, Class<?>> tableOwners = new LinkedHashMap<>();
        for (EntityMetadata metadata : families.values()) {
            types.put(metadata.entityType(), metadata);
            for (VariantMapping variant : metadata.variants()) {
                types.put(variant.type(), metadata);
            }
            for (TableDefinition table : metadata.tableDefinitions()) {
                Class<?> previous = tableOwners.putIfAbsent(table.name(), metadata.entityType());
                if (previous != null) {
                    throw new ChariotException("Table " + table.name() + " is mapped by both "
                            + previous.getName() + " and " + metadata.entityType().getName());
                }
            }
        }
        this.byType = Collections.unmodifiableMap(types);
        for (EntityMetadata metadata : families.values()) {
            for (RelationshipMapping relationship : metadata.relationships()) {
                if (!byType.containsKey(relationship.targetType())) {
                    throw new ChariotException("Relationship " + relationship.declaringType().getSimpleName() + "."
                            + relationship.property() + " targets unmapped entity "
                            + relationship.targetType().getName());
                }
            }
        }
    }

    /**
     * Build a schema from entity family roots (sealed interfaces or records).
     *
     * @throws ChariotException if a declaration is malformed or references an unmapped entity
     */
    public static Schema of(Class<?>... entityTypes) {
        return of(List.of(entityTypes));
    }

    public static Schema of(Collection<Class<?>> entityTypes) {
        Map<Class<?>, EntityMetadata> families = new LinkedHashMap<>();
        for (Class<?> entityType : entityTypes) {
            if (families.containsKey(entityType)) {
                continue;
            }
            families.put(entityType, MetadataExtractor.extractEntityMetadata(entityType));
        }
        return new Schema(families);
    }

    public Collection<EntityMetadata> entities() {
        return families.values();
    }

    /**
     * Metadata of the family a root or variant type belongs to.
     */
    public Optional<EntityMetadata> find(Class<?> type) {
        return Optional.ofNullable(byType.get(type));
    }

    public EntityMetadata metadata(Class<?> type) {
        EntityMetadata metadata = byType.get(type);
        if (metadata == null) {
            throw new ChariotException(type.getName() + " is not a mapped entity");
        }
        return metadata;
    }

    public boolean isMapped(Class<?> type) {
        return byType.containsKey(type);
    }

    /**
     * Every table of the schema: each family's base and specialization tables, then the junction
     * tables, each once.
     */
    public List<TableDefinition> tableDefinitions() {
        List<TableDefinition> definitions = new ArrayList<>();
        Map<String, TableDefinition> junctions = new LinkedHashMap<>();
        for (EntityMetadata metadata : families.values()) {
            definitions.addAll(metadata.tableDefinitions());
            for (TableDefinition junction : metadata.junctionDefinitions()) {
                junctions.putIfAbsent(junction.name(), junction);
            }
        }
        definitions.addAll(junctions.values());
        return definitions;
    }

    @Override
    public String toString() {
        return "Schema" + families.keySet().stream().map(Class::getSimpleName).toList();
    }
}
