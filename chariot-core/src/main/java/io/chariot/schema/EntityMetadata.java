package io.chariot.schema;

import io.chariot.storage.ColumnDefinition;
import io.chariot.storage.ForeignKeyDefinition;
import io.chariot.storage.TableDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Mapping of one entity family: its base table, variants and owned relationships.
 * <p>
 * A polymorphic family (a sealed interface with joined inheritance) stores every variant in the
 * base table tagged by the discriminator column; variants with extra properties add a
 * specialization table keyed by the same id. A plain record entity is a family of one variant
 * without discriminator.
 */
public final class EntityMetadata {

    private final Class<?> entityType;
    private final String table;
    private final PropertyMapping id;
    private final String discriminatorColumn;
    private final List<PropertyMapping> baseProperties;
    private final List<VariantMapping> variants;
    private final List<RelationshipMapping> relationships;

    EntityMetadata(Class<?> entityType,
                   String table,
                   PropertyMapping id,
                   String discriminatorColumn,
                   List<PropertyMapping> baseProperties,
                   List<VariantMapping> variants,
                   List<RelationshipMapping> relationships) {
        this.entityType = entityType;
        this.table = table;
        this.id = id;
        this.discriminatorColumn = discriminatorColumn;
        this.baseProperties = List.copyOf(baseProperties);
        this.variants = List.copyOf(variants);
        this.relationships = List.copyOf(relationships);
    }

    /**
     * The family root: the sealed interface, or the record for non-polymorphic entities.
     */
    public Class<?> entityType() {
        return entityType;
    }

    public String table() {
        return table;
    }

    public PropertyMapping id() {
        return id;
    }

    public boolean isPolymorphic() {
        return discriminatorColumn != null;
    }

    /**
     * @return the discriminator column, or null for non-polymorphic entities
     */
    public String discriminatorColumn() {
        return discriminatorColumn;
    }

    /**
     * Properties stored in the base table, id first.
     */
    public List<PropertyMapping> baseProperties() {
        return baseProperties;
    }

    public List<VariantMapping> variants() {
        return variants;
    }

    public List<RelationshipMapping> relationships() {
        return relationships;
    }

    /**
     * Whether instances of the type belong to this family: the root itself or one of its variants.
     */
    public boolean covers(Class<?> type) {
        if (type == entityType) {
            return true;
        }
        for (VariantMapping variant : variants) {
            if (variant.type() == type) {
                return true;
            }
        }
        return false;
    }

    public VariantMapping variantOf(Class<?> type) {
        for (VariantMapping variant : variants) {
            if (variant.type() == type) {
                return variant;
            }
        }
        throw new IllegalArgumentException(type.getName() + " is not a variant of " + entityType.getName());
    }

    public Optional<VariantMapping> variantFor(String discriminatorValue) {
        for (VariantMapping variant : variants) {
            if (discriminatorValue == null ? variant.discriminatorValue() == null
                    : discriminatorValue.equals(variant.discriminatorValue())) {
                return Optional.of(variant);
            }
        }
        return Optional.empty();
    }

    /**
     * Variants an instance of the type can be: every variant for the root, otherwise the type itself.
     */
    public List<VariantMapping> variantsCoveredBy(Class<?> type) {
        if (type == entityType) {
            return variants;
        }
        return List.of(variantOf(type));
    }

    /**
     * Look up a property visible on the type: base properties, then the variant's own.
     */
    public Optional<PropertyMapping> property(Class<?> type, String property) {
        for (PropertyMapping mapping : baseProperties) {
            if (mapping.property().equals(property)) {
                return Optional.of(mapping);
            }
        }
        if (type != entityType) {
            for (PropertyMapping mapping : variantOf(type).properties()) {
                if (mapping.property().equals(property)) {
                    return Optional.of(mapping);
                }
            }
        }
        return Optional.empty();
    }

    public Optional<RelationshipMapping> relationship(String property) {
        for (RelationshipMapping relationship : relationships) {
            if (relationship.property().equals(property)) {
                return Optional.of(relationship);
            }
        }
        return Optional.empty();
    }

    /**
     * Table holding rows of the type: the variant's specialization table when it has one,
     * the base table otherwise.
     */
    public String tableFor(Class<?> type) {
        if (type == entityType) {
            return table;
        }
        VariantMapping variant = variantOf(type);
        return variant.hasTable() ? variant.table() : table;
    }

    /**
     * Base table first, then one specialization table per variant that declares one.
     */
    public List<TableDefinition> tableDefinitions() {
        List<TableDefinition> definitions = new ArrayList<>();
        definitions.add(new TableDefinition(table, baseColumns(), id.column(), foreignKeysIn(table)));
        for (VariantMapping variant : variants) {
            if (!variant.hasTable()) {
                continue;
            }
            List<ColumnDefinition> columns = new ArrayList<>();
            columns.add(new ColumnDefinition(id.column(), id.type(), false, false));
            for (PropertyMapping property : variant.properties()) {
                columns.add(new ColumnDefinition(property.column(), property.type(), property.nullable(),
                        property.unique()));
            }
            List<ForeignKeyDefinition> keys = new ArrayList<>();
            keys.add(new ForeignKeyDefinition(id.column(), table, id.column()));
            keys.addAll(foreignKeysIn(variant.table()));
            definitions.add(new TableDefinition(variant.table(), columns, id.column(), keys));
        }
        return definitions;
    }

    private List<ColumnDefinition> baseColumns() {
        List<ColumnDefinition> columns = new ArrayList<>();
        columns.add(new ColumnDefinition(id.column(), id.type(), false, false));
        if (discriminatorColumn != null) {
            columns.add(new ColumnDefinition(discriminatorColumn, String.class, false, false));
        }
        for (PropertyMapping property : baseProperties) {
            if (!property.id()) {
                columns.add(new ColumnDefinition(property.column(), property.type(), property.nullable(),
                        property.unique()));
            }
        }
        return columns;
    }

    private List<ForeignKeyDefinition> foreignKeysIn(String tableName) {
        List<ForeignKeyDefinition> keys = new ArrayList<>();
        for (RelationshipMapping relationship : relationships) {
            if (relationship.kind() == RelationshipMapping.Kind.MANY_TO_ONE && relationship.table().equals(tableName)) {
                keys.add(new ForeignKeyDefinition(relationship.column(), relationship.targetTable(),
                        relationship.targetColumn()));
            }
        }
        return keys;
    }

    /**
     * Junction tables of the many-to-many relationships this family owns.
     */
    public List<TableDefinition> junctionDefinitions() {
        List<TableDefinition> definitions = new ArrayList<>();
        for (RelationshipMapping relationship : relationships) {
            if (relationship.kind() != RelationshipMapping.Kind.MANY_TO_MANY) {
                continue;
            }
            RelationshipMapping.JoinTableMapping joinTable = relationship.joinTable();
            List<ColumnDefinition> columns = List.of(
                    new ColumnDefinition(joinTable.joinColumn(), id.type(), false, false),
                    new ColumnDefinition(joinTable.inverseJoinColumn(), Object.class, false, false));
            List<ForeignKeyDefinition> keys = List.of(
                    new ForeignKeyDefinition(joinTable.joinColumn(), relationship.table(), id.column()),
                    new ForeignKeyDefinition(joinTable.inverseJoinColumn(), relationship.targetTable(),
                            relationship.targetColumn()));
            definitions.add(new TableDefinition(joinTable.name(), columns, null, keys));
        }
        return definitions;
    }

    @Override
    public String toString() {
        return "EntityMetadata{" + entityType.getSimpleName() + " -> " + table + "}";
    }
}
