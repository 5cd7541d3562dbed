package io.chariot.schema;

import io.chariot.core.ChariotException;
import io.chariot.schema.RelationshipMapping.JoinTableMapping;
import io.chariot.schema.RelationshipMapping.Kind;
import io.chariot.util.NamingUtils;
import jakarta.persistence.Column;
import jakarta.persistence.DiscriminatorColumn;
import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Inheritance;
import jakarta.persistence.InheritanceType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts mapping metadata from annotated entity types. All reflection happens here, once per
 * entity family.
 * <p>
 * Two shapes are accepted:
 * <ul>
 * <li>a sealed interface annotated {@code @Entity}, {@code @Inheritance(strategy = JOINED)} and
 * optionally {@code @DiscriminatorColumn}; its abstract accessors are the base-table columns and
 * each permitted record is a variant tagged by {@code @DiscriminatorValue}, with its own
 * {@code @Table} when it declares extra properties</li>
 * <li>a record annotated {@code @Entity}: a single table, no discriminator</li>
 * </ul>
 * Relationships are key properties: {@code @ManyToOne(targetEntity = ...)} with
 * {@code @JoinColumn} on an id-typed property, or {@code @ManyToMany(targetEntity = ...)} with
 * {@code @JoinTable} on a {@code List} of ids.
 */
public final class MetadataExtractor {

    private static final String DEFAULT_DISCRIMINATOR_COLUMN = "dtype";

    private MetadataExtractor() {
    }

    /**
     * Extract metadata from an entity family root.
     *
     * @param entityType the sealed interface or record
     * @return the entity metadata
     * @throws ChariotException if the declaration is malformed
     */
    public static EntityMetadata extractEntityMetadata(Class<?> entityType) {
        if (!entityType.isAnnotationPresent(Entity.class)) {
            throw new ChariotException(entityType.getName() + " is not annotated @Entity");
        }
        if (entityType.isInterface()) {
            return extractFamily(entityType);
        }
        if (entityType.isRecord()) {
            return extractRecord(entityType);
        }
        throw new ChariotException("Entity " + entityType.getName() + " must be a sealed interface or a record");
    }

    private static EntityMetadata extractRecord(Class<?> recordType) {
        String table = tableName(recordType);
        List<PropertyMapping> properties = new ArrayList<>();
        List<RelationshipMapping> relationships = new ArrayList<>();
        for (RecordComponent component : recordType.getRecordComponents()) {
            map(component.getAccessor(), recordType, table, properties, relationships);
        }
        PropertyMapping id = requireId(recordType, properties);
        VariantMapping variant = new VariantMapping(recordType, null, null, List.of(),
                componentNames(recordType), canonicalConstructor(recordType));
        return new EntityMetadata(recordType, table, id, null, idFirst(properties), List.of(variant), relationships);
    }

    private static EntityMetadata extractFamily(Class<?> familyType) {
        if (!familyType.isSealed()) {
            throw new ChariotException("Entity family " + familyType.getName() + " must be a sealed interface");
        }
        Inheritance inheritance = familyType.getAnnotation(Inheritance.class);
        if (inheritance == null || inheritance.strategy() != InheritanceType.JOINED) {
            throw new ChariotException("Entity family " + familyType.getName()
                    + " must declare @Inheritance(strategy = JOINED)");
        }
        DiscriminatorColumn discriminator = familyType.getAnnotation(DiscriminatorColumn.class);
        String discriminatorColumn = discriminator == null || discriminator.name().isEmpty()
                ? DEFAULT_DISCRIMINATOR_COLUMN
                : discriminator.name();
        String table = tableName(familyType);

        Class<?>[] permitted = familyType.getPermittedSubclasses();
        if (permitted == null || permitted.length == 0) {
            throw new ChariotException("Entity family " + familyType.getName() + " permits no variants");
        }
        for (Class<?> variantType : permitted) {
            if (!variantType.isRecord()) {
                throw new ChariotException("Variant " + variantType.getName() + " of " + familyType.getName()
                        + " must be a record");
            }
        }

        // Base accessors in the component order of the first variant
        Map<String, Method> baseAccessors = new LinkedHashMap<>();
        Map<String, Method> declared = new LinkedHashMap<>();
        for (Method method : familyType.getMethods()) {
            if (Modifier.isAbstract(method.getModifiers()) && !Modifier.isStatic(method.getModifiers())
                    && method.getParameterCount() == 0 && method.getReturnType() != void.class) {
                declared.put(method.getName(), method);
            }
        }
        for (String component : componentNames(permitted[0])) {
            Method method = declared.get(component);
            if (method != null) {
                baseAccessors.put(component, method);
            }
        }
        if (baseAccessors.size() != declared.size()) {
            throw new ChariotException("Accessors of " + familyType.getName()
                    + " must be record components of every variant");
        }

        List<PropertyMapping> baseProperties = new ArrayList<>();
        List<RelationshipMapping> relationships = new ArrayList<>();
        for (Method accessor : baseAccessors.values()) {
            map(accessor, familyType, table, baseProperties, relationships);
        }
        PropertyMapping id = requireId(familyType, baseProperties);

        List<VariantMapping> variants = new ArrayList<>();
        List<String> discriminatorValues = new ArrayList<>();
        for (Class<?> variantType : permitted) {
            DiscriminatorValue value = variantType.getAnnotation(DiscriminatorValue.class);
            if (value == null || value.value().isBlank()) {
                throw new ChariotException("Variant " + variantType.getName() + " must declare @DiscriminatorValue");
            }
            if (discriminatorValues.contains(value.value())) {
                throw new ChariotException("Duplicate discriminator value " + value.value() + " in "
                        + familyType.getName());
            }
            discriminatorValues.add(value.value());

            Table variantTable = variantType.getAnnotation(Table.class);
            String variantTableName = variantTable == null ? null : tableName(variantType);
            List<PropertyMapping> variantProperties = new ArrayList<>();
            for (RecordComponent component : variantType.getRecordComponents()) {
                if (baseAccessors.containsKey(component.getName())) {
                    continue;
                }
                if (variantTableName == null) {
                    throw new ChariotException("Variant " + variantType.getName() + " declares "
                            + component.getName() + " but has no @Table to store it");
                }
                map(component.getAccessor(), variantType, variantTableName, variantProperties, relationships);
            }
            variants.add(new VariantMapping(variantType, value.value(), variantTableName, variantProperties,
                    componentNames(variantType), canonicalConstructor(variantType)));
        }
        return new EntityMetadata(familyType, table, id, discriminatorColumn, idFirst(baseProperties), variants,
                relationships);
    }

    private static void map(Method accessor,
                            Class<?> declaringType,
                            String table,
                            List<PropertyMapping> properties,
                            List<RelationshipMapping> relationships) {
        accessor.trySetAccessible();
        String property = accessor.getName();
        Class<?> type = accessor.getReturnType();

        ManyToMany manyToMany = accessor.getAnnotation(ManyToMany.class);
        if (manyToMany != null) {
            if (!Collection.class.isAssignableFrom(type)) {
                throw new ChariotException("@ManyToMany property " + declaringType.getSimpleName() + "." + property
                        + " must be a List of ids");
            }
            Class<?> target = requireTarget(manyToMany.targetEntity(), declaringType, property);
            JoinTableMapping joinTable = joinTable(accessor.getAnnotation(JoinTable.class), table, target);
            relationships.add(new RelationshipMapping(NamingUtils.relationshipName(property), property,
                    Kind.MANY_TO_MANY, declaringType, target, table, null, tableNameOf(target), idColumnOf(target),
                    joinTable));
            return;
        }

        ManyToOne manyToOne = accessor.getAnnotation(ManyToOne.class);
        if (manyToOne != null) {
            Class<?> target = requireTarget(manyToOne.targetEntity(), declaringType, property);
            JoinColumn joinColumn = accessor.getAnnotation(JoinColumn.class);
            String column = joinColumn == null || joinColumn.name().isEmpty()
                    ? NamingUtils.toSnakeCase(property)
                    : joinColumn.name();
            boolean nullable = (joinColumn == null || joinColumn.nullable()) && manyToOne.optional();
            boolean unique = joinColumn != null && joinColumn.unique();
            properties.add(new PropertyMapping(property, column, table, type, false, nullable, unique, false,
                    accessor));
            relationships.add(new RelationshipMapping(NamingUtils.relationshipName(property), property,
                    Kind.MANY_TO_ONE, declaringType, target, table, column, tableNameOf(target), idColumnOf(target),
                    null));
            return;
        }

        Column column = accessor.getAnnotation(Column.class);
        boolean id = accessor.isAnnotationPresent(Id.class);
        String columnName = column == null || column.name().isEmpty()
                ? NamingUtils.toSnakeCase(property)
                : column.name();
        boolean nullable = !id && (column == null || column.nullable());
        boolean unique = column != null && column.unique();
        boolean generated = accessor.isAnnotationPresent(GeneratedValue.class);
        properties.add(new PropertyMapping(property, columnName, table, type, id, nullable, unique, generated,
                accessor));
    }

    private static Class<?> requireTarget(Class<?> target, Class<?> declaringType, String property) {
        if (target == null || target == void.class) {
            throw new ChariotException("Relationship " + declaringType.getSimpleName() + "." + property
                    + " must name its targetEntity");
        }
        return target;
    }

    private static JoinTableMapping joinTable(JoinTable annotation, String ownerTable, Class<?> target) {
        String targetTable = tableNameOf(target);
        String name = annotation == null || annotation.name().isEmpty()
                ? ownerTable + "_" + targetTable
                : annotation.name();
        String joinColumn = annotation != null && annotation.joinColumns().length > 0
                && !annotation.joinColumns()[0].name().isEmpty()
                ? annotation.joinColumns()[0].name()
                : ownerTable + "_id";
        String inverseJoinColumn = annotation != null && annotation.inverseJoinColumns().length > 0
                && !annotation.inverseJoinColumns()[0].name().isEmpty()
                ? annotation.inverseJoinColumns()[0].name()
                : targetTable + "_id";
        return new JoinTableMapping(name, joinColumn, inverseJoinColumn);
    }

    private static PropertyMapping requireId(Class<?> entityType, List<PropertyMapping> properties) {
        PropertyMapping id = null;
        for (PropertyMapping property : properties) {
            if (property.id()) {
                if (id != null) {
                    throw new ChariotException("Entity " + entityType.getName() + " declares more than one @Id");
                }
                id = property;
            }
        }
        if (id == null) {
            throw new ChariotException("Entity " + entityType.getName() + " declares no @Id");
        }
        return id;
    }

    private static List<PropertyMapping> idFirst(List<PropertyMapping> properties) {
        List<PropertyMapping> ordered = new ArrayList<>(properties.size());
        for (PropertyMapping property : properties) {
            if (property.id()) {
                ordered.add(property);
            }
        }
        for (PropertyMapping property : properties) {
            if (!property.id()) {
                ordered.add(property);
            }
        }
        return ordered;
    }

    /**
     * Table storing rows of an entity type: a variant's own table, its family table, or the
     * entity's table.
     */
    static String tableNameOf(Class<?> type) {
        if (type.isRecord() && type.isAnnotationPresent(DiscriminatorValue.class)) {
            if (type.isAnnotationPresent(Table.class)) {
                return tableName(type);
            }
            return tableName(familyOf(type));
        }
        if (type.isAnnotationPresent(Entity.class)) {
            return tableName(type);
        }
        throw new ChariotException(type.getName() + " is not an entity");
    }

    private static String idColumnOf(Class<?> type) {
        Class<?> owner = type.isRecord() && type.isAnnotationPresent(DiscriminatorValue.class) ? familyOf(type) : type;
        if (owner.isInterface()) {
            for (Method method : owner.getMethods()) {
                if (method.isAnnotationPresent(Id.class)) {
                    return columnName(method);
                }
            }
        } else if (owner.isRecord()) {
            for (RecordComponent component : owner.getRecordComponents()) {
                if (component.getAccessor().isAnnotationPresent(Id.class)) {
                    return columnName(component.getAccessor());
                }
            }
        }
        throw new ChariotException("Entity " + owner.getName() + " declares no @Id");
    }

    private static String columnName(Method accessor) {
        Column column = accessor.getAnnotation(Column.class);
        return column == null || column.name().isEmpty() ? NamingUtils.toSnakeCase(accessor.getName()) : column.name();
    }

    static Class<?> familyOf(Class<?> variantType) {
        for (Class<?> candidate : variantType.getInterfaces()) {
            if (candidate.isAnnotationPresent(Entity.class) && candidate.isAnnotationPresent(Inheritance.class)) {
                return candidate;
            }
        }
        throw new ChariotException("Variant " + variantType.getName() + " implements no entity family");
    }

    private static String tableName(Class<?> type) {
        Table table = type.getAnnotation(Table.class);
        if (table != null && !table.name().isEmpty()) {
            return table.name();
        }
        return NamingUtils.toSnakeCase(type.getSimpleName());
    }

    private static List<String> componentNames(Class<?> recordType) {
        List<String> names = new ArrayList<>();
        for (RecordComponent component : recordType.getRecordComponents()) {
            names.add(component.getName());
        }
        return names;
    }

    private static Constructor<?> canonicalConstructor(Class<?> recordType) {
        RecordComponent[] components = recordType.getRecordComponents();
        Class<?>[] types = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            types[i] = components[i].getType();
        }
        try {
            Constructor<?> constructor = recordType.getDeclaredConstructor(types);
            constructor.trySetAccessible();
            return constructor;
        } catch (NoSuchMethodException e) {
            throw new ChariotException("No canonical constructor on " + recordType.getName(), e);
        }
    }
}
