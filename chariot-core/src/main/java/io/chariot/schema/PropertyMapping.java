package io.chariot.schema;

import io.chariot.core.ChariotException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

/**
 * A scalar property of an entity and the column that stores it.
 *
 * @param property  the accessor name
 * @param column    the column name
 * @param table     the table holding the column (family base table or variant table)
 * @param type      the property type
 * @param id        whether this is the identifier
 * @param nullable  whether null is accepted at commit
 * @param unique    whether the column carries a unique index
 * @param generated whether ids are drawn from the family sequence when absent
 * @param accessor  the method reading the property from an entity instance
 */
public record PropertyMapping(String property,
                              String column,
                              String table,
                              Class<?> type,
                              boolean id,
                              boolean nullable,
                              boolean unique,
                              boolean generated,
                              Method accessor) {

    public PropertyMapping {
        if (property == null || property.isBlank()) {
            throw new IllegalArgumentException("property required");
        }
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column required");
        }
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table required");
        }
        if (type == null) {
            throw new IllegalArgumentException("type required");
        }
        if (accessor == null) {
            throw new IllegalArgumentException("accessor required");
        }
    }

    /**
     * Read this property from an entity.
     */
    public Object read(Object entity) {
        try {
            return accessor.invoke(entity);
        } catch (IllegalAccessException e) {
            throw new ChariotException("Cannot read " + property + " of " + entity.getClass().getName(), e);
        } catch (InvocationTargetException e) {
            throw new ChariotException("Accessor " + property + " of " + entity.getClass().getName() + " failed",
                    e.getCause());
        }
    }
}
