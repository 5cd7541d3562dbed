package io.chariot.schema;

import io.chariot.core.ChariotException;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One concrete record type of an entity family.
 *
 * @param type               the record class
 * @param discriminatorValue the stored tag selecting this variant, null for non-polymorphic entities
 * @param table              the specialization table sharing the family primary key, or null
 * @param properties         properties stored in the specialization table (never the id)
 * @param components         record component names in canonical constructor order
 * @param constructor        the canonical constructor
 */
public record VariantMapping(Class<?> type,
                             String discriminatorValue,
                             String table,
                             List<PropertyMapping> properties,
                             List<String> components,
                             Constructor<?> constructor) {

    public VariantMapping {
        if (type == null) {
            throw new IllegalArgumentException("type required");
        }
        if (constructor == null) {
            throw new IllegalArgumentException("constructor required");
        }
        properties = List.copyOf(properties);
        components = List.copyOf(components);
    }

    public boolean hasTable() {
        return table != null;
    }

    /**
     * Build an instance from property values keyed by component name. Missing components are null.
     */
    public Object instantiate(Map<String, Object> values) {
        Object[] args = new Object[components.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = values.get(components.get(i));
        }
        try {
            return constructor.newInstance(args);
        } catch (InstantiationException | IllegalAccessException | IllegalArgumentException e) {
            throw new ChariotException("Cannot construct " + type.getName() + " from " + values, e);
        } catch (InvocationTargetException e) {
            throw new ChariotException("Constructor of " + type.getName() + " rejected " + values, e.getCause());
        }
    }

    /**
     * Read every record component of an instance, keyed by component name.
     */
    public Map<String, Object> values(Object entity) {
        if (!type.isInstance(entity)) {
            throw new IllegalArgumentException(entity.getClass().getName() + " is not a " + type.getName());
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (RecordComponent component : type.getRecordComponents()) {
            Method accessor = component.getAccessor();
            accessor.trySetAccessible();
            try {
                values.put(component.getName(), accessor.invoke(entity));
            } catch (IllegalAccessException e) {
                throw new ChariotException("Cannot read " + component.getName() + " of " + type.getName(), e);
            } catch (InvocationTargetException e) {
                throw new ChariotException("Accessor " + component.getName() + " of " + type.getName() + " failed",
                        e.getCause());
            }
        }
        return values;
    }
}
