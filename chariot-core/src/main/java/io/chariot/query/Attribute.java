package io.chariot.query;

/**
 * A typed reference to a scalar entity property, used to build filter conditions.
 *
 * @param owner    the entity type declaring the property (family root or variant)
 * @param property the property (record component) name
 * @param type     the property type
 * @param <E>      owner type
 * @param <V>      value type
 */
public record Attribute<E, V>(Class<E> owner, String property, Class<V> type) {

    public Attribute {
        if (owner == null) {
            throw new IllegalArgumentException("owner required");
        }
        if (property == null || property.isBlank()) {
            throw new IllegalArgumentException("property required");
        }
        if (type == null) {
            throw new IllegalArgumentException("type required");
        }
    }

    public static <E, V> Attribute<E, V> of(Class<E> owner, String property, Class<V> type) {
        return new Attribute<>(owner, property, type);
    }

    public Condition eq(V value) {
        return new Condition.Comparison(this, Condition.Operator.EQ, value);
    }

    public Condition ne(V value) {
        return new Condition.Comparison(this, Condition.Operator.NE, value);
    }

    public Condition gt(V value) {
        return new Condition.Comparison(this, Condition.Operator.GT, value);
    }

    public Condition ge(V value) {
        return new Condition.Comparison(this, Condition.Operator.GE, value);
    }

    public Condition lt(V value) {
        return new Condition.Comparison(this, Condition.Operator.LT, value);
    }

    public Condition le(V value) {
        return new Condition.Comparison(this, Condition.Operator.LE, value);
    }

    public Condition isNull() {
        return new Condition.IsNull(this);
    }

    @Override
    public String toString() {
        return owner.getSimpleName() + "." + property;
    }
}
