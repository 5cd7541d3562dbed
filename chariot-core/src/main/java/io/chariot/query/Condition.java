package io.chariot.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Filter conditions over entity attributes. SQL null semantics: a comparison involving null is
 * false; use {@link IsNull} to match missing values.
 */
public sealed interface Condition permits Condition.Comparison, Condition.IsNull, Condition.And {

    enum Operator {
        EQ("="),
        NE("!="),
        GT(">"),
        GE(">="),
        LT("<"),
        LE("<=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        @SuppressWarnings({ "unchecked", "rawtypes" })
        boolean test(Object actual, Object expected) {
            if (actual == null || expected == null) {
                return false;
            }
            if (this == EQ) {
                return Objects.equals(actual, expected);
            }
            if (this == NE) {
                return !Objects.equals(actual, expected);
            }
            int comparison = ((Comparable) actual).compareTo(expected);
            return switch (this) {
                case GT -> comparison > 0;
                case GE -> comparison >= 0;
                case LT -> comparison < 0;
                case LE -> comparison <= 0;
                default -> throw new IllegalStateException("Unexpected operator " + this);
            };
        }
    }

    record Comparison(Attribute<?, ?> attribute, Operator operator, Object value) implements Condition {
        public Comparison {
            if (attribute == null) {
                throw new IllegalArgumentException("attribute required");
            }
            if (operator == null) {
                throw new IllegalArgumentException("operator required");
            }
            if (value != null && operator != Operator.EQ && operator != Operator.NE
                    && !(value instanceof Comparable)) {
                throw new IllegalArgumentException("comparable value required for " + operator);
            }
        }
    }

    record IsNull(Attribute<?, ?> attribute) implements Condition {
        public IsNull {
            if (attribute == null) {
                throw new IllegalArgumentException("attribute required");
            }
        }
    }

    record And(List<Condition> conditions) implements Condition {
        public And {
            if (conditions == null || conditions.isEmpty()) {
                throw new IllegalArgumentException("conditions required");
            }
            conditions = List.copyOf(conditions);
        }
    }

    static Condition allOf(Condition first, Condition... rest) {
        if (rest.length == 0) {
            return first;
        }
        List<Condition> conditions = new ArrayList<>(rest.length + 1);
        conditions.add(first);
        conditions.addAll(List.of(rest));
        return new And(conditions);
    }

    default Condition and(Condition other) {
        return allOf(this, other);
    }

    /**
     * Attributes referenced by this condition, in order of appearance.
     */
    default List<Attribute<?, ?>> attributes() {
        List<Attribute<?, ?>> attributes = new ArrayList<>();
        collect(this, attributes);
        return attributes;
    }

    private static void collect(Condition condition, List<Attribute<?, ?>> attributes) {
        if (condition instanceof Comparison comparison) {
            attributes.add(comparison.attribute());
        } else if (condition instanceof IsNull isNull) {
            attributes.add(isNull.attribute());
        } else if (condition instanceof And and) {
            for (Condition nested : and.conditions()) {
                collect(nested, attributes);
            }
        }
    }
}
