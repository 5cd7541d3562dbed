package io.chariot.sql;

import io.chariot.core.QueryConstructionException;
import io.chariot.query.Attribute;
import io.chariot.query.Condition;
import io.chariot.query.Fetch;
import io.chariot.query.QueryPlan;
import io.chariot.query.Relationship;
import io.chariot.schema.EntityMetadata;
import io.chariot.schema.PropertyMapping;
import io.chariot.schema.RelationshipMapping;
import io.chariot.schema.RelationshipMapping.JoinTableMapping;
import io.chariot.schema.Schema;
import io.chariot.schema.VariantMapping;
import io.chariot.storage.TableDefinition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Renders query plans and row inserts as SQL text. The text is for display and statement echo;
 * the store never parses it.
 * <p>
 * Select statements label every column {@code <alias>_<column>}. Inner joins use plain table
 * names where possible; junction tables and eager fetches get numbered aliases. A variant with
 * its own table is rendered as a parenthesized join of base and specialization table.
 */
public final class SqlCompiler {

    private static final Set<String> RESERVED = Set.of("order", "group", "user", "select", "from", "where",
            "table", "join", "key", "index", "references", "primary");

    private final Schema schema;

    public SqlCompiler(Schema schema) {
        this.schema = schema;
    }

    public Statement insert(TableDefinition table, Object[] values) {
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(quote(table.name())).append(" (");
        StringBuilder placeholders = new StringBuilder();
        for (int i = 0; i < table.columns().size(); i++) {
            if (i > 0) {
                sql.append(", ");
                placeholders.append(", ");
            }
            sql.append(quote(table.columns().get(i).name()));
            placeholders.append('?');
        }
        sql.append(") VALUES (").append(placeholders).append(')');
        return new Statement(sql.toString(), Arrays.asList(values));
    }

    public Statement select(QueryPlan plan) {
        Aliases aliases = new Aliases();
        List<Object> parameters = new ArrayList<>();
        List<String> columns = new ArrayList<>();
        Map<Class<?>, EntityRef> scope = new LinkedHashMap<>();

        EntityRef root = entity(plan.rootType(), aliases, false);
        scope.put(plan.rootType(), root);
        columns.addAll(root.columns());
        StringBuilder from = new StringBuilder(root.tableExpression(false));

        for (Relationship<?, ?> join : plan.joins()) {
            EntityRef source = inScope(scope, join.source());
            EntityRef target = entity(join.target(), aliases, false);
            from.append(' ').append(join(join, source, target, aliases, false));
            scope.put(join.target(), target);
        }

        String where = "";
        Condition condition = plan.condition();
        if (condition != null) {
            where = " WHERE " + render(condition, scope, parameters);
        }

        Map<List<Relationship<?, ?>>, EntityRef> fetched = new HashMap<>();
        Set<EntityRef> selected = new HashSet<>();
        selected.add(root);
        for (Fetch fetch : plan.fetches()) {
            EntityRef source = root;
            List<Relationship<?, ?>> prefix = new ArrayList<>();
            for (Relationship<?, ?> relationship : fetch.path()) {
                prefix.add(relationship);
                EntityRef target;
                if (fetch.strategy() == Fetch.Strategy.CONTAINS_EAGER) {
                    target = scope.get(relationship.target());
                } else {
                    target = fetched.get(prefix);
                    if (target == null) {
                        target = entity(relationship.target(), aliases, true);
                        from.append(' ').append(join(relationship, source, target, aliases, true));
                        fetched.put(List.copyOf(prefix), target);
                    }
                }
                if (selected.add(target)) {
                    columns.addAll(target.columns());
                }
                source = target;
            }
        }

        String sql = "SELECT " + String.join(", ", columns) + " FROM " + from + where;
        return new Statement(sql, parameters);
    }

    private String join(Relationship<?, ?> relationship,
                        EntityRef source,
                        EntityRef target,
                        Aliases aliases,
                        boolean outer) {
        RelationshipMapping mapping = relationship.mapping(schema);
        String keyword = outer ? "LEFT OUTER JOIN " : "JOIN ";
        boolean inverse = relationship.direction() == Relationship.Direction.INVERSE;

        if (mapping.kind() == RelationshipMapping.Kind.MANY_TO_ONE) {
            String on = inverse
                    ? source.idColumn() + " = " + target.column(mapping.table(), mapping.column())
                    : target.idColumn() + " = " + source.column(mapping.table(), mapping.column());
            return keyword + target.tableExpression(true) + " ON " + on;
        }

        JoinTableMapping joinTable = mapping.joinTable();
        String junction = aliases.allocate(joinTable.name(), true);
        String sourceColumn = inverse ? joinTable.inverseJoinColumn() : joinTable.joinColumn();
        String targetColumn = inverse ? joinTable.joinColumn() : joinTable.inverseJoinColumn();
        String junctionExpression = quote(joinTable.name()) + " AS " + quote(junction);
        String toJunction = source.idColumn() + " = " + quote(junction) + "." + quote(sourceColumn);
        String toTarget = target.idColumn() + " = " + quote(junction) + "." + quote(targetColumn);
        if (outer) {
            return keyword + "(" + junctionExpression + " JOIN " + target.tableExpression(true) + " ON " + toTarget
                    + ") ON " + toJunction;
        }
        return keyword + junctionExpression + " ON " + toJunction + " JOIN " + target.tableExpression(true)
                + " ON " + toTarget;
    }

    private String render(Condition condition, Map<Class<?>, EntityRef> scope, List<Object> parameters) {
        if (condition instanceof Condition.And and) {
            List<String> parts = new ArrayList<>();
            for (Condition nested : and.conditions()) {
                parts.add(render(nested, scope, parameters));
            }
            return String.join(" AND ", parts);
        }
        if (condition instanceof Condition.Comparison comparison) {
            parameters.add(comparison.value());
            return column(comparison.attribute(), scope) + " " + comparison.operator().symbol() + " ?";
        }
        if (condition instanceof Condition.IsNull isNull) {
            return column(isNull.attribute(), scope) + " IS NULL";
        }
        throw new IllegalStateException("Unsupported condition " + condition);
    }

    private String column(Attribute<?, ?> attribute, Map<Class<?>, EntityRef> scope) {
        EntityRef ref = inScope(scope, attribute.owner());
        PropertyMapping property = ref.metadata.property(attribute.owner(), attribute.property())
                .orElseThrow(() -> new QueryConstructionException("Attribute " + attribute + " is not mapped"));
        return ref.column(property.table(), property.column());
    }

    private static EntityRef inScope(Map<Class<?>, EntityRef> scope, Class<?> type) {
        for (Map.Entry<Class<?>, EntityRef> entry : scope.entrySet()) {
            if (type.isAssignableFrom(entry.getKey())) {
                return entry.getValue();
            }
        }
        throw new QueryConstructionException(type.getSimpleName() + " is not in scope");
    }

    private EntityRef entity(Class<?> type, Aliases aliases, boolean aliased) {
        EntityMetadata metadata = schema.metadata(type);
        VariantMapping variant = type == metadata.entityType() ? null : metadata.variantOf(type);
        String variantTable = variant != null && variant.hasTable() ? variant.table() : null;
        String baseAlias = aliases.allocate(metadata.table(), aliased);
        String variantAlias = variantTable == null ? null : aliases.allocate(variantTable, aliased);
        return new EntityRef(metadata, variant, baseAlias, variantTable, variantAlias);
    }

    static String quote(String identifier) {
        return RESERVED.contains(identifier.toLowerCase(Locale.ROOT)) ? "\"" + identifier + "\"" : identifier;
    }

    /**
     * Tables of one entity occurrence in a statement and their aliases.
     */
    private static final class EntityRef {
        private final EntityMetadata metadata;
        private final VariantMapping variant;
        private final String baseAlias;
        private final String variantTable;
        private final String variantAlias;

        EntityRef(EntityMetadata metadata,
                  VariantMapping variant,
                  String baseAlias,
                  String variantTable,
                  String variantAlias) {
            this.metadata = metadata;
            this.variant = variant;
            this.baseAlias = baseAlias;
            this.variantTable = variantTable;
            this.variantAlias = variantAlias;
        }

        String idColumn() {
            return quote(baseAlias) + "." + quote(metadata.id().column());
        }

        String column(String table, String column) {
            if (table.equals(metadata.table())) {
                return quote(baseAlias) + "." + quote(column);
            }
            if (table.equals(variantTable)) {
                return quote(variantAlias) + "." + quote(column);
            }
            throw new QueryConstructionException("Table " + table + " is not part of " + metadata.entityType()
                    .getSimpleName() + " here");
        }

        String tableExpression(boolean parenthesize) {
            String base = aliased(metadata.table(), baseAlias);
            if (variantTable == null) {
                return base;
            }
            String joined = base + " JOIN " + aliased(variantTable, variantAlias) + " ON " + idColumn() + " = "
                    + quote(variantAlias) + "." + quote(metadata.id().column());
            return parenthesize ? "(" + joined + ")" : joined;
        }

        List<String> columns() {
            List<String> columns = new ArrayList<>();
            columns.add(labelled(baseAlias, metadata.id().column()));
            if (metadata.isPolymorphic()) {
                columns.add(labelled(baseAlias, metadata.discriminatorColumn()));
            }
            for (PropertyMapping property : metadata.baseProperties()) {
                if (!property.id()) {
                    columns.add(labelled(baseAlias, property.column()));
                }
            }
            if (variant != null && variant.hasTable()) {
                for (PropertyMapping property : variant.properties()) {
                    columns.add(labelled(variantAlias, property.column()));
                }
            }
            return columns;
        }

        private static String labelled(String alias, String column) {
            return quote(alias) + "." + quote(column) + " AS " + alias + "_" + column;
        }

        private static String aliased(String table, String alias) {
            return table.equals(alias) ? quote(table) : quote(table) + " AS " + quote(alias);
        }
    }

    /**
     * Alias allocation per statement: a table's first plain use keeps its name, later or forced
     * uses are numbered {@code <table>_<n>}.
     */
    private static final class Aliases {
        private final Set<String> used = new HashSet<>();
        private final Map<String, Integer> counters = new HashMap<>();

        String allocate(String table, boolean numbered) {
            if (!numbered && used.add(table)) {
                return table;
            }
            String alias;
            do {
                alias = table + "_" + counters.merge(table, 1, Integer::sum);
            } while (!used.add(alias));
            return alias;
        }
    }
}
