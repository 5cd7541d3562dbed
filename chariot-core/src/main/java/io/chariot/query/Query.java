package io.chariot.query;

import io.chariot.core.QueryConstructionException;
import io.chariot.schema.EntityMetadata;
import io.chariot.schema.PropertyMapping;
import io.chariot.schema.Schema;
import io.chariot.sql.SqlCompiler;
import io.chariot.sql.Statement;

import java.lang.invoke.MethodType;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable query builder over one root entity type. Every builder call validates its argument
 * against the schema and the types already in scope, and returns a new query.
 *
 * <pre>{@code
 * session.query(Order.class)
 *         .join(Order.MENU_ITEMS)
 *         .join(MenuItem.FOOD_TRUCK)
 *         .filter(MenuItem.PRICE.eq(700))
 *         .options(Fetch.joined(Order.MENU_ITEMS), Fetch.joined(Order.CUSTOMER))
 *         .all();
 * }</pre>
 *
 * @param <T> the root type
 */
public final class Query<T> {

    private final EntitySource source;
    private final Class<T> rootType;
    private final List<Relationship<?, ?>> joins;
    private final List<Condition> conditions;
    private final List<Fetch> fetches;

    public Query(EntitySource source, Class<T> rootType) {
        this(source, rootType, List.of(), List.of(), List.of());
        if (!source.schema().isMapped(rootType)) {
            throw new QueryConstructionException(rootType.getName() + " is not a mapped entity");
        }
    }

    private Query(EntitySource source,
                  Class<T> rootType,
                  List<Relationship<?, ?>> joins,
                  List<Condition> conditions,
                  List<Fetch> fetches) {
        this.source = source;
        this.rootType = rootType;
        this.joins = List.copyOf(joins);
        this.conditions = List.copyOf(conditions);
        this.fetches = List.copyOf(fetches);
    }

    public Class<T> rootType() {
        return rootType;
    }

    /**
     * Inner join along a relationship whose source is already in scope.
     *
     * @throws QueryConstructionException if the source is not in scope, the target type is
     *                                    already in scope, or the relationship is not mapped
     */
    public Query<T> join(Relationship<?, ?> relationship) {
        List<Class<?>> scope = scope();
        if (!inScope(scope, relationship.source())) {
            throw new QueryConstructionException("Cannot join " + relationship + ": "
                    + relationship.source().getSimpleName() + " is not in scope " + names(scope));
        }
        if (scope.contains(relationship.target())) {
            throw new QueryConstructionException("Cannot join " + relationship + ": "
                    + relationship.target().getSimpleName() + " is already joined");
        }
        relationship.mapping(schema());
        List<Relationship<?, ?>> extended = new ArrayList<>(joins);
        extended.add(relationship);
        return new Query<>(source, rootType, extended, conditions, fetches);
    }

    /**
     * Restrict the joined rows. Repeated calls combine with AND.
     *
     * @throws QueryConstructionException if an attribute is not in scope, not mapped, or typed
     *                                    differently from the mapped property
     */
    public Query<T> filter(Condition condition) {
        if (condition == null) {
            throw new IllegalArgumentException("condition required");
        }
        List<Class<?>> scope = scope();
        for (Attribute<?, ?> attribute : condition.attributes()) {
            if (!inScope(scope, attribute.owner())) {
                throw new QueryConstructionException("Cannot filter on " + attribute + ": "
                        + attribute.owner().getSimpleName() + " is not in scope " + names(scope));
            }
            EntityMetadata metadata = schema().metadata(attribute.owner());
            PropertyMapping property = metadata.property(attribute.owner(), attribute.property())
                    .orElseThrow(() -> new QueryConstructionException("Cannot filter on " + attribute
                            + ": not a mapped property"));
            if (boxed(attribute.type()) != boxed(property.type())) {
                throw new QueryConstructionException("Cannot filter on " + attribute + ": declared as "
                        + attribute.type().getSimpleName() + " but mapped as " + property.type().getSimpleName());
            }
        }
        List<Condition> extended = new ArrayList<>(conditions);
        extended.add(condition);
        return new Query<>(source, rootType, joins, extended, fetches);
    }

    /**
     * Add eager-fetch directives.
     *
     * @throws QueryConstructionException if a path does not start at the root type, a
     *                                    relationship is not mapped, or a containsEager
     *                                    relationship has no matching join
     */
    public Query<T> options(Fetch... options) {
        List<Fetch> extended = new ArrayList<>(fetches);
        for (Fetch fetch : options) {
            if (!fetch.first().source().isAssignableFrom(rootType)) {
                throw new QueryConstructionException("Cannot fetch " + fetch + ": path must start at "
                        + rootType.getSimpleName());
            }
            for (Relationship<?, ?> relationship : fetch.path()) {
                relationship.mapping(schema());
                if (fetch.strategy() == Fetch.Strategy.CONTAINS_EAGER && !joins.contains(relationship)) {
                    throw new QueryConstructionException("Cannot fetch " + fetch + ": " + relationship
                            + " is not joined");
                }
            }
            extended.add(fetch);
        }
        return new Query<>(source, rootType, joins, conditions, extended);
    }

    public QueryPlan plan() {
        QueryPlan plan = new QueryPlan.Scan(rootType);
        for (Relationship<?, ?> join : joins) {
            plan = new QueryPlan.Join(plan, join);
        }
        if (!conditions.isEmpty()) {
            Condition condition = conditions.size() == 1 ? conditions.get(0) : new Condition.And(conditions);
            plan = new QueryPlan.Filter(plan, condition);
        }
        for (Fetch fetch : fetches) {
            plan = new QueryPlan.Eager(plan, fetch);
        }
        return plan;
    }

    /**
     * The plan as SQL text with bound parameters, for display and echo.
     */
    public Statement statement() {
        return new SqlCompiler(schema()).select(plan());
    }

    public QueryResult<T> execute() {
        QueryPlan plan = plan();
        source.executing(plan);
        return new QueryExecutor(source).execute(plan, rootType);
    }

    public List<T> all() {
        return execute().roots();
    }

    private Schema schema() {
        return source.schema();
    }

    private List<Class<?>> scope() {
        List<Class<?>> scope = new ArrayList<>();
        scope.add(rootType);
        for (Relationship<?, ?> join : joins) {
            scope.add(join.target());
        }
        return scope;
    }

    private static boolean inScope(List<Class<?>> scope, Class<?> type) {
        for (Class<?> candidate : scope) {
            if (type.isAssignableFrom(candidate)) {
                return true;
            }
        }
        return false;
    }

    private static Class<?> boxed(Class<?> type) {
        return type.isPrimitive() ? MethodType.methodType(type).wrap().returnType() : type;
    }

    private static List<String> names(List<Class<?>> scope) {
        return scope.stream().map(Class::getSimpleName).toList();
    }

    @Override
    public String toString() {
        return "Query{" + plan() + "}";
    }
}
