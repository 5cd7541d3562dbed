package io.chariot.query;

import io.chariot.core.QueryConstructionException;
import io.chariot.schema.EntityMetadata;
import io.chariot.schema.PropertyMapping;
import io.chariot.schema.RelationshipMapping;
import io.chariot.schema.Schema;
import io.chariot.storage.HeapTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Executes a {@link QueryPlan} against committed rows.
 * <p>
 * Tuples of ids, one slot per type in scope, are expanded join by join through indexes and
 * filtered; distinct roots are kept in store order. Each fetch level is then resolved for all of
 * its sources at once and the targets are materialized through the entity source's identity map.
 */
final class QueryExecutor {
    private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

    private final EntitySource source;
    private final RelationshipNavigator navigator;

    QueryExecutor(EntitySource source) {
        this.source = source;
        this.navigator = new RelationshipNavigator(source);
    }

    <T> QueryResult<T> execute(QueryPlan plan, Class<T> rootType) {
        Schema schema = source.schema();
        EntityMetadata rootMetadata = schema.metadata(rootType);

        List<Class<?>> slots = new ArrayList<>();
        slots.add(rootType);
        List<Object[]> tuples = scan(rootMetadata, rootType);

        List<Relationship<?, ?>> joins = plan.joins();
        for (Relationship<?, ?> join : joins) {
            int from = slotOf(slots, join.source());
            RelationshipMapping mapping = join.mapping(schema);
            List<Object[]> expanded = new ArrayList<>();
            for (Object[] tuple : tuples) {
                for (Object targetId : navigator.targets(join, mapping, tuple[from])) {
                    Object[] next = Arrays.copyOf(tuple, tuple.length + 1);
                    next[tuple.length] = targetId;
                    expanded.add(next);
                }
            }
            tuples = expanded;
            slots.add(join.target());
        }

        Condition condition = plan.condition();
        if (condition != null) {
            List<Object[]> matching = new ArrayList<>();
            for (Object[] tuple : tuples) {
                if (matches(condition, slots, tuple)) {
                    matching.add(tuple);
                }
            }
            tuples = matching;
        }

        Set<Object> rootIds = new LinkedHashSet<>();
        for (Object[] tuple : tuples) {
            rootIds.add(tuple[0]);
        }
        List<T> roots = new ArrayList<>(rootIds.size());
        for (Object id : rootIds) {
            roots.add(rootType.cast(source.load(rootMetadata, id)));
        }

        EntityGraph graph = new EntityGraph();
        for (Fetch fetch : plan.fetches()) {
            resolve(fetch, rootIds, joins, slots, tuples, graph);
        }
        log.debug("Query on {} kept {} tuple(s) and {} root(s)", rootType.getSimpleName(), tuples.size(),
                roots.size());
        return new QueryResult<>(roots, graph);
    }

    private List<Object[]> scan(EntityMetadata metadata, Class<?> type) {
        HeapTable base = source.store().table(metadata.table());
        String idColumn = metadata.id().column();
        List<Object[]> tuples = new ArrayList<>();
        for (int row : base.scanAll()) {
            if (RelationshipNavigator.holds(metadata, type, base, row)) {
                tuples.add(new Object[] { base.value(row, idColumn) });
            }
        }
        return tuples;
    }

    private void resolve(Fetch fetch,
                         Set<Object> rootIds,
                         List<Relationship<?, ?>> joins,
                         List<Class<?>> slots,
                         List<Object[]> tuples,
                         EntityGraph graph) {
        Schema schema = source.schema();
        List<Object> sourceIds = new ArrayList<>(rootIds);
        for (Relationship<?, ?> relationship : fetch.path()) {
            EntityMetadata sourceMetadata = schema.metadata(relationship.source());
            EntityMetadata targetMetadata = schema.metadata(relationship.target());
            Map<Object, List<Object>> targetIds = fetch.strategy() == Fetch.Strategy.JOINED
                    ? navigator.targets(relationship, relationship.mapping(schema), sourceIds)
                    : fromJoinedRows(relationship, joins, slots, tuples);

            Set<Object> next = new LinkedHashSet<>();
            for (Object sourceId : sourceIds) {
                Object entity = source.load(sourceMetadata, sourceId);
                if (!relationship.source().isInstance(entity)) {
                    continue;
                }
                List<Object> targets = new ArrayList<>();
                for (Object targetId : targetIds.getOrDefault(sourceId, List.of())) {
                    Object target = source.load(targetMetadata, targetId);
                    if (target != null) {
                        targets.add(target);
                        next.add(targetId);
                    }
                }
                graph.put(relationship, entity, targets);
            }
            sourceIds = new ArrayList<>(next);
        }
    }

    private static Map<Object, List<Object>> fromJoinedRows(Relationship<?, ?> relationship,
                                                           List<Relationship<?, ?>> joins,
                                                           List<Class<?>> slots,
                                                           List<Object[]> tuples) {
        int join = joins.indexOf(relationship);
        if (join < 0) {
            throw new QueryConstructionException("containsEager(" + relationship + ") has no matching join");
        }
        // slot i + 1 holds the target of join i
        int targetSlot = join + 1;
        int sourceSlot = slotOf(slots.subList(0, targetSlot), relationship.source());
        Map<Object, Set<Object>> pairs = new LinkedHashMap<>();
        for (Object[] tuple : tuples) {
            pairs.computeIfAbsent(tuple[sourceSlot], ignored -> new LinkedHashSet<>()).add(tuple[targetSlot]);
        }
        Map<Object, List<Object>> targets = new LinkedHashMap<>();
        pairs.forEach((sourceId, targetIds) -> targets.put(sourceId, new ArrayList<>(targetIds)));
        return targets;
    }

    private boolean matches(Condition condition, List<Class<?>> slots, Object[] tuple) {
        if (condition instanceof Condition.And and) {
            for (Condition nested : and.conditions()) {
                if (!matches(nested, slots, tuple)) {
                    return false;
                }
            }
            return true;
        }
        if (condition instanceof Condition.Comparison comparison) {
            Object actual = read(comparison.attribute(), slots, tuple);
            return comparison.operator().test(actual, comparison.value());
        }
        if (condition instanceof Condition.IsNull isNull) {
            return read(isNull.attribute(), slots, tuple) == null;
        }
        throw new IllegalStateException("Unsupported condition " + condition);
    }

    private Object read(Attribute<?, ?> attribute, List<Class<?>> slots, Object[] tuple) {
        int slot = slotOf(slots, attribute.owner());
        EntityMetadata metadata = source.schema().metadata(slots.get(slot));
        PropertyMapping property = metadata.property(attribute.owner(), attribute.property())
                .orElseThrow(() -> new QueryConstructionException("Attribute " + attribute + " is not mapped"));
        HeapTable table = source.store().table(property.table());
        int row = table.findById(tuple[slot]);
        return row < 0 ? null : table.value(row, property.column());
    }

    /**
     * First slot holding instances of the type.
     */
    static int slotOf(List<Class<?>> slots, Class<?> type) {
        for (int i = 0; i < slots.size(); i++) {
            if (type.isAssignableFrom(slots.get(i))) {
                return i;
            }
        }
        throw new QueryConstructionException(type.getSimpleName() + " is not in scope");
    }
}
