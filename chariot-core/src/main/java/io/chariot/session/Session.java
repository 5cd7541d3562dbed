package io.chariot.session;

import io.chariot.core.ChariotException;
import io.chariot.query.EntitySource;
import io.chariot.query.Query;
import io.chariot.query.QueryPlan;
import io.chariot.schema.EntityMetadata;
import io.chariot.schema.PropertyMapping;
import io.chariot.schema.RelationshipMapping;
import io.chariot.schema.Schema;
import io.chariot.schema.VariantMapping;
import io.chariot.sql.SqlCompiler;
import io.chariot.sql.Statement;
import io.chariot.storage.RowInsert;
import io.chariot.storage.Store;
import io.chariot.storage.TableDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Unit of work over a store.
 * <p>
 * {@link #add(Object)} assigns ids and buffers the rows of an entity; {@link #commit()} writes
 * every buffered row as one atomic batch. Entities are immutable records, so {@code add} returns
 * the instance that carries the assigned id. Within a session each stored row is represented by a
 * single instance. Queries see committed rows only.
 * <p>
 * Not thread safe.
 */
public final class Session implements EntitySource, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Session.class);
    private static final Logger echo = LoggerFactory.getLogger("io.chariot.sql.echo");

    private final Schema schema;
    private final Store store;
    private final boolean echoStatements;
    private final SqlCompiler compiler;
    private final EntityMaterializer materializer;
    private final IdentityMap identityMap = new IdentityMap();
    private final List<RowInsert> pending = new ArrayList<>();
    private final List<IdentityMap.Key> pendingKeys = new ArrayList<>();
    private boolean closed;

    Session(Schema schema, Store store, boolean echoStatements) {
        this.schema = schema;
        this.store = store;
        this.echoStatements = echoStatements;
        this.compiler = new SqlCompiler(schema);
        this.materializer = new EntityMaterializer(store);
    }

    @Override
    public Schema schema() {
        return schema;
    }

    @Override
    public Store store() {
        return store;
    }

    /**
     * Buffer an entity for the next commit.
     *
     * @param entity a variant record of a mapped family
     * @param <E>    entity type
     * @return the entity with its id assigned; the argument itself when it already had one
     * @throws ChariotException if the entity is not mapped, or has no id and none is generated
     */
    @SuppressWarnings("unchecked")
    public <E> E add(E entity) {
        assertOpen();
        if (entity == null) {
            throw new IllegalArgumentException("entity required");
        }
        EntityMetadata metadata = schema.metadata(entity.getClass());
        VariantMapping variant = metadata.variantOf(entity.getClass());
        Map<String, Object> values = variant.values(entity);
        PropertyMapping id = metadata.id();
        Object idValue = values.get(id.property());
        E added = entity;
        if (idValue == null) {
            if (!id.generated()) {
                throw new ChariotException(entity.getClass().getSimpleName() + " has no " + id.property()
                        + " and it is not @GeneratedValue");
            }
            idValue = convertId(store.nextId(metadata.table()), id.type());
            values.put(id.property(), idValue);
            added = (E) variant.instantiate(values);
        } else if (id.generated() && idValue instanceof Number number) {
            store.observeId(metadata.table(), number.longValue());
        }

        IdentityMap.Key key = new IdentityMap.Key(metadata.entityType(), idValue);
        Object mapped = identityMap.get(key);
        if (mapped == entity) {
            return entity;
        }
        // a committed row keeps its identity; the duplicate is rejected at commit
        if (mapped == null && store.table(metadata.table()).findById(idValue) < 0) {
            identityMap.putIfAbsent(key, added);
            pendingKeys.add(key);
        }
        pending.addAll(rows(metadata, variant, values));
        return added;
    }

    /**
     * Add several entities in order.
     *
     * @return the added instances, ids assigned
     */
    public <E> List<E> addAll(Collection<? extends E> entities) {
        List<E> added = new ArrayList<>(entities.size());
        for (E entity : entities) {
            added.add(add(entity));
        }
        return added;
    }

    /**
     * Write every buffered row in one atomic batch.
     *
     * @throws io.chariot.core.ConstraintViolationException if a row violates a constraint; the
     *                                                      session is rolled back and nothing is
     *                                                      stored
     */
    public void commit() {
        assertOpen();
        if (pending.isEmpty()) {
            return;
        }
        List<RowInsert> batch = List.copyOf(pending);
        echo("BEGIN (implicit)");
        if (echoStatements) {
            for (RowInsert insert : batch) {
                TableDefinition table = store.table(insert.table()).definition();
                echo(compiler.insert(table, insert.values()));
            }
        }
        try {
            store.apply(batch);
        } catch (ChariotException e) {
            echo("ROLLBACK");
            discardPending();
            throw e;
        }
        pending.clear();
        pendingKeys.clear();
        echo("COMMIT");
        log.debug("Committed {} row(s)", batch.size());
    }

    /**
     * Discard buffered rows and forget the entities they belonged to.
     */
    public void rollback() {
        assertOpen();
        discardPending();
    }

    /**
     * Look up an entity by id: a buffered or already loaded instance, else the committed row.
     *
     * @return the entity, or empty when there is no such row or it is not an instance of the type
     */
    public <E> Optional<E> get(Class<E> type, Object id) {
        assertOpen();
        if (id == null) {
            return Optional.empty();
        }
        EntityMetadata metadata = schema.metadata(type);
        Object entity = identityMap.get(new IdentityMap.Key(metadata.entityType(), id));
        if (entity == null) {
            entity = load(metadata, id);
        }
        return type.isInstance(entity) ? Optional.of(type.cast(entity)) : Optional.empty();
    }

    public <T> Query<T> query(Class<T> type) {
        assertOpen();
        return new Query<>(this, type);
    }

    @Override
    public Object load(EntityMetadata family, Object id) {
        assertOpen();
        IdentityMap.Key key = new IdentityMap.Key(family.entityType(), id);
        Object cached = identityMap.get(key);
        if (cached != null) {
            return cached;
        }
        Object entity = materializer.materialize(family, id);
        if (entity != null) {
            identityMap.putIfAbsent(key, entity);
        }
        return entity;
    }

    @Override
    public void executing(QueryPlan plan) {
        if (echoStatements) {
            echo(compiler.select(plan));
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Roll back buffered work and release the identity map.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        discardPending();
        identityMap.clear();
        closed = true;
    }

    private List<RowInsert> rows(EntityMetadata metadata, VariantMapping variant, Map<String, Object> values) {
        List<RowInsert> rows = new ArrayList<>();
        Object id = values.get(metadata.id().property());

        Map<String, Object> base = new HashMap<>();
        for (PropertyMapping property : metadata.baseProperties()) {
            base.put(property.column(), values.get(property.property()));
        }
        if (metadata.isPolymorphic()) {
            base.put(metadata.discriminatorColumn(), variant.discriminatorValue());
        }
        rows.add(row(metadata.table(), base));

        if (variant.hasTable()) {
            Map<String, Object> specialization = new HashMap<>();
            specialization.put(metadata.id().column(), id);
            for (PropertyMapping property : variant.properties()) {
                specialization.put(property.column(), values.get(property.property()));
            }
            rows.add(row(variant.table(), specialization));
        }

        for (RelationshipMapping relationship : metadata.relationships()) {
            if (!relationship.isCollection() || !EntityMaterializer.owns(metadata, variant, relationship)) {
                continue;
            }
            Collection<?> targets = (Collection<?>) values.get(relationship.property());
            if (targets == null) {
                continue;
            }
            RelationshipMapping.JoinTableMapping joinTable = relationship.joinTable();
            for (Object target : targets) {
                Map<String, Object> link = new HashMap<>();
                link.put(joinTable.joinColumn(), id);
                link.put(joinTable.inverseJoinColumn(), target);
                rows.add(row(joinTable.name(), link));
            }
        }
        return rows;
    }

    private RowInsert row(String table, Map<String, Object> byColumn) {
        TableDefinition definition = store.table(table).definition();
        Object[] values = new Object[definition.columns().size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = byColumn.get(definition.columns().get(i).name());
        }
        return new RowInsert(table, values);
    }

    private void discardPending() {
        for (IdentityMap.Key key : pendingKeys) {
            identityMap.evict(key);
        }
        if (!pending.isEmpty()) {
            log.debug("Discarded {} pending row(s)", pending.size());
        }
        pending.clear();
        pendingKeys.clear();
    }

    private void echo(String message) {
        if (echoStatements) {
            echo.info(message);
        }
    }

    private void echo(Statement statement) {
        echo.info(statement.sql());
        echo.info("[parameters] {}", statement.parameters());
    }

    private static Object convertId(long id, Class<?> type) {
        if (type == Long.class || type == long.class) {
            return id;
        }
        if (type == Integer.class || type == int.class) {
            return Math.toIntExact(id);
        }
        throw new ChariotException("Generated ids must be Long or Integer, not " + type.getName());
    }

    private void assertOpen() {
        if (closed) {
            throw new IllegalStateException("Session is closed");
        }
    }
}
