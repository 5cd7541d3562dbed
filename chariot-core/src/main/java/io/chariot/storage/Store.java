package io.chariot.storage;

import io.chariot.core.ChariotException;
import io.chariot.core.ConstraintViolationException;
import io.chariot.core.ConstraintViolationException.Constraint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An isolated in-memory relational store: heap tables, their indexes and id sequences.
 * <p>
 * A store lives until {@link #close()}; data is never written anywhere else. Each
 * {@link #open(String)} call yields a fresh, empty store, so tests get isolation by opening
 * their own.
 * <p>
 * Writes go through {@link #apply(List)}, which validates the whole batch before storing
 * any row of it.
 */
public final class Store implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Store.class);

    private static final String SCHEME = "mem:";

    private final String url;
    private final Map<String, HeapTable> tables = new LinkedHashMap<>();
    private final Map<String, AtomicLong> sequences = new HashMap<>();
    private boolean closed;

    private Store(String url) {
        this.url = url;
    }

    /**
     * Open a store for the connection string.
     *
     * @param url {@code mem:} or {@code mem:<name>}
     * @return a new, empty store
     * @throws ChariotException for any other scheme
     */
    public static Store open(String url) {
        if (url == null || !url.startsWith(SCHEME)) {
            throw new ChariotException("Unsupported store url: " + url + " (expected " + SCHEME + "[name])");
        }
        log.debug("Opened store {}", url);
        return new Store(url);
    }

    public String url() {
        return url;
    }

    /**
     * Create a table unless one with the same name exists.
     *
     * @return true if the table was created
     */
    public boolean createTable(TableDefinition definition) {
        assertOpen();
        if (tables.containsKey(definition.name())) {
            return false;
        }
        tables.put(definition.name(), new HeapTable(definition));
        log.debug("Created table {} {}", definition.name(), definition.columnNames());
        return true;
    }

    public void createAll(Collection<TableDefinition> definitions) {
        for (TableDefinition definition : definitions) {
            createTable(definition);
        }
    }

    public boolean hasTable(String name) {
        assertOpen();
        return tables.containsKey(name);
    }

    public HeapTable table(String name) {
        assertOpen();
        HeapTable table = tables.get(name);
        if (table == null) {
            throw new ChariotException("No such table: " + name);
        }
        return table;
    }

    /**
     * Next value of a named id sequence, starting at 1.
     */
    public long nextId(String sequence) {
        assertOpen();
        return sequences.computeIfAbsent(sequence, ignored -> new AtomicLong()).incrementAndGet();
    }

    /**
     * Keep a sequence ahead of an explicitly supplied id.
     */
    public void observeId(String sequence, long id) {
        assertOpen();
        sequences.computeIfAbsent(sequence, ignored -> new AtomicLong()).accumulateAndGet(id, Math::max);
    }

    /**
     * Validate and store a batch of rows, all or nothing.
     * <p>
     * Checks, per row in batch order: not-null columns, primary key uniqueness, unique columns,
     * then foreign keys. A foreign key may reference a committed row or a row earlier in the
     * same batch.
     *
     * @param batch the rows to insert
     * @throws ConstraintViolationException on the first violated constraint; nothing is stored
     */
    public void apply(List<RowInsert> batch) {
        assertOpen();
        Map<String, Map<String, Set<Object>>> pending = new HashMap<>();
        for (RowInsert insert : batch) {
            validate(insert, pending);
        }
        for (RowInsert insert : batch) {
            tables.get(insert.table()).insert(insert.values());
        }
        log.debug("Applied {} row(s) to {}", batch.size(), url);
    }

    private void validate(RowInsert insert, Map<String, Map<String, Set<Object>>> pending) {
        HeapTable table = table(insert.table());
        TableDefinition definition = table.definition();
        Object[] values = insert.values();
        if (values.length != definition.columns().size()) {
            throw new ChariotException("Row for " + definition.name() + " has " + values.length
                    + " values, expected " + definition.columns().size());
        }
        Map<String, Set<Object>> pendingForTable = pending.computeIfAbsent(definition.name(), ignored -> new HashMap<>());

        for (int i = 0; i < values.length; i++) {
            ColumnDefinition column = definition.columns().get(i);
            boolean required = !column.nullable() || column.name().equals(definition.primaryKey());
            if (values[i] == null && required) {
                throw new ConstraintViolationException(definition.name(), column.name(), Constraint.NOT_NULL,
                        "value required");
            }
        }

        if (definition.primaryKey() != null) {
            Object id = values[definition.columnIndex(definition.primaryKey())];
            if (table.findById(id) >= 0 || seen(pendingForTable, definition.primaryKey(), id)) {
                throw new ConstraintViolationException(definition.name(), definition.primaryKey(),
                        Constraint.PRIMARY_KEY, "duplicate id " + id);
            }
        }

        for (int i = 0; i < values.length; i++) {
            ColumnDefinition column = definition.columns().get(i);
            if (!column.unique() || values[i] == null || column.name().equals(definition.primaryKey())) {
                continue;
            }
            if (table.contains(column.name(), values[i]) || seen(pendingForTable, column.name(), values[i])) {
                throw new ConstraintViolationException(definition.name(), column.name(), Constraint.UNIQUE,
                        "duplicate value " + values[i]);
            }
        }

        for (ForeignKeyDefinition foreignKey : definition.foreignKeys()) {
            Object value = values[definition.columnIndex(foreignKey.column())];
            if (value == null) {
                continue;
            }
            HeapTable referenced = tables.get(foreignKey.referencedTable());
            boolean committed = referenced != null && referenced.contains(foreignKey.referencedColumn(), value);
            boolean earlierInBatch = seen(pending.getOrDefault(foreignKey.referencedTable(), Map.of()),
                    foreignKey.referencedColumn(), value);
            if (!committed && !earlierInBatch) {
                throw new ConstraintViolationException(definition.name(), foreignKey.column(), Constraint.FOREIGN_KEY,
                        "no " + foreignKey.referencedTable() + "." + foreignKey.referencedColumn() + " = " + value);
            }
        }

        for (int i = 0; i < values.length; i++) {
            if (values[i] != null) {
                pendingForTable.computeIfAbsent(definition.columns().get(i).name(), ignored -> new HashSet<>())
                        .add(values[i]);
            }
        }
    }

    private static boolean seen(Map<String, Set<Object>> pendingForTable, String column, Object value) {
        Set<Object> values = pendingForTable.get(column);
        return values != null && values.contains(value);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        tables.clear();
        sequences.clear();
        log.debug("Closed store {}", url);
    }

    private void assertOpen() {
        if (closed) {
            throw new IllegalStateException("Store is closed");
        }
    }
}
