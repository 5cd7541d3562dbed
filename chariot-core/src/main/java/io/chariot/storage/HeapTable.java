package io.chariot.storage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Row-oriented heap table. Rows keep insertion order and are never updated or removed.
 * <p>
 * Inserts are unchecked: {@link Store#apply(List)} validates a batch before any row lands here.
 */
public final class HeapTable {
    private static final int DEFAULT_CAPACITY = 64;

    private final TableDefinition definition;
    private final int primaryKeyIndex;
    private final List<Object[]> rows;
    private final Map<Object, Integer> primaryIndex;
    private final Map<String, HashIndex<Object>> indexes;

    public HeapTable(TableDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition required");
        }
        this.definition = definition;
        this.primaryKeyIndex = definition.primaryKey() == null ? -1 : definition.columnIndex(definition.primaryKey());
        this.rows = new ArrayList<>(DEFAULT_CAPACITY);
        this.primaryIndex = new HashMap<>(DEFAULT_CAPACITY);
        this.indexes = new HashMap<>();
        for (String column : definition.indexedColumns()) {
            indexes.put(column, new HashIndex<>());
        }
    }

    public String name() {
        return definition.name();
    }

    public TableDefinition definition() {
        return definition;
    }

    public long rowCount() {
        return rows.size();
    }

    int insert(Object[] values) {
        if (values == null || values.length != definition.columns().size()) {
            throw new IllegalArgumentException("values length must match column count");
        }
        int row = rows.size();
        rows.add(values.clone());
        if (primaryKeyIndex >= 0) {
            primaryIndex.put(values[primaryKeyIndex], row);
        }
        for (Map.Entry<String, HashIndex<Object>> entry : indexes.entrySet()) {
            Object key = values[definition.columnIndex(entry.getKey())];
            if (key != null) {
                entry.getValue().add(key, row);
            }
        }
        return row;
    }

    /**
     * Row index for a primary key value.
     *
     * @param id the primary key value
     * @return the row index, or -1 if absent or the table has no primary key
     */
    public int findById(Object id) {
        if (id == null || primaryKeyIndex < 0) {
            return -1;
        }
        Integer row = primaryIndex.get(id);
        return row == null ? -1 : row;
    }

    /**
     * Rows whose column equals the value. Uses the primary or a secondary index when one exists,
     * a scan otherwise.
     */
    public int[] lookup(String column, Object value) {
        if (value == null) {
            return new int[0];
        }
        if (primaryKeyIndex >= 0 && column.equals(definition.primaryKey())) {
            int row = findById(value);
            return row < 0 ? new int[0] : new int[] { row };
        }
        HashIndex<Object> index = indexes.get(column);
        if (index != null) {
            return index.lookup(value);
        }
        int position = requireColumn(column);
        int[] matches = new int[rows.size()];
        int count = 0;
        for (int i = 0; i < rows.size(); i++) {
            if (value.equals(rows.get(i)[position])) {
                matches[count++] = i;
            }
        }
        int[] trimmed = new int[count];
        System.arraycopy(matches, 0, trimmed, 0, count);
        return trimmed;
    }

    public boolean contains(String column, Object value) {
        return lookup(column, value).length > 0;
    }

    public int[] scanAll() {
        int[] all = new int[rows.size()];
        for (int i = 0; i < all.length; i++) {
            all[i] = i;
        }
        return all;
    }

    public Object value(int row, String column) {
        return rows.get(row)[requireColumn(column)];
    }

    public Object[] row(int row) {
        return rows.get(row).clone();
    }

    private int requireColumn(String column) {
        int position = definition.columnIndex(column);
        if (position < 0) {
            throw new IllegalArgumentException("no column " + column + " in " + definition.name());
        }
        return position;
    }
}
