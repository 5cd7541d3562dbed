package io.chariot.storage;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shape of one heap table: ordered columns, an optional single-column primary key and foreign keys.
 * <p>
 * Junction tables have no primary key.
 */
public record TableDefinition(String name,
                              List<ColumnDefinition> columns,
                              String primaryKey,
                              List<ForeignKeyDefinition> foreignKeys) {

    public TableDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name required");
        }
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("columns required");
        }
        columns = List.copyOf(columns);
        foreignKeys = foreignKeys == null ? List.of() : List.copyOf(foreignKeys);
        Set<String> names = new LinkedHashSet<>();
        for (ColumnDefinition column : columns) {
            if (!names.add(column.name())) {
                throw new IllegalArgumentException("duplicate column " + column.name() + " in " + name);
            }
        }
        if (primaryKey != null && !names.contains(primaryKey)) {
            throw new IllegalArgumentException("primary key " + primaryKey + " is not a column of " + name);
        }
        for (ForeignKeyDefinition foreignKey : foreignKeys) {
            if (!names.contains(foreignKey.column())) {
                throw new IllegalArgumentException("foreign key " + foreignKey.column() + " is not a column of " + name);
            }
        }
    }

    /**
     * Position of a column in row arrays.
     *
     * @param column the column name
     * @return the position, or -1 if the table has no such column
     */
    public int columnIndex(String column) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(column)) {
                return i;
            }
        }
        return -1;
    }

    public ColumnDefinition column(String column) {
        int index = columnIndex(column);
        return index < 0 ? null : columns.get(index);
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnDefinition::name).toList();
    }

    /**
     * Columns that get a secondary hash index: unique columns and foreign key columns.
     */
    public Set<String> indexedColumns() {
        Set<String> indexed = new LinkedHashSet<>();
        for (ColumnDefinition column : columns) {
            if (column.unique() && !column.name().equals(primaryKey)) {
                indexed.add(column.name());
            }
        }
        for (ForeignKeyDefinition foreignKey : foreignKeys) {
            if (!foreignKey.column().equals(primaryKey)) {
                indexed.add(foreignKey.column());
            }
        }
        return indexed;
    }

    /**
     * Zips a row array into a column-name keyed map, in column order.
     */
    public Map<String, Object> asMap(Object[] values) {
        Map<String, Object> map = new LinkedHashMap<>(columns.size() * 2);
        for (int i = 0; i < columns.size(); i++) {
            map.put(columns.get(i).name(), values[i]);
        }
        return map;
    }
}
