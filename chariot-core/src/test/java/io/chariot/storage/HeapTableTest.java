package io.chariot.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class HeapTableTest {

    private static final TableDefinition PERSON = new TableDefinition("person",
            List.of(new ColumnDefinition("id", Long.class, false, false),
                    new ColumnDefinition("type", String.class, false, false),
                    new ColumnDefinition("last_name", String.class, true, false)),
            "id", List.of());

    @Test
    @DisplayName("Should keep insertion order and find rows by id")
    void shouldFindById() {
        HeapTable table = new HeapTable(PERSON);
        table.insert(new Object[] { 7L, "employee", "Zuko" });
        table.insert(new Object[] { 3L, "customer", null });

        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.findById(3L)).isEqualTo(1);
        assertThat(table.findById(42L)).isEqualTo(-1);
        assertThat(table.scanAll()).containsExactly(0, 1);
        assertThat(table.row(0)).containsExactly(7L, "employee", "Zuko");
    }

    @Test
    @DisplayName("Should scan unindexed columns")
    void shouldScanUnindexedColumns() {
        HeapTable table = new HeapTable(PERSON);
        table.insert(new Object[] { 1L, "employee", "Zuko" });
        table.insert(new Object[] { 2L, "customer", null });
        table.insert(new Object[] { 3L, "employee", "Dee" });

        assertThat(table.lookup("type", "employee")).containsExactly(0, 2);
        assertThat(table.lookup("last_name", null)).isEmpty();
        assertThat(table.contains("type", "person")).isFalse();
    }

    @Test
    @DisplayName("Should reject unknown columns and wrong row widths")
    void shouldRejectBadAccess() {
        HeapTable table = new HeapTable(PERSON);

        assertThatThrownBy(() -> table.insert(new Object[] { 1L }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("values length");
        table.insert(new Object[] { 1L, "person", null });
        assertThatThrownBy(() -> table.value(0, "first_name"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no column first_name");
    }

    @Test
    @DisplayName("Should validate table definitions")
    void shouldValidateDefinitions() {
        List<ColumnDefinition> columns = List.of(new ColumnDefinition("id", Long.class, false, false));

        assertThatThrownBy(() -> new TableDefinition(" ", columns, "id", List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("name required");
        assertThatThrownBy(() -> new TableDefinition("t", columns, "key", List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("primary key key is not a column of t");
        assertThatThrownBy(() -> new TableDefinition("t", columns, "id",
                List.of(new ForeignKeyDefinition("other_id", "other", "id"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("foreign key other_id");
    }

    @Test
    @DisplayName("Should index unique and foreign key columns")
    void shouldListIndexedColumns() {
        TableDefinition item = new TableDefinition("item",
                List.of(new ColumnDefinition("id", Long.class, false, true),
                        new ColumnDefinition("sku", String.class, false, true),
                        new ColumnDefinition("truck_id", Long.class, false, false)),
                "id", List.of(new ForeignKeyDefinition("truck_id", "truck", "id")));

        assertThat(item.indexedColumns()).containsExactly("sku", "truck_id");
        assertThat(item.asMap(new Object[] { 1L, "A-1", 2L })).containsExactly(
                entry("id", 1L),
                entry("sku", "A-1"),
                entry("truck_id", 2L));
    }
}
