package io.evpipelines.table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Ordered column list plus ordered rows. Tables are immutable; filtering derives a new table.
 * A row's index is its position in the table it was loaded into.
 */
public final class Table {
    private final List<String> columns;
    private final List<Row> rows;

    public Table(List<String> columns, List<Row> rows) {
        this.columns = List.copyOf(columns);
        this.rows = List.copyOf(rows);
    }

    public List<String> columns() { return columns; }
    public List<Row> rows() { return rows; }
    public int size() { return rows.size(); }
    public boolean isEmpty() { return rows.isEmpty(); }
    public boolean hasColumn(String column) { return columns.contains(column); }
    public Row row(int index) { return rows.get(index); }

    /** Column order of this table after dropping the given names. */
    public List<String> columnsWithout(Collection<String> dropped) {
        List<String> out = new ArrayList<>(columns);
        out.removeAll(dropped);
        return out;
    }

    @Override
    public String toString() {
        return "Table{columns=" + columns + ", rows=" + rows.size() + '}';
    }
}
