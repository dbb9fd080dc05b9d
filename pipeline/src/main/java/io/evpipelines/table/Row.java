package io.evpipelines.table;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One table row: an immutable, ordered mapping from column name to the raw cell text as read from the input.
 * Typed access parses on demand so the row itself never loses what was on disk.
 */
public final class Row {
    private final Map<String, String> cells;

    private Row(Map<String, String> cells) {
        this.cells = Collections.unmodifiableMap(cells);
    }

    public static Row of(List<String> columns, List<String> values) {
        if (columns.size() != values.size()) {
            throw new IllegalArgumentException("Expected " + columns.size() + " values but got " + values.size());
        }
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            m.put(columns.get(i), values.get(i));
        }
        return new Row(m);
    }

    public static Row of(Map<String, String> cells) {
        return new Row(new LinkedHashMap<>(cells));
    }

    public Set<String> columns() { return cells.keySet(); }

    public boolean has(String column) { return cells.containsKey(column); }

    /** Raw cell text, or null when the row has no such column. */
    public String get(String column) { return cells.get(column); }

    public Map<String, String> asMap() { return cells; }

    /** Copy of this row without the given columns; absent names are ignored. */
    public Row without(Collection<String> columns) {
        if (columns.isEmpty() || Collections.disjoint(cells.keySet(), columns)) return this;
        Map<String, String> m = new LinkedHashMap<>(cells);
        m.keySet().removeAll(columns);
        return new Row(m);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row that)) return false;
        return cells.equals(that.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cells);
    }

    @Override
    public String toString() {
        return cells.toString();
    }
}
