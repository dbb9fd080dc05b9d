package io.evpipelines.fisheries.validation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of one check category.
 */
public record CheckResult(CheckCategory category, List<Violation> violations) {
    public CheckResult {
        violations = List.copyOf(violations);
    }

    public boolean passed() { return violations.isEmpty(); }
    public Severity severity() { return category.severity(); }
    public boolean isFatal() { return !passed() && severity() == Severity.FATAL; }

    public SortedSet<Long> offendingRows() {
        SortedSet<Long> rows = new TreeSet<>();
        for (Violation v : violations) {
            if (v.isRowLevel()) rows.add(v.rowIndex());
        }
        return rows;
    }

    /** Distinct offending values per column, in first-seen order. */
    public Set<String> offendingValues(String column) {
        Set<String> out = new LinkedHashSet<>();
        for (Violation v : violations) {
            if (column.equals(v.column())) out.add(v.value());
        }
        return out;
    }
}
