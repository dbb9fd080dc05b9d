package io.evpipelines.fisheries.validation;

import io.evpipelines.fisheries.DatasetVariant;

import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Per-variant validation outcome: one {@link CheckResult} per category that ran, in run order.
 * A fatal report stops after the schema-presence check.
 */
public record ValidationReport(DatasetVariant variant, int rowCount, List<CheckResult> checks) {
    public ValidationReport {
        checks = List.copyOf(checks);
    }

    public boolean isFatal() {
        return checks.stream().anyMatch(CheckResult::isFatal);
    }

    public boolean passed() {
        return checks.stream().allMatch(CheckResult::passed);
    }

    public Optional<CheckResult> result(CheckCategory category) {
        return checks.stream().filter(c -> c.category() == category).findFirst();
    }

    public List<String> missingColumns() {
        return result(CheckCategory.SCHEMA_PRESENCE)
                .map(r -> r.violations().stream().map(Violation::column).toList())
                .orElse(List.of());
    }

    /** Rows flagged by any warning-level check. */
    public SortedSet<Long> offendingRows() {
        SortedSet<Long> rows = new TreeSet<>();
        for (CheckResult c : checks) {
            if (c.severity() == Severity.WARNING) rows.addAll(c.offendingRows());
        }
        return rows;
    }

    public int warningCount() {
        return checks.stream()
                .filter(c -> c.severity() == Severity.WARNING)
                .mapToInt(c -> c.violations().size())
                .sum();
    }
}
