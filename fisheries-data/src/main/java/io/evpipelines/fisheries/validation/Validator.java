package io.evpipelines.fisheries.validation;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import io.evpipelines.fisheries.rules.ColumnType;
import io.evpipelines.fisheries.rules.NumericRange;
import io.evpipelines.fisheries.rules.SchemaRules;
import io.evpipelines.metrics.Metrics;
import io.evpipelines.table.Row;
import io.evpipelines.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks a loaded table against its {@link SchemaRules} without touching the data.
 * Checks run in {@link CheckCategory} order; a missing required column ends validation immediately.
 */
public class Validator {
    private static final Logger LOG = LoggerFactory.getLogger(Validator.class);
    /** Distinct offending values listed per log line. */
    private static final int MAX_LOGGED_VALUES = 10;

    private final Metrics metrics;

    public Validator() {
        this(new Metrics(new MetricRegistry()));
    }

    public Validator(Metrics metrics) {
        this.metrics = metrics;
    }

    public ValidationReport validate(Table table, SchemaRules rules) {
        Metrics m = metrics.scoped(rules.variant().key());
        try (Timer.Context ignored = m.timer("validation.time").time()) {
            List<CheckResult> checks = new ArrayList<>(CheckCategory.values().length);

            CheckResult presence = checkPresence(table, rules);
            checks.add(presence);
            if (presence.isFatal()) {
                LOG.error("Missing required columns: {}", presence.violations().stream().map(Violation::column).toList());
                m.counter("validation.fatal").inc();
                return report(rules, table, checks);
            }
            List<String> optional = rules.optionalColumns().stream().filter(table::hasColumn).toList();
            if (!optional.isEmpty()) LOG.info("Optional columns present: {}", optional);
            LOG.info("Schema validation passed");

            checks.add(checkTypes(table, rules));
            checks.add(checkRanges(table, rules));
            checks.add(checkCategories(table, rules));

            ValidationReport report = report(rules, table, checks);
            for (CheckResult c : checks) {
                m.counter("validation." + c.category().key() + ".violations").inc(c.violations().size());
            }
            if (report.passed()) {
                LOG.info("All validation checks passed for {} rows", table.size());
            } else {
                LOG.warn("Validation finished with {} warnings across {} rows", report.warningCount(),
                        report.offendingRows().size());
            }
            return report;
        }
    }

    CheckResult checkPresence(Table table, SchemaRules rules) {
        LOG.info("Validating data schema...");
        List<Violation> missing = new ArrayList<>();
        for (String col : rules.requiredColumns()) {
            if (!table.hasColumn(col)) missing.add(Violation.missingColumn(col));
        }
        return new CheckResult(CheckCategory.SCHEMA_PRESENCE, missing);
    }

    CheckResult checkTypes(Table table, SchemaRules rules) {
        LOG.info("Validating data types...");
        List<Violation> out = new ArrayList<>();
        for (Map.Entry<String, ColumnType> e : rules.columnTypes().entrySet()) {
            String col = e.getKey();
            ColumnType type = e.getValue();
            if (!table.hasColumn(col)) continue;
            List<Row> rows = table.rows();
            int before = out.size();
            for (int i = 0; i < rows.size(); i++) {
                String raw = rows.get(i).get(col);
                if (!type.conforms(raw)) {
                    out.add(new Violation(i, col, raw, "not a valid " + type.displayName()));
                }
            }
            if (out.size() > before) {
                LOG.warn("Found {} non-{} values in '{}': {}", out.size() - before, type.displayName(), col,
                        sample(out.subList(before, out.size())));
            }
        }
        return new CheckResult(CheckCategory.TYPE, out);
    }

    /** Cells that fail to parse are left to the type check and not reported again here. */
    CheckResult checkRanges(Table table, SchemaRules rules) {
        LOG.info("Validating data ranges...");
        List<Violation> out = new ArrayList<>();
        for (Map.Entry<String, NumericRange> e : rules.ranges().entrySet()) {
            String col = e.getKey();
            NumericRange range = e.getValue();
            if (!table.hasColumn(col)) continue;
            ColumnType type = rules.typeOf(col);
            List<Row> rows = table.rows();
            int before = out.size();
            for (int i = 0; i < rows.size(); i++) {
                String raw = rows.get(i).get(col);
                OptionalDouble v = type.numericValue(raw);
                if (v.isPresent() && !range.contains(v.getAsDouble())) {
                    out.add(new Violation(i, col, raw, "outside expected range " + range.describe()));
                }
            }
            if (out.size() > before) {
                LOG.warn("Data quality issue: {} '{}' values outside expected range {}: {}", out.size() - before, col,
                        range.describe(), sample(out.subList(before, out.size())));
            }
        }
        if (out.isEmpty()) LOG.info("Data range validation passed");
        return new CheckResult(CheckCategory.RANGE, out);
    }

    CheckResult checkCategories(Table table, SchemaRules rules) {
        List<Violation> out = new ArrayList<>();
        for (Map.Entry<String, Set<String>> e : rules.categoricalValues().entrySet()) {
            String col = e.getKey();
            Set<String> allowed = e.getValue();
            if (!table.hasColumn(col)) continue;
            LOG.info("Validating {} values...", col);
            List<Row> rows = table.rows();
            int before = out.size();
            Set<String> observed = new TreeSet<>();
            for (int i = 0; i < rows.size(); i++) {
                String raw = rows.get(i).get(col);
                if (raw != null) observed.add(raw);
                if (raw == null || !allowed.contains(raw)) {
                    out.add(new Violation(i, col, raw, "not one of " + allowed));
                }
            }
            if (out.size() > before) {
                LOG.warn("Unexpected {} values: {}", col, sample(out.subList(before, out.size())));
            } else {
                LOG.info("All {} values valid: {}", col, observed);
            }
        }
        return new CheckResult(CheckCategory.CATEGORICAL, out);
    }

    private static ValidationReport report(SchemaRules rules, Table table, List<CheckResult> checks) {
        return new ValidationReport(rules.variant(), table.size(), checks);
    }

    private static Set<String> sample(List<Violation> violations) {
        Set<String> values = new TreeSet<>();
        for (Violation v : violations) {
            if (values.size() >= MAX_LOGGED_VALUES) break;
            values.add(String.valueOf(v.value()));
        }
        return values;
    }
}
