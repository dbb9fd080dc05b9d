package io.evpipelines.fisheries.rules;

import io.evpipelines.fisheries.ConfigurationException;
import io.evpipelines.fisheries.DatasetVariant;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable description of what one dataset variant must look like: required columns, column types,
 * numeric ranges, categorical closed sets, aggregate markers, display-only columns and the categorical
 * dimensions reported in the summary.
 */
public final class SchemaRules {
    private final DatasetVariant variant;
    private final List<String> requiredColumns;
    private final List<String> optionalColumns;
    private final Map<String, ColumnType> columnTypes;
    private final Map<String, NumericRange> ranges;
    private final Map<String, Set<String>> categoricalValues;
    private final Map<String, Set<String>> aggregateMarkers;
    private final List<String> displayColumns;
    private final Map<String, String> summaryDimensions;
    private final String yearColumn;
    private final String valueColumn;

    private SchemaRules(Builder b) {
        this.variant = b.variant;
        this.requiredColumns = List.copyOf(b.requiredColumns);
        this.optionalColumns = List.copyOf(b.optionalColumns);
        this.columnTypes = Collections.unmodifiableMap(new LinkedHashMap<>(b.columnTypes));
        this.ranges = Collections.unmodifiableMap(new LinkedHashMap<>(b.ranges));
        this.categoricalValues = freeze(b.categoricalValues);
        this.aggregateMarkers = freeze(b.aggregateMarkers);
        this.displayColumns = List.copyOf(b.displayColumns);
        this.summaryDimensions = Collections.unmodifiableMap(new LinkedHashMap<>(b.summaryDimensions));
        this.yearColumn = b.yearColumn;
        this.valueColumn = b.valueColumn;
    }

    public static Builder builder(DatasetVariant variant) {
        return new Builder(variant);
    }

    public DatasetVariant variant() { return variant; }
    public List<String> requiredColumns() { return requiredColumns; }
    public List<String> optionalColumns() { return optionalColumns; }
    public Map<String, ColumnType> columnTypes() { return columnTypes; }
    public Map<String, NumericRange> ranges() { return ranges; }
    public Map<String, Set<String>> categoricalValues() { return categoricalValues; }
    public Map<String, Set<String>> aggregateMarkers() { return aggregateMarkers; }
    public List<String> displayColumns() { return displayColumns; }
    /** Categorical column name to the summary key its distinct values are reported under. */
    public Map<String, String> summaryDimensions() { return summaryDimensions; }
    public String yearColumn() { return yearColumn; }
    public String valueColumn() { return valueColumn; }

    public ColumnType typeOf(String column) {
        return columnTypes.getOrDefault(column, ColumnType.STRING);
    }

    public NumericRange yearBounds() {
        return ranges.get(yearColumn);
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> in) {
        Map<String, Set<String>> out = new LinkedHashMap<>();
        in.forEach((k, v) -> out.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
        return Collections.unmodifiableMap(out);
    }

    @Override
    public String toString() {
        return "SchemaRules{" + variant.key() + ", required=" + requiredColumns + '}';
    }

    public static final class Builder {
        private final DatasetVariant variant;
        private final List<String> requiredColumns = new ArrayList<>();
        private final List<String> optionalColumns = new ArrayList<>();
        private final Map<String, ColumnType> columnTypes = new LinkedHashMap<>();
        private final Map<String, NumericRange> ranges = new LinkedHashMap<>();
        private final Map<String, Set<String>> categoricalValues = new LinkedHashMap<>();
        private final Map<String, Set<String>> aggregateMarkers = new LinkedHashMap<>();
        private final List<String> displayColumns = new ArrayList<>();
        private final Map<String, String> summaryDimensions = new LinkedHashMap<>();
        private String yearColumn = "year";
        private String valueColumn = "exchange_value";

        private Builder(DatasetVariant variant) {
            this.variant = Objects.requireNonNull(variant, "variant");
        }

        public Builder requiredColumns(Collection<String> cols) { requiredColumns.addAll(cols); return this; }
        public Builder optionalColumns(Collection<String> cols) { optionalColumns.addAll(cols); return this; }
        public Builder columnType(String column, ColumnType type) { columnTypes.put(column, type); return this; }
        public Builder range(String column, NumericRange range) { ranges.put(column, range); return this; }
        public Builder categorical(String column, Collection<String> values) {
            categoricalValues.put(column, new LinkedHashSet<>(values));
            return this;
        }
        public Builder aggregateMarkers(String column, Collection<String> markers) {
            aggregateMarkers.put(column, new LinkedHashSet<>(markers));
            return this;
        }
        public Builder displayColumns(Collection<String> cols) { displayColumns.addAll(cols); return this; }
        public Builder summaryDimension(String column, String summaryKey) { summaryDimensions.put(column, summaryKey); return this; }
        public Builder yearColumn(String column) { this.yearColumn = column; return this; }
        public Builder valueColumn(String column) { this.valueColumn = column; return this; }

        public SchemaRules build() {
            String v = variant.key();
            if (requiredColumns.isEmpty()) {
                throw new ConfigurationException(v + ": required columns must not be empty");
            }
            for (String c : List.of(yearColumn, valueColumn)) {
                if (!requiredColumns.contains(c)) {
                    throw new ConfigurationException(v + ": '" + c + "' must be a required column");
                }
            }
            categoricalValues.forEach((col, values) -> {
                if (values.isEmpty()) {
                    throw new ConfigurationException(v + ": closed set for '" + col + "' is empty");
                }
            });
            aggregateMarkers.forEach((col, markers) -> {
                Set<String> allowed = categoricalValues.get(col);
                if (allowed == null) {
                    throw new ConfigurationException(v + ": aggregate markers given for non-categorical column '" + col + "'");
                }
                for (String m : markers) {
                    if (!allowed.contains(m)) {
                        throw new ConfigurationException(v + ": aggregate marker '" + m + "' is not a valid '" + col + "' value");
                    }
                }
            });
            ranges.keySet().forEach(col -> {
                if (typeOf(col) == ColumnType.STRING) {
                    throw new ConfigurationException(v + ": range declared for non-numeric column '" + col + "'");
                }
            });
            return new SchemaRules(this);
        }

        private ColumnType typeOf(String column) {
            return columnTypes.getOrDefault(column, ColumnType.STRING);
        }
    }
}
