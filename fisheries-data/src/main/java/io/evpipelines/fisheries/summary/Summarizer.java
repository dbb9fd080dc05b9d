package io.evpipelines.fisheries.summary;

import io.evpipelines.fisheries.rules.ColumnType;
import io.evpipelines.fisheries.rules.SchemaRules;
import io.evpipelines.table.Row;
import io.evpipelines.table.Table;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Computes a {@link SummaryRecord} from the raw and cleaned tables. Pure: reads both tables, writes nothing.
 * Cells that do not parse are skipped in sums and year bounds.
 */
public class Summarizer {
    private final Clock clock;

    public Summarizer(Clock clock) {
        this.clock = clock;
    }

    public SummaryRecord summarize(Table raw, Table cleaned, SchemaRules rules) {
        String yearCol = rules.yearColumn();
        String valueCol = rules.valueColumn();

        Long minYear = null;
        Long maxYear = null;
        BigDecimal total = BigDecimal.ZERO;
        SortedMap<Long, Long> recordsByYear = new TreeMap<>();
        SortedMap<Long, BigDecimal> valueByYear = new TreeMap<>();

        for (Row row : cleaned.rows()) {
            OptionalLong year = ColumnType.parseInteger(row.get(yearCol));
            OptionalDouble value = ColumnType.parseReal(row.get(valueCol));
            BigDecimal v = value.isPresent() ? BigDecimal.valueOf(value.getAsDouble()) : null;
            if (v != null) total = total.add(v);
            if (year.isPresent()) {
                long y = year.getAsLong();
                minYear = minYear == null ? y : Math.min(minYear, y);
                maxYear = maxYear == null ? y : Math.max(maxYear, y);
                recordsByYear.merge(y, 1L, Long::sum);
                if (v != null) valueByYear.merge(y, v, BigDecimal::add);
                else valueByYear.putIfAbsent(y, BigDecimal.ZERO);
            }
        }

        SortedMap<Long, Double> totalValueByYear = new TreeMap<>();
        valueByYear.forEach((y, v) -> totalValueByYear.put(y, v.doubleValue()));

        Map<String, List<Object>> distinct = new LinkedHashMap<>();
        rules.summaryDimensions().forEach((column, key) ->
                distinct.put(key, distinctValues(cleaned, column, rules.typeOf(column))));

        return new SummaryRecord(
                rules.variant(),
                LocalDateTime.now(clock).toString(),
                raw.size(),
                cleaned.size(),
                minYear == null ? DateRange.EMPTY : new DateRange(minYear, maxYear),
                total.doubleValue(),
                distinct,
                recordsByYear,
                totalValueByYear);
    }

    /** Sorted distinct values: numeric order for integer columns, lexicographic otherwise. */
    static List<Object> distinctValues(Table table, String column, ColumnType type) {
        if (!table.hasColumn(column)) return List.of();
        if (type == ColumnType.INTEGER) {
            SortedSet<Long> values = new TreeSet<>();
            for (Row row : table.rows()) {
                OptionalLong v = ColumnType.parseInteger(row.get(column));
                if (v.isPresent()) values.add(v.getAsLong());
            }
            return new ArrayList<>(values);
        }
        SortedSet<String> values = new TreeSet<>();
        for (Row row : table.rows()) {
            String v = row.get(column);
            if (v != null && !v.isEmpty()) values.add(v);
        }
        return new ArrayList<>(values);
    }
}
