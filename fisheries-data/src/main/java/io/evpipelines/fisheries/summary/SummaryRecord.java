package io.evpipelines.fisheries.summary;

import io.evpipelines.fisheries.DatasetVariant;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Statistics for one cleaned variant.
 *
 * @param distinctValues summary key (e.g. {@code unique_counties}) to the sorted distinct values of that dimension
 */
public record SummaryRecord(
        DatasetVariant variant,
        String processingTimestamp,
        long rawRowCount,
        long cleanedRowCount,
        DateRange dateRange,
        double totalExchangeValue,
        Map<String, List<Object>> distinctValues,
        SortedMap<Long, Long> recordsByYear,
        SortedMap<Long, Double> totalValueByYear
) {
    public SummaryRecord {
        Map<String, List<Object>> distinct = new LinkedHashMap<>();
        distinctValues.forEach((key, values) -> distinct.put(key, List.copyOf(values)));
        distinctValues = Collections.unmodifiableMap(distinct);
        recordsByYear = Collections.unmodifiableSortedMap(new TreeMap<>(recordsByYear));
        totalValueByYear = Collections.unmodifiableSortedMap(new TreeMap<>(totalValueByYear));
    }

    public String dataType() { return variant.key(); }

    public long rowsRemoved() { return rawRowCount - cleanedRowCount; }

    public List<Object> distinct(String key) {
        return distinctValues.getOrDefault(key, List.of());
    }
}
