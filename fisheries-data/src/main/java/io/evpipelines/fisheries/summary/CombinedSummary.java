package io.evpipelines.fisheries.summary;

import io.evpipelines.fisheries.DatasetVariant;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The run-level document: one summary per succeeded variant, a failure message per failed variant, and
 * cross-variant totals when every variant succeeded.
 */
public record CombinedSummary(
        String pipelineTimestamp,
        Map<DatasetVariant, SummaryRecord> summaries,
        Map<DatasetVariant, String> failures
) {
    public CombinedSummary {
        summaries = Collections.unmodifiableMap(copy(summaries));
        failures = Collections.unmodifiableMap(copy(failures));
    }

    public Optional<SummaryRecord> summary(DatasetVariant variant) {
        return Optional.ofNullable(summaries.get(variant));
    }

    /** Present only when every variant succeeded. */
    public Optional<Overall> overall() {
        if (!failures.isEmpty() || summaries.size() < DatasetVariant.values().length) return Optional.empty();
        long records = 0;
        double value = 0.0;
        DateRange range = DateRange.EMPTY;
        for (SummaryRecord s : summaries.values()) {
            records += s.cleanedRowCount();
            value += s.totalExchangeValue();
            range = range.union(s.dateRange());
        }
        return Optional.of(new Overall(records, value, range));
    }

    public record Overall(long totalRecords, double totalExchangeValue, DateRange combinedDateRange) {}

    private static <V> Map<DatasetVariant, V> copy(Map<DatasetVariant, V> in) {
        Map<DatasetVariant, V> m = new EnumMap<>(DatasetVariant.class);
        m.putAll(in);
        return m;
    }
}
