package io.evpipelines.fisheries;

import io.evpipelines.fisheries.summary.CombinedSummary;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-variant results of one orchestrated run.
 *
 * @param summaryFile combined summary JSON, or null when no variant succeeded
 */
public record PipelineOutcome(
        Map<DatasetVariant, VariantResult> results,
        Map<DatasetVariant, VariantFailureException> failures,
        CombinedSummary summary,
        Path summaryFile
) {
    public PipelineOutcome {
        results = Collections.unmodifiableMap(copy(results));
        failures = Collections.unmodifiableMap(copy(failures));
    }

    public boolean allSucceeded() {
        return failures.isEmpty() && !results.isEmpty();
    }

    public boolean succeeded(DatasetVariant variant) {
        return results.containsKey(variant);
    }

    private static <V> Map<DatasetVariant, V> copy(Map<DatasetVariant, V> in) {
        Map<DatasetVariant, V> m = new EnumMap<>(DatasetVariant.class);
        m.putAll(in);
        return m;
    }
}
