package io.evpipelines.fisheries;

import io.evpipelines.fisheries.summary.SummaryRecord;
import io.evpipelines.fisheries.validation.ValidationReport;

import java.nio.file.Path;

/**
 * A successfully cleaned variant.
 *
 * @param diagnosticsFile validation report JSON, or null when diagnostics are off
 */
public record VariantResult(
        DatasetVariant variant,
        Path inputFile,
        Path outputFile,
        Path diagnosticsFile,
        ValidationReport report,
        SummaryRecord summary
) {}
