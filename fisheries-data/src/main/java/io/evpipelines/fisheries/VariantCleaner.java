package io.evpipelines.fisheries;

import io.evpipelines.fisheries.io.CleanedCsvExporter;
import io.evpipelines.fisheries.io.CsvTableLoader;
import io.evpipelines.fisheries.io.OutputNaming;
import io.evpipelines.fisheries.rules.SchemaRules;
import io.evpipelines.fisheries.summary.Summarizer;
import io.evpipelines.fisheries.summary.SummaryRecord;
import io.evpipelines.fisheries.transform.TransformOptions;
import io.evpipelines.fisheries.transform.Transformer;
import io.evpipelines.fisheries.transform.ViolationPolicy;
import io.evpipelines.fisheries.validation.ReportJsonWriter;
import io.evpipelines.fisheries.validation.ValidationReport;
import io.evpipelines.fisheries.validation.Validator;
import io.evpipelines.metrics.Metrics;
import io.evpipelines.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Set;

/**
 * Runs one variant end to end: load, validate, stop on a fatal schema problem, transform, summarize, export.
 * Nothing is written for a variant that fails before export.
 */
public class VariantCleaner {
    private static final Logger LOG = LoggerFactory.getLogger(VariantCleaner.class);
    private static final String RULE = "=".repeat(60);

    private final SchemaRules rules;
    private final TransformOptions options;
    private final ViolationPolicy policy;
    private final boolean writeDiagnostics;
    private final OutputNaming naming;
    private final Metrics metrics;
    private final CsvTableLoader loader;
    private final Validator validator;
    private final Transformer transformer;
    private final Summarizer summarizer;
    private final CleanedCsvExporter exporter;

    public VariantCleaner(SchemaRules rules, TransformOptions options, ViolationPolicy policy, boolean writeDiagnostics,
                          OutputNaming naming, Metrics metrics, Clock clock) {
        this.rules = rules;
        this.options = options;
        this.policy = policy;
        this.writeDiagnostics = writeDiagnostics;
        this.naming = naming;
        this.metrics = metrics;
        this.loader = new CsvTableLoader(metrics);
        this.validator = new Validator(metrics);
        this.transformer = new Transformer(rules, metrics);
        this.summarizer = new Summarizer(clock);
        this.exporter = new CleanedCsvExporter(metrics);
    }

    public DatasetVariant variant() { return rules.variant(); }

    public VariantResult clean(Path inputFile) throws VariantFailureException {
        DatasetVariant variant = rules.variant();
        LOG.info(RULE);
        LOG.info("{} FISHERIES DATA CLEANING PIPELINE", variant.label());
        LOG.info(RULE);

        Table raw = loader.load(variant, inputFile);

        ValidationReport report = validator.validate(raw, rules);
        Path diagnostics = writeDiagnostics ? writeDiagnostics(report) : null;
        if (report.isFatal()) {
            throw new SchemaViolationException(variant, report.missingColumns());
        }

        Set<Long> rejected = policy == ViolationPolicy.REJECT ? report.offendingRows() : Set.of();
        Table cleaned;
        try {
            cleaned = transformer.transform(raw, options, rejected);
        } catch (Exception e) {
            throw new VariantFailureException(variant, "Transform failed: " + e.getMessage(), e);
        }

        Path output = exporter.export(variant, cleaned, naming.cleanedCsv(variant));
        LOG.info("Generating summary statistics...");
        SummaryRecord summary = summarizer.summarize(raw, cleaned, rules);

        Metrics m = metrics.scoped(variant.key());
        m.counter("rows.raw").inc(summary.rawRowCount());
        m.counter("rows.cleaned").inc(summary.cleanedRowCount());
        m.counter("rows.removed").inc(summary.rowsRemoved());

        LOG.info(RULE);
        LOG.info("{} DATA CLEANING COMPLETE", variant.label());
        LOG.info("Input:  {} rows", String.format("%,d", summary.rawRowCount()));
        LOG.info("Output: {} rows", String.format("%,d", summary.cleanedRowCount()));
        LOG.info("Removed: {} rows", String.format("%,d", summary.rowsRemoved()));
        LOG.info(RULE);
        return new VariantResult(variant, inputFile, output, diagnostics, report, summary);
    }

    private Path writeDiagnostics(ValidationReport report) {
        Path file = naming.diagnosticsJson(report.variant());
        try {
            new ReportJsonWriter().write(report, file);
            LOG.info("Validation diagnostics written to {}", file);
            return file;
        } catch (IOException e) {
            LOG.warn("Could not write validation diagnostics to {}: {}", file, e.getMessage());
            return null;
        }
    }
}
