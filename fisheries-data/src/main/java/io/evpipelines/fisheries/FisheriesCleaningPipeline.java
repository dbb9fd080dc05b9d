package io.evpipelines.fisheries;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import io.evpipelines.fisheries.io.InputLocator;
import io.evpipelines.fisheries.io.OutputNaming;
import io.evpipelines.fisheries.rules.SchemaRules;
import io.evpipelines.fisheries.summary.CombinedSummary;
import io.evpipelines.fisheries.summary.SummaryJsonWriter;
import io.evpipelines.fisheries.summary.SummaryRecord;
import io.evpipelines.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the requested variants, each independently: a failure in one never stops the other. Writes the combined
 * summary for the variants that succeeded and logs a final report.
 */
public class FisheriesCleaningPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(FisheriesCleaningPipeline.class);
    private static final String RULE = "=".repeat(70);

    private final FisheriesConfig config;
    private final Map<DatasetVariant, SchemaRules> rules;
    private final MetricRegistry registry;
    private final Clock clock;
    private final OutputNaming naming;
    private final InputLocator locator;

    public FisheriesCleaningPipeline(FisheriesConfig config, Map<DatasetVariant, SchemaRules> rules,
                                     MetricRegistry registry, Clock clock) {
        this.config = config;
        this.rules = new EnumMap<>(rules);
        this.registry = registry;
        this.clock = clock;
        this.naming = new OutputNaming(config.outputDir(), clock);
        this.locator = new InputLocator(config.inputDir());
    }

    public PipelineOutcome run() throws IOException {
        return run(Set.of(DatasetVariant.values()));
    }

    public PipelineOutcome run(Set<DatasetVariant> variants) throws IOException {
        Files.createDirectories(config.outputDir());
        LOG.info(RULE);
        LOG.info("FISHERIES DATA CLEANING PIPELINE - START");
        LOG.info(RULE);
        LOG.info("Input Directory:  {}", config.inputDir().toAbsolutePath());
        LOG.info("Output Directory: {}", config.outputDir().toAbsolutePath());
        LOG.info("Remove Aggregates: {}", config.removeAggregates());
        LOG.info("Remove Display Columns: {}", config.removeDisplay());
        LOG.info("Violation Policy: {}", config.violationPolicy());
        LOG.info(RULE);

        Map<DatasetVariant, VariantResult> results = new EnumMap<>(DatasetVariant.class);
        Map<DatasetVariant, VariantFailureException> failures = new EnumMap<>(DatasetVariant.class);
        for (Map.Entry<DatasetVariant, Attempt> e : attempt(variants).entrySet()) {
            Attempt a = e.getValue();
            if (a.result != null) results.put(e.getKey(), a.result);
            else failures.put(e.getKey(), a.failure);
        }

        Map<DatasetVariant, SummaryRecord> summaries = new EnumMap<>(DatasetVariant.class);
        results.forEach((v, r) -> summaries.put(v, r.summary()));
        Map<DatasetVariant, String> messages = new EnumMap<>(DatasetVariant.class);
        failures.forEach((v, f) -> messages.put(v, f.getMessage()));
        CombinedSummary combined = new CombinedSummary(LocalDateTime.now(clock).toString(), summaries, messages);

        Path summaryFile = null;
        if (!results.isEmpty()) {
            LOG.info("Exporting summary statistics to JSON...");
            summaryFile = new SummaryJsonWriter().write(combined, naming.summaryJson());
            LOG.info("Summary exported to {}", summaryFile);
        } else {
            LOG.error("No variant succeeded; summary not written");
        }

        PipelineOutcome outcome = new PipelineOutcome(results, failures, combined, summaryFile);
        logReport(variants, outcome);
        Slf4jReporter.forRegistry(registry)
                .outputTo(LoggerFactory.getLogger("io.evpipelines.metrics"))
                .build()
                .report();
        return outcome;
    }

    private Map<DatasetVariant, Attempt> attempt(Set<DatasetVariant> variants) {
        Map<DatasetVariant, Attempt> out = new LinkedHashMap<>();
        if (!config.parallel() || variants.size() < 2) {
            for (DatasetVariant v : DatasetVariant.values()) {
                if (variants.contains(v)) out.put(v, runVariant(v));
            }
            return out;
        }
        ExecutorService pool = Executors.newFixedThreadPool(variants.size());
        try {
            Map<DatasetVariant, Future<Attempt>> futures = new LinkedHashMap<>();
            for (DatasetVariant v : DatasetVariant.values()) {
                if (variants.contains(v)) futures.put(v, pool.submit(() -> runVariant(v)));
            }
            for (Map.Entry<DatasetVariant, Future<Attempt>> e : futures.entrySet()) {
                DatasetVariant v = e.getKey();
                try {
                    out.put(v, e.getValue().get());
                } catch (ExecutionException ex) {
                    if (ex.getCause() instanceof ConfigurationException ce) throw ce;
                    out.put(v, Attempt.failed(new VariantFailureException(v, "Unexpected failure: " + ex.getCause(), ex.getCause())));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    out.put(v, Attempt.failed(new VariantFailureException(v, "Interrupted", ie)));
                }
            }
        } finally {
            pool.shutdownNow();
        }
        return out;
    }

    private Attempt runVariant(DatasetVariant variant) {
        LOG.info("");
        LOG.info("STARTING {} DATA CLEANING", variant.label());
        LOG.info("");
        try {
            SchemaRules r = rules.get(variant);
            if (r == null) throw new ConfigurationException("No rules configured for " + variant.key());
            VariantCleaner cleaner = new VariantCleaner(r, config.transformOptions(), config.violationPolicy(),
                    config.writeDiagnostics(), naming, new Metrics(registry), clock);
            return Attempt.ok(cleaner.clean(locator.locate(variant)));
        } catch (VariantFailureException e) {
            LOG.error("{} data cleaning failed: {}", variant.label(), e.getMessage());
            return Attempt.failed(e);
        }
    }

    private void logReport(Set<DatasetVariant> variants, PipelineOutcome outcome) {
        LOG.info("");
        LOG.info(RULE);
        LOG.info("FISHERIES DATA CLEANING PIPELINE - FINAL REPORT");
        LOG.info(RULE);
        for (DatasetVariant v : DatasetVariant.values()) {
            if (!variants.contains(v)) continue;
            LOG.info("");
            VariantResult r = outcome.results().get(v);
            if (r == null) {
                LOG.info("{} FISHERIES: FAILED ({})", v.label(), outcome.failures().get(v).getMessage());
                continue;
            }
            SummaryRecord s = r.summary();
            LOG.info("{} FISHERIES:", v.label());
            LOG.info("  Status: SUCCESS");
            LOG.info("  Input Rows:  {}", String.format("%,d", s.rawRowCount()));
            LOG.info("  Output Rows: {}", String.format("%,d", s.cleanedRowCount()));
            LOG.info("  Removed:     {}", String.format("%,d", s.rowsRemoved()));
            LOG.info("  Date Range:  {}-{}", s.dateRange().minYear(), s.dateRange().maxYear());
            LOG.info("  Total Value: {}", String.format("$%,.2f", s.totalExchangeValue()));
            LOG.info("  Warnings:    {}", r.report().warningCount());
            s.distinctValues().forEach((key, values) -> LOG.info("  {}: {}", key, values.size()));
        }
        LOG.info("");
        LOG.info(RULE);
        LOG.info(outcome.allSucceeded() ? "PIPELINE STATUS: SUCCESS" : "PIPELINE STATUS: PARTIAL SUCCESS OR FAILURE");
    }

    private static final class Attempt {
        final VariantResult result;
        final VariantFailureException failure;

        private Attempt(VariantResult result, VariantFailureException failure) {
            this.result = result;
            this.failure = failure;
        }

        static Attempt ok(VariantResult r) { return new Attempt(r, null); }
        static Attempt failed(VariantFailureException e) { return new Attempt(null, e); }
    }
}
