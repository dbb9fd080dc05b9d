package io.evpipelines.fisheries;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import io.evpipelines.fisheries.transform.ViolationPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI that validates and cleans the commercial and non-commercial fisheries exchange-value datasets.
 * Exit codes: 0 every requested variant succeeded, 1 at least one failed, 2 configuration error.
 */
@CommandLine.Command(name = "fisheries-clean", mixinStandardHelpOptions = true,
        description = "Validate and clean fisheries exchange-value CSVs and write summary statistics")
public final class FisheriesCleaningMain implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_VARIANT_FAILED = 1;
    static final int EXIT_CONFIG = 2;

    private static final Logger LOG = LoggerFactory.getLogger(FisheriesCleaningMain.class);

    @CommandLine.Option(names = {"-i", "--input"}, description = "Input directory (default: data/raw)")
    Path inputDir;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output directory (default: data/cleaned)")
    Path outputDir;

    @CommandLine.Option(names = "--remove-aggregates", paramLabel = "<true|false>",
            description = "Drop 'All Species' / 'All Ecosystems' rows (default: true)")
    String removeAggregates;

    @CommandLine.Option(names = "--remove-display", paramLabel = "<true|false>",
            description = "Drop *_olelo and *_formatted columns (default: false)")
    String removeDisplay;

    @CommandLine.Option(names = "--policy", paramLabel = "<warn|reject>",
            description = "Handling of rows with validation warnings (default: warn)")
    String policy;

    @CommandLine.Option(names = "--diagnostics", paramLabel = "<true|false>",
            description = "Write validation reports as JSON (default: false)")
    String diagnostics;

    @CommandLine.Option(names = "--parallel", paramLabel = "<true|false>",
            description = "Clean both variants concurrently (default: false)")
    String parallel;

    @CommandLine.Option(names = "--commercial-rules", description = "Rules JSON replacing the bundled commercial rules")
    Path commercialRules;

    @CommandLine.Option(names = "--non-commercial-rules", description = "Rules JSON replacing the bundled non-commercial rules")
    Path nonCommercialRules;

    @CommandLine.Option(names = {"-v", "--variant"}, split = ",",
            description = "Variants to clean: commercial, non-commercial (default: both)")
    List<String> variants = new ArrayList<>();

    public static void main(String[] args) {
        int code = new CommandLine(new FisheriesCleaningMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        FisheriesConfig cfg;
        Set<DatasetVariant> selected;
        FisheriesCleaningPipeline pipeline;
        try {
            cfg = config(FisheriesConfig.fromEnv());
            selected = selectedVariants();
            Injector injector = Guice.createInjector(new FisheriesModule(cfg, selected));
            pipeline = injector.getInstance(FisheriesCleaningPipeline.class);
        } catch (ConfigurationException e) {
            return configError(e);
        } catch (ProvisionException e) {
            if (e.getCause() instanceof ConfigurationException ce) return configError(ce);
            throw e;
        }

        PipelineOutcome outcome = pipeline.run(selected);
        if (outcome.allSucceeded()) {
            System.out.println("Data cleaning completed successfully.");
            System.out.println("  Cleaned files saved to: " + cfg.outputDir());
            System.out.println("  Summary JSON saved to: " + outcome.summaryFile());
            return EXIT_OK;
        }
        System.err.println("Data cleaning encountered errors. Check logs for details.");
        outcome.failures().forEach((v, e) -> System.err.println("  " + v.key() + ": " + e.getMessage()));
        return EXIT_VARIANT_FAILED;
    }

    FisheriesConfig config(FisheriesConfig base) {
        return new FisheriesConfig(
                inputDir != null ? inputDir : base.inputDir(),
                outputDir != null ? outputDir : base.outputDir(),
                removeAggregates != null ? FisheriesConfig.parseSwitch("remove-aggregates", removeAggregates) : base.removeAggregates(),
                removeDisplay != null ? FisheriesConfig.parseSwitch("remove-display", removeDisplay) : base.removeDisplay(),
                policy != null ? ViolationPolicy.fromName(policy) : base.violationPolicy(),
                diagnostics != null ? FisheriesConfig.parseSwitch("diagnostics", diagnostics) : base.writeDiagnostics(),
                parallel != null ? FisheriesConfig.parseSwitch("parallel", parallel) : base.parallel(),
                commercialRules != null ? commercialRules : base.commercialRules(),
                nonCommercialRules != null ? nonCommercialRules : base.nonCommercialRules());
    }

    Set<DatasetVariant> selectedVariants() {
        if (variants.isEmpty()) return EnumSet.allOf(DatasetVariant.class);
        Set<DatasetVariant> out = EnumSet.noneOf(DatasetVariant.class);
        for (String v : variants) out.add(DatasetVariant.fromName(v));
        return out;
    }

    private static int configError(ConfigurationException e) {
        LOG.error("Configuration error: {}", e.getMessage());
        System.err.println("Configuration error: " + e.getMessage());
        return EXIT_CONFIG;
    }
}
