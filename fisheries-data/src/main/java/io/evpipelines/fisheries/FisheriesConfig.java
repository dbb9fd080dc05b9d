package io.evpipelines.fisheries;

import io.evpipelines.fisheries.transform.TransformOptions;
import io.evpipelines.fisheries.transform.ViolationPolicy;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Run configuration. {@link #fromEnv()} reads system properties, then environment variables, then defaults;
 * the command line overrides on top.
 *
 * @param commercialRules    rules file replacing the bundled commercial rules, or null
 * @param nonCommercialRules rules file replacing the bundled non-commercial rules, or null
 */
public record FisheriesConfig(
        Path inputDir,
        Path outputDir,
        boolean removeAggregates,
        boolean removeDisplay,
        ViolationPolicy violationPolicy,
        boolean writeDiagnostics,
        boolean parallel,
        Path commercialRules,
        Path nonCommercialRules
) {
    public static FisheriesConfig fromEnv() {
        Path in = Path.of(setting("fisheries.in", "FISHERIES_IN", "data/raw"));
        Path out = Path.of(setting("fisheries.out", "FISHERIES_OUT", "data/cleaned"));
        boolean aggregates = parseSwitch("remove-aggregates", setting("fisheries.removeAggregates", "FISHERIES_REMOVE_AGGREGATES", "true"));
        boolean display = parseSwitch("remove-display", setting("fisheries.removeDisplay", "FISHERIES_REMOVE_DISPLAY", "false"));
        ViolationPolicy policy = ViolationPolicy.fromName(setting("fisheries.policy", "FISHERIES_POLICY", "warn"));
        boolean diagnostics = parseSwitch("diagnostics", setting("fisheries.diagnostics", "FISHERIES_DIAGNOSTICS", "false"));
        boolean parallel = parseSwitch("parallel", setting("fisheries.parallel", "FISHERIES_PARALLEL", "false"));
        Path commRules = optionalPath(setting("fisheries.rules.commercial", "FISHERIES_RULES_COMMERCIAL", ""));
        Path nonCommRules = optionalPath(setting("fisheries.rules.noncommercial", "FISHERIES_RULES_NONCOMMERCIAL", ""));
        return new FisheriesConfig(in, out, aggregates, display, policy, diagnostics, parallel, commRules, nonCommRules);
    }

    public TransformOptions transformOptions() {
        return new TransformOptions(removeAggregates, removeDisplay);
    }

    public Path rulesOverride(DatasetVariant variant) {
        return variant == DatasetVariant.COMMERCIAL ? commercialRules : nonCommercialRules;
    }

    /** Strict boolean: true/false, yes/no, 1/0. Anything else is a configuration error. */
    public static boolean parseSwitch(String name, String value) {
        if (value == null) throw new ConfigurationException("Switch '" + name + "' has no value");
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw new ConfigurationException("Unrecognized value for switch '" + name + "': '" + value + "'");
        };
    }

    private static String setting(String property, String env, String fallback) {
        return System.getProperty(property, System.getenv().getOrDefault(env, fallback));
    }

    private static Path optionalPath(String s) {
        return s == null || s.isBlank() ? null : Path.of(s);
    }
}
