package io.evpipelines.fisheries;

import java.util.Locale;

/**
 * The two fisheries datasets. Each variant knows where its default rules live and how its input file is named.
 */
public enum DatasetVariant {
    COMMERCIAL("commercial", "COMMERCIAL", "rules/commercial.json",
            "*tidied_comm_ev*.csv", "*comm_ev*.csv", "noncomm", "cleaned_commercial"),
    NON_COMMERCIAL("non_commercial", "NON-COMMERCIAL", "rules/non-commercial.json",
            "*tidied_noncomm_ev*.csv", "*noncomm_ev*.csv", null, "cleaned_noncommercial");

    private final String key;
    private final String label;
    private final String rulesResource;
    private final String inputGlob;
    private final String fallbackGlob;
    private final String fallbackExclude;
    private final String outputPrefix;

    DatasetVariant(String key, String label, String rulesResource, String inputGlob, String fallbackGlob,
                   String fallbackExclude, String outputPrefix) {
        this.key = key;
        this.label = label;
        this.rulesResource = rulesResource;
        this.inputGlob = inputGlob;
        this.fallbackGlob = fallbackGlob;
        this.fallbackExclude = fallbackExclude;
        this.outputPrefix = outputPrefix;
    }

    /** Name used as {@code data_type} and as the summary JSON key. */
    public String key() { return key; }
    public String label() { return label; }
    public String rulesResource() { return rulesResource; }
    public String inputGlob() { return inputGlob; }
    public String fallbackGlob() { return fallbackGlob; }
    /** File-name fragment that disqualifies a fallback match, or null. */
    public String fallbackExclude() { return fallbackExclude; }
    public String outputPrefix() { return outputPrefix; }

    public static DatasetVariant fromName(String name) {
        if (name == null) throw new ConfigurationException("Variant name is required");
        String n = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (n) {
            case "commercial", "comm" -> COMMERCIAL;
            case "non_commercial", "noncommercial", "noncomm" -> NON_COMMERCIAL;
            default -> throw new ConfigurationException("Unknown dataset variant: '" + name + "'");
        };
    }
}
