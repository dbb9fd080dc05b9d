package io.evpipelines.fisheries.transform;

import io.evpipelines.fisheries.ConfigurationException;

import java.util.Locale;

/**
 * What happens to rows the validator flagged with a warning.
 */
public enum ViolationPolicy {
    /** Keep flagged rows; the report is advisory. */
    WARN,
    /** Drop flagged rows before aggregate filtering. */
    REJECT;

    public static ViolationPolicy fromName(String name) {
        if (name == null) throw new ConfigurationException("Violation policy is required");
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "warn" -> WARN;
            case "reject", "strict" -> REJECT;
            default -> throw new ConfigurationException("Unknown violation policy: '" + name + "' (expected warn|reject)");
        };
    }
}
