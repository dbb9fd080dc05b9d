package io.evpipelines.fisheries.validation;

public enum Severity {
    /** Halts the variant before any transform or export. */
    FATAL,
    /** Reported and logged; the pipeline carries on. */
    WARNING
}
