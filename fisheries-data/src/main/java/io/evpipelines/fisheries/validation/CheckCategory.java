package io.evpipelines.fisheries.validation;

/**
 * Validation checks in the order they run.
 */
public enum CheckCategory {
    SCHEMA_PRESENCE("schema_presence", Severity.FATAL),
    TYPE("type", Severity.WARNING),
    RANGE("range", Severity.WARNING),
    CATEGORICAL("categorical", Severity.WARNING);

    private final String key;
    private final Severity severity;

    CheckCategory(String key, Severity severity) {
        this.key = key;
        this.severity = severity;
    }

    public String key() { return key; }
    public Severity severity() { return severity; }
}
