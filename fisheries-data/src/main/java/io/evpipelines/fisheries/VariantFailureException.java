package io.evpipelines.fisheries;

/**
 * A fatal failure that stops one variant's pipeline. The other variant is unaffected.
 */
public class VariantFailureException extends Exception {
    private final DatasetVariant variant;

    public VariantFailureException(DatasetVariant variant, String message) {
        super(message);
        this.variant = variant;
    }

    public VariantFailureException(DatasetVariant variant, String message, Throwable cause) {
        super(message, cause);
        this.variant = variant;
    }

    public DatasetVariant variant() { return variant; }
}
