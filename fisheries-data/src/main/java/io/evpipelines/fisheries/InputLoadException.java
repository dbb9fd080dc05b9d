package io.evpipelines.fisheries;

/**
 * The input file could not be found, read or parsed.
 */
public class InputLoadException extends VariantFailureException {
    public InputLoadException(DatasetVariant variant, String message) {
        super(variant, message);
    }

    public InputLoadException(DatasetVariant variant, String message, Throwable cause) {
        super(variant, message, cause);
    }
}
