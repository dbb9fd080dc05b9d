package io.evpipelines.fisheries;

/**
 * Cleaned output could not be written. No partial file is left behind.
 */
public class OutputWriteException extends VariantFailureException {
    public OutputWriteException(DatasetVariant variant, String message, Throwable cause) {
        super(variant, message, cause);
    }
}
