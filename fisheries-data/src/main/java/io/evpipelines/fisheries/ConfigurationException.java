package io.evpipelines.fisheries;

/**
 * Caller or setup error: a bad switch value, an unknown variant name, or rules that cannot describe a dataset.
 * Raised immediately and never confused with data-quality warnings.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
