package com.compound.enrichment.config;

/**
 * A problem that prevents a run from starting: missing or unreadable work set, an output
 * location that cannot be written, invalid settings. Raised before any item is processed.
 */
public class FatalConfigurationException extends RuntimeException {

    public FatalConfigurationException(String message) {
        super(message);
    }

    public FatalConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
