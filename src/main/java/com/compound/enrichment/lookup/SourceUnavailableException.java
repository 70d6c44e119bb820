package com.compound.enrichment.lookup;

/**
 * Thrown when an external source could not answer a query.
 * Distinct from "not found", which sources report as an empty result.
 */
public class SourceUnavailableException extends RuntimeException {

    private final Integer statusCode;
    private final boolean retryable;

    public SourceUnavailableException(String message) {
        this(message, null, true, null);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        this(message, null, true, cause);
    }

    public SourceUnavailableException(String message, Integer statusCode, boolean retryable) {
        this(message, statusCode, retryable, null);
    }

    public SourceUnavailableException(String message, Integer statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    /**
     * HTTP status returned by the source, or null if no response was received.
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Builds the exception for an unexpected HTTP status.
     */
    public static SourceUnavailableException forStatus(String sourceId, int statusCode, String body) {
        boolean retryable = statusCode >= 500 || statusCode == 429;
        String snippet = body != null && body.length() > 200 ? body.substring(0, 200) + "..." : body;
        return new SourceUnavailableException(
                sourceId + " returned status " + statusCode + ": " + snippet, statusCode, retryable);
    }
}
