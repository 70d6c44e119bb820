package com.compound.enrichment.lookup;

import java.util.Objects;

/**
 * Outcome of a single call to a {@link LookupSource}: a value, a definitive miss, or
 * a failure to answer.
 */
public record LookupAttempt(String sourceId, Status status, String value, String detail) {

    public enum Status {
        FOUND,
        NOT_FOUND,
        UNAVAILABLE
    }

    public LookupAttempt {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(status, "status is required");
        if (status == Status.FOUND && (value == null || value.isBlank())) {
            throw new IllegalArgumentException("A found attempt requires a value");
        }
        if (status != Status.FOUND) {
            value = null;
        }
    }

    public static LookupAttempt found(String sourceId, String value) {
        return new LookupAttempt(sourceId, Status.FOUND, value, null);
    }

    public static LookupAttempt notFound(String sourceId) {
        return new LookupAttempt(sourceId, Status.NOT_FOUND, null, null);
    }

    public static LookupAttempt unavailable(String sourceId, String detail) {
        return new LookupAttempt(sourceId, Status.UNAVAILABLE, null, detail);
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    /**
     * True for outcomes that would be the same if the call were repeated: found or not found.
     */
    public boolean isDefinitive() {
        return status != Status.UNAVAILABLE;
    }
}
