package com.compound.enrichment.core.model;

import java.util.Objects;

/**
 * Outcome of resolving one work item through the fallback chain.
 *
 * <p>The value is non-empty if and only if the tier is not {@link QualityTier#UNRESOLVED}.
 * Unresolved results carry a {@link UnresolvedReason}; resolved ones carry the id of the
 * source that produced the value.</p>
 */
public record ResolutionResult(
        String value,
        QualityTier tier,
        String sourceId,
        UnresolvedReason unresolvedReason
) {
    public ResolutionResult {
        Objects.requireNonNull(tier, "tier is required");
        value = value != null ? value : "";
        if (tier == QualityTier.UNRESOLVED) {
            if (!value.isEmpty()) {
                throw new IllegalArgumentException("Unresolved result must not carry a value");
            }
            Objects.requireNonNull(unresolvedReason, "unresolvedReason is required when unresolved");
        } else {
            if (value.isBlank()) {
                throw new IllegalArgumentException("Resolved result requires a non-empty value");
            }
            Objects.requireNonNull(sourceId, "sourceId is required when resolved");
            unresolvedReason = null;
        }
    }

    public static ResolutionResult full(String value, String sourceId) {
        return new ResolutionResult(value, QualityTier.FULL, sourceId, null);
    }

    public static ResolutionResult degraded(String value, String sourceId) {
        return new ResolutionResult(value, QualityTier.DEGRADED, sourceId, null);
    }

    public static ResolutionResult unresolved(UnresolvedReason reason) {
        return new ResolutionResult("", QualityTier.UNRESOLVED, null, reason);
    }

    public static ResolutionResult of(String value, QualityTier tier, String sourceId) {
        return new ResolutionResult(value, tier, sourceId, null);
    }

    /**
     * Result for runs that collect entries without resolving anything.
     */
    public static ResolutionResult notRequested() {
        return unresolved(UnresolvedReason.NOT_REQUESTED);
    }

    public boolean wasRequested() {
        return unresolvedReason != UnresolvedReason.NOT_REQUESTED;
    }

    public boolean isResolved() {
        return tier != QualityTier.UNRESOLVED;
    }
}
