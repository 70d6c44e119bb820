package com.compound.enrichment.core.model;

/**
 * Quality of a resolved identifier, ordered from worst to best.
 * The declaration order is the total order used by {@link #isAtLeast(QualityTier)}.
 */
public enum QualityTier {
    /**
     * No value could be resolved.
     */
    UNRESOLVED,

    /**
     * A valid but partial value, e.g. a SMILES string without stereochemistry.
     */
    DEGRADED,

    /**
     * A structurally complete value. Terminal for the fallback chain.
     */
    FULL;

    public boolean isAtLeast(QualityTier other) {
        return compareTo(other) >= 0;
    }

    /**
     * Returns the lower of the two tiers.
     */
    public static QualityTier min(QualityTier a, QualityTier b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
