package com.compound.enrichment.lookup;

import com.compound.enrichment.core.model.QualityTier;

/**
 * Classifies a raw value returned by a lookup source into a quality tier.
 */
@FunctionalInterface
public interface QualityPredicate {

    QualityTier classify(String value);

    /**
     * Treats every non-blank value as {@link QualityTier#FULL}.
     */
    QualityPredicate ANY_VALUE_IS_FULL = value ->
            value == null || value.isBlank() ? QualityTier.UNRESOLVED : QualityTier.FULL;
}
