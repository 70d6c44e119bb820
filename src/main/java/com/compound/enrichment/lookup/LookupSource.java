package com.compound.enrichment.lookup;

import com.compound.enrichment.core.model.QualityTier;

import java.util.Optional;

/**
 * An external source able to turn a query key into a raw value.
 * Implementations reach a remote service; the fallback resolver only depends on this shape.
 */
public interface LookupSource {

    /**
     * Looks up a value.
     *
     * @param key the query key, never blank
     * @return the raw value, or empty if the source has no value for this key
     * @throws SourceUnavailableException if the source could not answer (network error,
     *                                    timeout, unexpected status, malformed body)
     */
    Optional<String> lookup(String key);

    /**
     * Identifier recorded as provenance of the values this source produces.
     */
    String getSourceId();

    /**
     * Key under which calls to this source are rate limited. Sources that share
     * an endpoint should share a key.
     */
    default String getRateLimitKey() {
        return getSourceId();
    }

    /**
     * Best tier a value from this source can be classified as.
     */
    default QualityTier maxTier() {
        return QualityTier.FULL;
    }
}
