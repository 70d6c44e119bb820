package com.compound.enrichment.core.model;

/**
 * Why an item ended up {@link QualityTier#UNRESOLVED}.
 */
public enum UnresolvedReason {
    /**
     * The item carried no hint usable by any source; nothing was queried.
     */
    NO_HINTS,

    /**
     * Every consulted source answered, none had a value.
     */
    NOT_FOUND,

    /**
     * At least one source could not be reached or returned a malformed response.
     */
    SOURCE_UNAVAILABLE,

    /**
     * No lookup chain is configured; only entries were collected for the item.
     */
    NOT_REQUESTED
}
