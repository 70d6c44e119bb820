package com.compound.enrichment.core.model;

/**
 * Terminal state of a work item within one run.
 */
public enum ItemOutcome {
    /**
     * Already completed by a previous run; not reprocessed.
     */
    SKIPPED,

    /**
     * Processed; the resolution tier tells how well.
     */
    RESOLVED,

    /**
     * An unexpected fault while processing this item was contained. The item is
     * recorded as failed; later runs skip it unless told to retry failed items.
     */
    FAILED_ISOLATED
}
