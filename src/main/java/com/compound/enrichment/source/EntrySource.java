package com.compound.enrichment.source;

import com.compound.enrichment.core.model.RawEntry;
import com.compound.enrichment.core.model.WorkItem;

import java.util.List;

/**
 * Supplies the raw entries listed in a work item's output section, e.g. the compounds
 * reported for a plant.
 */
public interface EntrySource {

    /**
     * Fetches the raw entries of an item, possibly with duplicates.
     *
     * @throws com.compound.enrichment.lookup.SourceUnavailableException if the source
     *         could not answer; the orchestrator records the item as failed
     */
    List<RawEntry> fetch(WorkItem item);

    String getSourceName();
}
