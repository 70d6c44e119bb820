package com.compound.enrichment.source;

import com.compound.enrichment.core.model.RawEntry;
import com.compound.enrichment.core.model.WorkItem;

import java.util.List;

/**
 * Entry source that reports nothing. Used when entry collection is disabled.
 */
public class NoOpEntrySource implements EntrySource {

    @Override
    public List<RawEntry> fetch(WorkItem item) {
        return List.of();
    }

    @Override
    public String getSourceName() {
        return "NoOp";
    }
}
