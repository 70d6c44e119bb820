package com.compound.enrichment.aggregate;

import com.compound.enrichment.core.model.AggregatedEntry;
import com.compound.enrichment.core.model.RawEntry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collapses raw entries describing the same logical entry.
 *
 * <p>Two raw entries are the same when they share entity label, provenance title and
 * provenance identifier. The first occurrence wins and keeps its position; later ones
 * are dropped. The input is not modified.</p>
 */
public class EntryAggregator {

    public List<AggregatedEntry> aggregate(List<RawEntry> rawEntries) {
        Objects.requireNonNull(rawEntries, "rawEntries is required");
        Map<AggregatedEntry.Key, AggregatedEntry> seen = new LinkedHashMap<>();
        for (RawEntry entry : rawEntries) {
            AggregatedEntry aggregated = AggregatedEntry.of(entry);
            seen.putIfAbsent(aggregated.key(), aggregated);
        }
        return List.copyOf(new ArrayList<>(seen.values()));
    }

    /**
     * Number of distinct entity labels among the given entries.
     */
    public static long countDistinctEntities(List<AggregatedEntry> entries) {
        return entries.stream().map(AggregatedEntry::entityLabel).distinct().count();
    }
}
