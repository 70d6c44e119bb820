package com.compound.enrichment.core.model;

import java.util.Objects;

/**
 * A deduplicated entry: the first raw entry seen for its composite key.
 */
public record AggregatedEntry(Key key, RawEntry entry) {

    public AggregatedEntry {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(entry, "entry is required");
    }

    public static AggregatedEntry of(RawEntry entry) {
        return new AggregatedEntry(Key.of(entry), entry);
    }

    public String entityLabel() {
        return entry.entityLabel();
    }

    /**
     * Composite identity of an entry: entity label, provenance title and provenance identifier.
     */
    public record Key(String entityLabel, String provenanceTitle, String provenanceId) {

        public static Key of(RawEntry entry) {
            return new Key(entry.entityLabel(), entry.provenanceTitle(), entry.provenanceId());
        }
    }
}
