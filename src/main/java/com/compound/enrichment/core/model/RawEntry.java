package com.compound.enrichment.core.model;

/**
 * A raw result row reported by an entry source for a work item, e.g. one
 * compound/reference pair from the LOTUS dataset. Several rows may describe the
 * same logical entry; see {@link AggregatedEntry}.
 *
 * @param entityLabel     human-readable label of the entity (compound name)
 * @param structure       structural identifier (SMILES), empty if unknown
 * @param structureKey    hashed structure key (InChIKey), empty if unknown
 * @param referenceId     identifier of the provenance record (e.g. a Wikidata QID)
 * @param provenanceTitle title of the provenance record
 * @param provenanceId    external identifier of the provenance record (DOI)
 * @param publishedOn     publication date of the provenance record, as reported
 */
public record RawEntry(
        String entityLabel,
        String structure,
        String structureKey,
        String referenceId,
        String provenanceTitle,
        String provenanceId,
        String publishedOn
) {
    public static final String UNKNOWN_LABEL = "Unknown";

    public RawEntry {
        entityLabel = entityLabel == null || entityLabel.isBlank() ? UNKNOWN_LABEL : entityLabel;
        structure = nullToEmpty(structure);
        structureKey = nullToEmpty(structureKey);
        referenceId = nullToEmpty(referenceId);
        provenanceTitle = nullToEmpty(provenanceTitle);
        provenanceId = nullToEmpty(provenanceId);
        publishedOn = nullToEmpty(publishedOn);
    }

    public boolean hasProvenance() {
        return !provenanceTitle.isEmpty() || !provenanceId.isEmpty();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
