package com.compound.enrichment.source;

/**
 * Bibliographic metadata of a reference item.
 *
 * @param doi         DOI, empty if unknown
 * @param title       title, empty if unknown
 * @param publishedOn publication date as {@code yyyy-MM-dd}, empty if unknown
 */
public record ReferenceMetadata(String doi, String title, String publishedOn) {

    private static final ReferenceMetadata EMPTY = new ReferenceMetadata("", "", "");

    public ReferenceMetadata {
        doi = doi != null ? doi : "";
        title = title != null ? title : "";
        publishedOn = publishedOn != null ? publishedOn : "";
    }

    public static ReferenceMetadata empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return doi.isEmpty() && title.isEmpty() && publishedOn.isEmpty();
    }

    /**
     * Turns a Wikidata time value ({@code +2001-05-01T00:00:00Z}) into {@code 2001-05-01}.
     */
    public static String cleanWikidataDate(String time) {
        if (time == null || time.isBlank()) {
            return "";
        }
        String cleaned = time.replace("+", "");
        int t = cleaned.indexOf('T');
        return t >= 0 ? cleaned.substring(0, t) : cleaned;
    }
}
