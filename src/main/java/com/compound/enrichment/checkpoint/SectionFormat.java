package com.compound.enrichment.checkpoint;

import com.compound.enrichment.core.model.AggregatedEntry;
import com.compound.enrichment.core.model.ProcessedItem;
import com.compound.enrichment.core.model.RawEntry;
import com.compound.enrichment.core.model.ResolutionResult;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Text layout of the output log.
 *
 * <pre>
 * COMPOUND ENRICHMENT RESULTS
 * Total Items: 2287
 * Generated: 2026-01-05 09:12:44
 *
 * ================================================================================
 * ITEM #12: Cinchona officinalis
 * ================================================================================
 * Status: RESOLVED
 * Tier: FULL
 * Resolved: COC1=CC2=C(C=CN=C2C=C1)[C@H]([C@@H]3C[C@@H]4CCN3C[C@@H]4C=C)O
 * Source: pubchem-name
 *
 * Compound 1: quinine
 *   SMILES: ...
 *   Title: ...
 *   DOI: 10.1000/xyz
 *   Published: 2001-05-01
 * END ITEM #12
 * </pre>
 *
 * <p>A section is complete only once its {@code END ITEM #key} line has been written.
 * Every line ends with {@code \n}; field values are flattened to a single line.
 * Runs without a lookup chain write {@code Status: COLLECTED} and no tier block.</p>
 */
public final class SectionFormat {

    public static final String HEADER_TITLE = "COMPOUND ENRICHMENT RESULTS";
    public static final String TOTAL_PREFIX = "Total Items: ";
    public static final String GENERATED_PREFIX = "Generated: ";
    public static final String SEPARATOR = "=".repeat(80);
    public static final String START_PREFIX = "ITEM #";
    public static final String END_PREFIX = "END ITEM #";
    public static final String STATUS_RESOLVED = "Status: RESOLVED";
    public static final String STATUS_FAILED = "Status: FAILED";
    public static final String STATUS_COLLECTED = "Status: COLLECTED";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private SectionFormat() {
    }

    public static String renderHeader(int totalItems, Instant generatedAt, ZoneId zone) {
        return HEADER_TITLE + '\n'
                + TOTAL_PREFIX + totalItems + '\n'
                + GENERATED_PREFIX + TIMESTAMP.format(generatedAt.atZone(zone)) + '\n';
    }

    public static String renderSection(ProcessedItem processed) {
        String key = processed.item().getKey();
        StringBuilder out = new StringBuilder(512);
        out.append('\n');
        out.append(SEPARATOR).append('\n');
        out.append(START_PREFIX).append(key).append(": ").append(oneLine(processed.item().getLabel())).append('\n');
        out.append(SEPARATOR).append('\n');

        if (processed.isFailed()) {
            out.append(STATUS_FAILED).append('\n');
            out.append("Error: ").append(oneLine(processed.failureMessage())).append('\n');
        } else if (!processed.resolution().wasRequested()) {
            out.append(STATUS_COLLECTED).append('\n');
            appendEntries(out, processed.entries());
        } else {
            ResolutionResult resolution = processed.resolution();
            out.append(STATUS_RESOLVED).append('\n');
            out.append("Tier: ").append(resolution.tier().name()).append('\n');
            if (resolution.isResolved()) {
                out.append("Resolved: ").append(oneLine(resolution.value())).append('\n');
                out.append("Source: ").append(resolution.sourceId()).append('\n');
            } else {
                out.append("Reason: ").append(resolution.unresolvedReason().name()).append('\n');
            }
            appendEntries(out, processed.entries());
        }

        out.append(END_PREFIX).append(key).append('\n');
        return out.toString();
    }

    private static void appendEntries(StringBuilder out, List<AggregatedEntry> entries) {
        out.append('\n');
        if (entries.isEmpty()) {
            out.append("No compounds found.").append('\n');
            return;
        }
        int index = 1;
        for (AggregatedEntry aggregated : entries) {
            RawEntry entry = aggregated.entry();
            out.append("Compound ").append(index++).append(": ").append(oneLine(entry.entityLabel())).append('\n');
            field(out, "SMILES", entry.structure());
            field(out, "InChIKey", entry.structureKey());
            if (entry.hasProvenance()) {
                field(out, "Title", entry.provenanceTitle());
                field(out, "DOI", entry.provenanceId());
                field(out, "Published", entry.publishedOn());
            }
        }
    }

    private static void field(StringBuilder out, String name, String value) {
        if (value != null && !value.isEmpty()) {
            out.append("  ").append(name).append(": ").append(oneLine(value)).append('\n');
        }
    }

    static String oneLine(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
    }
}
