package com.compound.enrichment.checkpoint;

import com.compound.enrichment.core.model.AggregatedEntry;
import com.compound.enrichment.core.model.ProcessedItem;
import com.compound.enrichment.core.model.RawEntry;
import com.compound.enrichment.core.model.ResolutionResult;
import com.compound.enrichment.core.model.UnresolvedReason;
import com.compound.enrichment.core.model.WorkItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SectionFormatTest {

    private static final String SEPARATOR = "=".repeat(80);

    @Test
    @DisplayName("Should render the header with total and timestamp")
    void testHeader() {
        String header = SectionFormat.renderHeader(3, Instant.parse("2026-01-05T09:12:44Z"), ZoneOffset.UTC);

        assertEquals("""
                COMPOUND ENRICHMENT RESULTS
                Total Items: 3
                Generated: 2026-01-05 09:12:44
                """, header);
    }

    @Test
    @DisplayName("Should render a resolved section with its entries and closing marker")
    void testResolvedSection() {
        WorkItem item = WorkItem.builder().key("12").label("Cinchona officinalis").build();
        RawEntry entry = new RawEntry("quinine", "C[C@H]O", "LOXJ", "Q1", "Alkaloids", "10.1/x", "2001-05-01");
        ProcessedItem processed = ProcessedItem.resolved(item,
                ResolutionResult.full("C[C@H]O", "pubchem-name"), List.of(AggregatedEntry.of(entry)));

        String section = SectionFormat.renderSection(processed);

        assertEquals("\n" + SEPARATOR + "\n"
                + "ITEM #12: Cinchona officinalis\n"
                + SEPARATOR + "\n"
                + "Status: RESOLVED\n"
                + "Tier: FULL\n"
                + "Resolved: C[C@H]O\n"
                + "Source: pubchem-name\n"
                + "\n"
                + "Compound 1: quinine\n"
                + "  SMILES: C[C@H]O\n"
                + "  InChIKey: LOXJ\n"
                + "  Title: Alkaloids\n"
                + "  DOI: 10.1/x\n"
                + "  Published: 2001-05-01\n"
                + "END ITEM #12\n", section);
    }

    @Test
    @DisplayName("Should render an unresolved section with its reason")
    void testUnresolvedSection() {
        WorkItem item = WorkItem.builder().key("7").label("nothing").build();

        String section = SectionFormat.renderSection(ProcessedItem.resolved(item,
                ResolutionResult.unresolved(UnresolvedReason.SOURCE_UNAVAILABLE), List.of()));

        assertTrue(section.contains("Tier: UNRESOLVED\nReason: SOURCE_UNAVAILABLE\n"));
        assertTrue(section.contains("No compounds found.\n"));
        assertTrue(section.endsWith("END ITEM #7\n"));
    }

    @Test
    @DisplayName("Should render a collected section without a tier block")
    void testCollectedSection() {
        WorkItem item = WorkItem.builder().key("4").label("Artemisia annua").build();
        RawEntry entry = new RawEntry("artemisinin", "CC1CCC2", "BLUA", "Q2", "", "", "");

        String section = SectionFormat.renderSection(ProcessedItem.resolved(item,
                ResolutionResult.notRequested(), List.of(AggregatedEntry.of(entry))));

        assertEquals("\n" + SEPARATOR + "\n"
                + "ITEM #4: Artemisia annua\n"
                + SEPARATOR + "\n"
                + "Status: COLLECTED\n"
                + "\n"
                + "Compound 1: artemisinin\n"
                + "  SMILES: CC1CCC2\n"
                + "  InChIKey: BLUA\n"
                + "END ITEM #4\n", section);
        assertEquals(Set.of("4"), CheckpointScanner.scan(
                SectionFormat.renderHeader(1, Instant.EPOCH, ZoneOffset.UTC) + section).completedKeys());
    }

    @Test
    @DisplayName("Should render a failed section and flatten multi-line text")
    void testFailedSection() {
        WorkItem item = WorkItem.builder().key("9").label("line one\nline two").build();

        String section = SectionFormat.renderSection(ProcessedItem.failed(item, "boom\r\nagain"));

        assertTrue(section.contains("ITEM #9: line one line two\n"));
        assertTrue(section.contains("Status: FAILED\nError: boom again\n"));
        assertFalse(section.contains("Compound"));
    }
}
