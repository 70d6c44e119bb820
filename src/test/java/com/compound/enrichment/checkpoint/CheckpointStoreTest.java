package com.compound.enrichment.checkpoint;

import com.compound.enrichment.config.FatalConfigurationException;
import com.compound.enrichment.core.model.ProcessedItem;
import com.compound.enrichment.core.model.ResolutionResult;
import com.compound.enrichment.core.model.WorkItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointStoreTest {

    @TempDir
    Path tempDir;

    private CheckpointStore store;
    private Path output;

    @BeforeEach
    void setUp() {
        store = new CheckpointStore(Clock.fixed(Instant.parse("2026-01-05T09:00:00Z"), ZoneOffset.UTC));
        output = tempDir.resolve("out").resolve("results.txt");
    }

    private static ProcessedItem processed(String key) {
        WorkItem item = WorkItem.builder().key(key).label("label " + key).build();
        return ProcessedItem.resolved(item, ResolutionResult.full("C[C@H]O", "pubchem-name"), List.of());
    }

    private String read() throws IOException {
        return Files.readString(output, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should return an empty completion set when the log does not exist")
    void testMissingLog() throws IOException {
        assertTrue(store.computeCompletionSet(output).isEmpty());
    }

    @Test
    @DisplayName("Should create the log with a header before the first section")
    void testInitialise() throws IOException {
        try (SectionWriter writer = store.openForAppend(output, 2)) {
            writer.append(processed("1"));
            assertEquals(1, writer.getSectionsWritten());
        }

        String content = read();
        assertTrue(content.startsWith("COMPOUND ENRICHMENT RESULTS\nTotal Items: 2\nGenerated: 2026-01-05 09:00:00\n"));
        assertTrue(content.endsWith("END ITEM #1\n"));
        assertEquals(Set.of("1"), store.computeCompletionSet(output));
    }

    @Test
    @DisplayName("Should append after existing sections without touching them")
    void testAppendKeepsPrefix() throws IOException {
        try (SectionWriter writer = store.openForAppend(output, 2)) {
            writer.append(processed("1"));
        }
        String before = read();

        try (SectionWriter writer = store.openForAppend(output, 2)) {
            writer.append(processed("2"));
        }

        String after = read();
        assertTrue(after.startsWith(before));
        assertEquals(1, after.split("COMPOUND ENRICHMENT RESULTS", -1).length - 1);
        assertEquals(Set.of("1", "2"), store.computeCompletionSet(output));
    }

    @Test
    @DisplayName("Should cut a truncated trailing section before appending")
    void testTruncatesDanglingSection() throws IOException {
        try (SectionWriter writer = store.openForAppend(output, 2)) {
            writer.append(processed("1"));
        }
        String valid = read();
        String partial = SectionFormat.renderSection(processed("2"));
        Files.writeString(output, valid + partial.substring(0, partial.length() - 20), StandardCharsets.UTF_8);
        assertEquals(Set.of("1"), store.computeCompletionSet(output));

        try (SectionWriter writer = store.openForAppend(output, 2)) {
            writer.append(processed("2"));
        }

        String content = read();
        assertEquals(valid + partial, content);
        assertEquals(1, content.split("ITEM #2:", -1).length - 1);
    }

    @Test
    @DisplayName("Should re-initialise a log whose header was cut short")
    void testPartialHeader() throws IOException {
        Files.createDirectories(output.getParent());
        Files.writeString(output, "COMPOUND ENRICHMENT RESULTS\nTotal", StandardCharsets.UTF_8);

        try (SectionWriter writer = store.openForAppend(output, 5)) {
            writer.append(processed("1"));
        }

        String content = read();
        assertTrue(content.startsWith("COMPOUND ENRICHMENT RESULTS\nTotal Items: 5\n"));
        assertEquals(Set.of("1"), store.computeCompletionSet(output));
    }

    @Test
    @DisplayName("Should re-initialise a log cut inside its title line")
    void testPartialTitle() throws IOException {
        Files.createDirectories(output.getParent());
        Files.writeString(output, "COMPOUND ENRI", StandardCharsets.UTF_8);

        assertTrue(store.computeCompletionSet(output).isEmpty());
        try (SectionWriter writer = store.openForAppend(output, 1)) {
            writer.append(processed("1"));
        }

        String content = read();
        assertTrue(content.startsWith(SectionFormat.HEADER_TITLE + "\nTotal Items: 1\n"));
        assertFalse(content.contains("COMPOUND ENRICOMPOUND"));
        assertEquals(Set.of("1"), store.computeCompletionSet(output));
    }

    @Test
    @DisplayName("Should leave failed items out of the completion set only when retrying them")
    void testRetryFailedCompletionSet() throws IOException {
        WorkItem broken = WorkItem.builder().key("2").label("label 2").build();
        try (SectionWriter writer = store.openForAppend(output, 2)) {
            writer.append(processed("1"));
            writer.append(ProcessedItem.failed(broken, "IOException: reset"));
        }

        assertEquals(Set.of("1", "2"), store.computeCompletionSet(output));
        assertEquals(Set.of("1", "2"), store.computeCompletionSet(output, false));
        assertEquals(Set.of("1"), store.computeCompletionSet(output, true));
    }

    @Test
    @DisplayName("Should refuse to append to a file that is not an output log")
    void testForeignFile() throws IOException {
        Files.createDirectories(output.getParent());
        Files.writeString(output, "precious data\n", StandardCharsets.UTF_8);

        assertThrows(FatalConfigurationException.class, () -> store.openForAppend(output, 1));
        assertEquals("precious data\n", read());
    }

    @Test
    @DisplayName("Should reject a directory as output location")
    void testDirectory() {
        assertThrows(FatalConfigurationException.class, () -> store.computeCompletionSet(tempDir));
    }
}
