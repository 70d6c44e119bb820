package com.compound.enrichment.bulk;

import com.compound.enrichment.config.FatalConfigurationException;
import com.compound.enrichment.core.model.WorkItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvWorkSetReaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should read positional rows without a header")
    void testPositionalRows() throws IOException {
        String csv = """
                1,Cinchona officinalis
                2,"Artemisia annua or Sweet wormwood"
                3,quinine,LOXJEDZZCXVOQV-UHFFFAOYSA-N
                """;

        LoadResult result = new CsvWorkSetReader().read(new StringReader(csv));

        assertEquals(3, result.size());
        assertFalse(result.hasErrors());
        WorkItem second = result.items().get(1);
        assertEquals("2", second.getKey());
        assertEquals(List.of("Artemisia annua", "Sweet wormwood"), second.getQueryNames());
        assertEquals("LOXJEDZZCXVOQV-UHFFFAOYSA-N", result.items().get(2).getSecondaryKey());
    }

    @Test
    @DisplayName("Should handle quoted CSV values")
    void testQuotedValues() throws IOException {
        String csv = "1,\"Acme, plant\"\n2,\"Big \"\"Blue\"\" herb\"\n";

        LoadResult result = new CsvWorkSetReader().read(new StringReader(csv));

        assertEquals("Acme, plant", result.items().get(0).getLabel());
        assertEquals("Big \"Blue\" herb", result.items().get(1).getLabel());
    }

    @Test
    @DisplayName("Should name extra columns from the header row")
    void testHeaderAttributes() throws IOException {
        String csv = """
                id,name,inchikey,plant_name,molecular_weight
                c1,quinine,LOXJ,Cinchona,324.4
                """;

        LoadResult result = new CsvWorkSetReader(true, 0, WorkItem.DEFAULT_SYNONYM_SEPARATOR)
                .read(new StringReader(csv));

        assertEquals(1, result.size());
        WorkItem item = result.items().get(0);
        assertEquals("c1", item.getKey());
        assertEquals("Cinchona", item.getAttributes().get("plant_name"));
        assertEquals("324.4", item.getAttributes().get("molecular_weight"));
    }

    @Test
    @DisplayName("Should report short rows, invalid keys and duplicates as load errors")
    void testLoadErrors() throws IOException {
        String csv = """
                1,Cinchona
                lonely
                bad key,Artemisia
                1,Duplicate
                2,Salvia
                """;

        LoadResult result = new CsvWorkSetReader().read(new StringReader(csv));

        assertEquals(2, result.size());
        assertEquals(3, result.errors().size());
        assertEquals(2, result.errors().get(0).position());
        assertTrue(result.errors().get(1).message().contains("invalid key"));
        assertTrue(result.errors().get(2).message().contains("duplicate key"));
    }

    @Test
    @DisplayName("Should skip empty lines and stop at max items")
    void testMaxItems() throws IOException {
        String csv = "1,a\n\n2,b\n3,c\n";

        LoadResult result = new CsvWorkSetReader(false, 2, WorkItem.DEFAULT_SYNONYM_SEPARATOR)
                .read(new StringReader(csv));

        assertEquals(List.of("1", "2"), result.items().stream().map(WorkItem::getKey).toList());
    }

    @Test
    @DisplayName("Should read a quoted field that spans lines and report later errors at their starting line")
    void testMultiLineField() throws IOException {
        String csv = "1,\"Artemisia annua\nSweet wormwood\",\"collected in\n\"\"Hunan\"\"\"\n"
                + "2\n"
                + "3,quinine\n";

        LoadResult result = new CsvWorkSetReader().read(new StringReader(csv));

        assertEquals(List.of("1", "3"), result.items().stream().map(WorkItem::getKey).toList());
        assertEquals("Artemisia annua\nSweet wormwood", result.items().get(0).getLabel());
        assertEquals("collected in\n\"Hunan\"", result.items().get(0).getSecondaryKey());
        assertEquals(1, result.errors().size());
        assertEquals(4, result.errors().get(0).position());
    }

    @Test
    @DisplayName("Should detect a quoted field left open at the end of a line")
    void testEndsInsideQuotes() {
        assertTrue(CsvWorkSetReader.endsInsideQuotes("1,\"Artemisia"));
        assertFalse(CsvWorkSetReader.endsInsideQuotes("1,\"Big \"\"Blue\"\" herb\""));
        assertTrue(CsvWorkSetReader.endsInsideQuotes("1,\"say \"\""));
        assertFalse(CsvWorkSetReader.endsInsideQuotes("1,plain"));
    }

    @Test
    @DisplayName("Should strip a UTF-8 byte order mark")
    void testBom() throws IOException {
        LoadResult result = new CsvWorkSetReader().read(new StringReader("\uFEFF1,a\n"));

        assertEquals("1", result.items().get(0).getKey());
    }

    @Test
    @DisplayName("Should read from a file and fail fatally when it is missing")
    void testFile() throws IOException {
        Path file = tempDir.resolve("plants.csv");
        Files.writeString(file, "1,Cinchona\n");

        assertEquals(1, new CsvWorkSetReader().read(file).size());
        assertThrows(FatalConfigurationException.class,
                () -> new CsvWorkSetReader().read(tempDir.resolve("missing.csv")));
    }

    @Test
    @DisplayName("Should split lines on commas outside quotes")
    void testParseCsvLine() {
        assertEquals(List.of("a", "b,c", ""), CsvWorkSetReader.parseCsvLine("a,\"b,c\","));
    }
}
