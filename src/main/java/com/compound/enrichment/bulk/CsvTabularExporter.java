package com.compound.enrichment.bulk;

import com.compound.enrichment.core.model.ProcessedItem;
import com.compound.enrichment.core.model.ResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * CSV tabular exporter.
 *
 * <p>Output format:</p>
 * <pre>
 * key,label,secondary_key,plant_name,molecular_weight,resolved_value,tier,source,status,entries
 * c1,quinine,LOXJEDZZCXVOQV-UHFFFAOYSA-N,Cinchona officinalis,324.4,"CO[C@H]...",FULL,pubchem-inchikey,RESOLVED,0
 * </pre>
 *
 * <p>Attribute columns appear in first-seen order across all items; an item without a
 * given attribute gets an empty cell. An attribute whose name is taken by a fixed column
 * (or by an earlier attribute column) is written under an {@code attr_} prefix.</p>
 */
public class CsvTabularExporter implements TabularExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvTabularExporter.class);

    private static final List<String> LEADING_COLUMNS = List.of("key", "label", "secondary_key");
    private static final List<String> TRAILING_COLUMNS = List.of("resolved_value", "tier", "source", "status", "entries");
    private static final String ATTRIBUTE_PREFIX = "attr_";

    @Override
    public ExportResult export(List<ProcessedItem> items, Writer writer) throws IOException {
        Set<String> attributeNames = new LinkedHashSet<>();
        for (ProcessedItem processed : items) {
            attributeNames.addAll(processed.item().getAttributes().keySet());
        }

        List<String> header = new ArrayList<>(LEADING_COLUMNS);
        header.addAll(attributeColumns(attributeNames));
        header.addAll(TRAILING_COLUMNS);
        writeRow(writer, header);

        long rows = 0;
        for (ProcessedItem processed : items) {
            List<String> row = new ArrayList<>(header.size());
            row.add(processed.item().getKey());
            row.add(processed.item().getLabel());
            row.add(processed.item().getSecondaryKey());
            for (String name : attributeNames) {
                row.add(processed.item().getAttributes().getOrDefault(name, ""));
            }
            ResolutionResult resolution = processed.resolution();
            row.add(resolution != null && resolution.isResolved() ? resolution.value() : "");
            boolean requested = resolution == null || resolution.wasRequested();
            row.add(requested ? processed.tier().name() : "");
            row.add(resolution != null && resolution.sourceId() != null ? resolution.sourceId() : "");
            row.add(processed.isFailed() ? "FAILED" : requested ? "RESOLVED" : "COLLECTED");
            row.add(String.valueOf(processed.entries().size()));
            writeRow(writer, row);
            rows++;
        }
        writer.flush();

        ExportResult result = new ExportResult(rows, header.size(), null);
        log.debug("export.written result={}", result);
        return result;
    }

    @Override
    public ExportResult export(List<ProcessedItem> items, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        ExportResult written;
        try (Writer writer = new BufferedWriter(Files.newBufferedWriter(target, StandardCharsets.UTF_8))) {
            written = export(items, writer);
        }
        ExportResult result = new ExportResult(written.rows(), written.columns(), target);
        log.info("export.completed result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    static List<String> attributeColumns(Set<String> attributeNames) {
        Set<String> taken = new HashSet<>(LEADING_COLUMNS);
        taken.addAll(TRAILING_COLUMNS);
        List<String> columns = new ArrayList<>(attributeNames.size());
        for (String name : attributeNames) {
            String column = name;
            while (!taken.add(column)) {
                column = ATTRIBUTE_PREFIX + column;
            }
            columns.add(column);
        }
        return columns;
    }

    private static void writeRow(Writer writer, List<String> values) throws IOException {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write(csvEscape(values.get(i)));
        }
        writer.write('\n');
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
