package com.compound.enrichment.bulk;

import com.compound.enrichment.core.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * CSV work set reader.
 *
 * <p>Expected CSV format, positional and without a header by default:</p>
 * <pre>
 * 1,Cinchona officinalis
 * 2,"Artemisia annua or Sweet wormwood"
 * 3,quinine,LOXJEDZZCXVOQV-UHFFFAOYSA-N
 * </pre>
 *
 * <p>Column 1 is the item key, column 2 the label, column 3 an optional secondary key.
 * Further columns are kept as attributes named {@code column4}, {@code column5}, ...
 * unless a header row supplies names. Rows with fewer than two fields, an invalid key
 * or a key already seen are skipped and reported. A quoted field may span several lines;
 * errors report the line the record starts on.</p>
 */
public class CsvWorkSetReader implements WorkSetReader {
    private static final Logger log = LoggerFactory.getLogger(CsvWorkSetReader.class);

    private final boolean hasHeader;
    private final int maxItems;
    private final String synonymSeparator;

    public CsvWorkSetReader() {
        this(false, 0, WorkItem.DEFAULT_SYNONYM_SEPARATOR);
    }

    /**
     * @param hasHeader        whether the first row holds column names
     * @param maxItems         stop after this many items; 0 or less means no limit
     * @param synonymSeparator separator between alternative names in the label
     */
    public CsvWorkSetReader(boolean hasHeader, int maxItems, String synonymSeparator) {
        this.hasHeader = hasHeader;
        this.maxItems = maxItems;
        this.synonymSeparator = synonymSeparator;
    }

    @Override
    public LoadResult read(Reader reader) throws IOException {
        List<WorkItem> items = new ArrayList<>();
        List<LoadResult.LoadError> errors = new ArrayList<>();
        Set<String> seenKeys = new HashSet<>();
        List<String> columnNames = List.of();

        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        String line;
        long physicalLine = 0;
        while ((line = br.readLine()) != null) {
            physicalLine++;
            long lineNumber = physicalLine;
            if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == '\uFEFF') {
                line = line.substring(1);
            }
            if (line.isBlank()) {
                continue;
            }
            String continuation;
            while (endsInsideQuotes(line) && (continuation = br.readLine()) != null) {
                physicalLine++;
                line = line + '\n' + continuation;
            }
            List<String> fields = parseCsvLine(line);
            if (hasHeader && lineNumber == 1) {
                columnNames = fields;
                continue;
            }
            if (maxItems > 0 && items.size() >= maxItems) {
                log.info("workset.max_items_reached maxItems={} line={}", maxItems, lineNumber);
                break;
            }
            if (fields.size() < 2) {
                errors.add(new LoadResult.LoadError(lineNumber, abbreviate(line), "expected at least 2 fields"));
                continue;
            }

            String key = fields.get(0).trim();
            if (!WorkItem.isValidKey(key)) {
                errors.add(new LoadResult.LoadError(lineNumber, abbreviate(line), "invalid key '" + key + "'"));
                continue;
            }
            if (!seenKeys.add(key)) {
                errors.add(new LoadResult.LoadError(lineNumber, abbreviate(line), "duplicate key '" + key + "'"));
                continue;
            }

            WorkItem.Builder builder = WorkItem.builder()
                    .key(key)
                    .label(fields.get(1))
                    .synonymSeparator(synonymSeparator);
            if (fields.size() > 2) {
                builder.secondaryKey(fields.get(2));
            }
            for (int i = 3; i < fields.size(); i++) {
                String name = i < columnNames.size() && !columnNames.get(i).isBlank()
                        ? columnNames.get(i).trim()
                        : "column" + (i + 1);
                builder.attribute(name, fields.get(i).trim());
            }
            items.add(builder.build());
        }

        for (LoadResult.LoadError error : errors) {
            log.warn("workset.skipped line={} input='{}' reason={}", error.position(), error.input(), error.message());
        }
        LoadResult result = new LoadResult(items, errors);
        log.info("workset.loaded format=csv result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    /**
     * Splits a CSV line, handling quoted values and doubled quotes inside them.
     */
    static List<String> parseCsvLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }

    /**
     * True when a quoted field is still open at the end of the text, i.e. the record
     * continues on the next line.
     */
    static boolean endsInsideQuotes(String text) {
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '"') {
                if (quoted && i + 1 < text.length() && text.charAt(i + 1) == '"') {
                    i++;
                } else {
                    quoted = !quoted;
                }
            }
        }
        return quoted;
    }

    private static String abbreviate(String value) {
        return value.length() > 80 ? value.substring(0, 77) + "..." : value;
    }
}
