package com.compound.enrichment.bulk;

import java.nio.file.Path;

/**
 * Result of a tabular export.
 *
 * @param rows    number of data rows written
 * @param columns number of columns in the header
 * @param target  where the table was written, null when exported to a stream
 */
public record ExportResult(long rows, int columns, Path target) {

    @Override
    public String toString() {
        return "ExportResult{rows=" + rows + ", columns=" + columns +
                (target != null ? ", target=" + target : "") + '}';
    }
}
