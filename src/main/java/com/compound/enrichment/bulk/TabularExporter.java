package com.compound.enrichment.bulk;

import com.compound.enrichment.core.model.ProcessedItem;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the items processed in a run as a flat table. Works from the in-memory results;
 * the output log is never re-read.
 */
public interface TabularExporter {

    /**
     * Exports to a writer. The writer is flushed, not closed.
     */
    ExportResult export(List<ProcessedItem> items, Writer writer) throws IOException;

    /**
     * Exports to a file, replacing it.
     */
    ExportResult export(List<ProcessedItem> items, Path target) throws IOException;

    /**
     * Returns the format written by this exporter (e.g., "csv").
     */
    String getFormat();
}
