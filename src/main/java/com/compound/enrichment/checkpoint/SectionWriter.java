package com.compound.enrichment.checkpoint;

import com.compound.enrichment.core.model.ProcessedItem;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;

/**
 * Appends finished sections to the output log. Each section is written and flushed as
 * a whole before {@link #append} returns, so a kill leaves at most one unclosed section
 * at the tail.
 */
public class SectionWriter implements AutoCloseable {

    private final Path output;
    private final Writer writer;
    private int sectionsWritten;

    SectionWriter(Path output, Writer writer) {
        this.output = output;
        this.writer = writer;
    }

    public void append(ProcessedItem processed) throws IOException {
        writer.write(SectionFormat.renderSection(processed));
        writer.flush();
        sectionsWritten++;
    }

    public int getSectionsWritten() {
        return sectionsWritten;
    }

    public Path getOutput() {
        return output;
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
