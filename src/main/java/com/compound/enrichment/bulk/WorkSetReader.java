package com.compound.enrichment.bulk;

import com.compound.enrichment.config.FatalConfigurationException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the work set from a specific format (CSV, JSON).
 * Invalid records are reported in the {@link LoadResult} and skipped; an input that
 * cannot be read at all is fatal.
 */
public interface WorkSetReader {

    /**
     * Reads work items from a reader.
     *
     * @throws IOException if the input cannot be read
     */
    LoadResult read(Reader reader) throws IOException;

    /**
     * Reads work items from a file.
     *
     * @throws FatalConfigurationException if the file is missing or unreadable
     */
    default LoadResult read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new FatalConfigurationException("Work set not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new FatalConfigurationException("Work set could not be read: " + path, e);
        }
    }

    /**
     * Returns the format supported by this reader (e.g., "csv", "json").
     */
    String getFormat();
}
