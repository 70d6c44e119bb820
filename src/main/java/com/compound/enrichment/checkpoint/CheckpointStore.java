package com.compound.enrichment.checkpoint;

import com.compound.enrichment.config.FatalConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Set;

/**
 * Checkpoint kept in the output log itself. There is no side file: the set of completed
 * items is whatever closed sections the log contains.
 */
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private final Clock clock;

    public CheckpointStore() {
        this(Clock.systemDefaultZone());
    }

    public CheckpointStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Reads the output log and derives its checkpoint. A missing file yields an empty state.
     */
    public CheckpointState inspect(Path output) throws IOException {
        if (!Files.exists(output)) {
            return CheckpointState.absent();
        }
        if (Files.isDirectory(output)) {
            throw new FatalConfigurationException("Output location is a directory: " + output);
        }
        String content = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
        CheckpointState state = CheckpointScanner.scan(content);
        if (!state.incompleteKeys().isEmpty()) {
            log.warn("checkpoint.incomplete_sections file={} keys={}", output, state.incompleteKeys());
        }
        log.debug("checkpoint.inspected file={} closed={} completed={} failed={} truncatedTail={}",
                output, state.closedSections(), state.completedKeys().size(),
                state.failedKeys().size(), state.hasTruncatedTail());
        return state;
    }

    /**
     * Keys of items a previous run persisted, including isolated failures.
     */
    public Set<String> computeCompletionSet(Path output) throws IOException {
        return computeCompletionSet(output, false);
    }

    /**
     * Keys of items a previous run persisted. With {@code retryFailed} the items whose
     * latest section records a failure are left out so they get processed again.
     */
    public Set<String> computeCompletionSet(Path output, boolean retryFailed) throws IOException {
        return inspect(output).completionSet(retryFailed);
    }

    /**
     * Prepares the output log for appending. A new or empty log gets a header. An existing
     * log is cut back to its last closed section so the unclosed tail of a killed run never
     * sits in front of new sections.
     *
     * @throws FatalConfigurationException if the file exists but is not an output log
     */
    public SectionWriter openForAppend(Path output, int totalItems) throws IOException {
        CheckpointState state = inspect(output);
        if (state.foreignContent()) {
            throw new FatalConfigurationException(
                    "Output location exists but is not an enrichment output log: " + output);
        }

        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        FileChannel channel = FileChannel.open(output,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        try {
            if (!state.headerPresent()) {
                channel.truncate(0);
                channel.position(0);
                String header = SectionFormat.renderHeader(totalItems, clock.instant(), clock.getZone());
                channel.write(StandardCharsets.UTF_8.encode(header));
                log.info("checkpoint.initialised file={} totalItems={}", output, totalItems);
            } else {
                if (state.hasTruncatedTail()) {
                    log.warn("checkpoint.truncated_tail file={} droppedBytes={}",
                            output, state.totalBytes() - state.validBytes());
                    channel.truncate(state.validBytes());
                }
                channel.position(channel.size());
                log.info("checkpoint.resuming file={} completed={} failed={}",
                        output, state.completedKeys().size(), state.failedKeys().size());
            }
            channel.force(false);
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }

        return new SectionWriter(output, new BufferedWriter(
                new OutputStreamWriter(Channels.newOutputStream(channel), StandardCharsets.UTF_8)));
    }
}
