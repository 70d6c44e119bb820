package com.compound.enrichment.checkpoint;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * What an existing output log says about prior runs.
 *
 * @param headerPresent  the file starts with a complete header
 * @param foreignContent the file is non-empty but was not written by this tool
 * @param completedKeys  keys with at least one closed section, failed or not
 * @param failedKeys     completed keys whose latest closed section records an isolated failure
 * @param incompleteKeys keys of sections that were opened but never closed
 * @param closedSections number of closed sections
 * @param validBytes     length of the prefix made of the header and closed sections;
 *                       anything after it is a truncated tail
 * @param totalBytes     length of the file
 */
public record CheckpointState(
        boolean headerPresent,
        boolean foreignContent,
        Set<String> completedKeys,
        Set<String> failedKeys,
        List<String> incompleteKeys,
        int closedSections,
        long validBytes,
        long totalBytes
) {
    public CheckpointState {
        completedKeys = Set.copyOf(completedKeys);
        failedKeys = Set.copyOf(failedKeys);
        incompleteKeys = List.copyOf(incompleteKeys);
    }

    public static CheckpointState absent() {
        return new CheckpointState(false, false, Set.of(), Set.of(), List.of(), 0, 0, 0);
    }

    public boolean hasTruncatedTail() {
        return headerPresent && validBytes < totalBytes;
    }

    public boolean isCompleted(String key) {
        return completedKeys.contains(key);
    }

    /**
     * Keys a run should skip. With {@code retryFailed} the keys whose latest section is
     * a failure are left out, so those items are processed again.
     */
    public Set<String> completionSet(boolean retryFailed) {
        if (!retryFailed || failedKeys.isEmpty()) {
            return completedKeys;
        }
        Set<String> keys = new HashSet<>(completedKeys);
        keys.removeAll(failedKeys);
        return Set.copyOf(keys);
    }
}
