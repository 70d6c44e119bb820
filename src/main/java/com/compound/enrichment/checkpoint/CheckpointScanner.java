package com.compound.enrichment.checkpoint;

import com.compound.enrichment.core.model.WorkItem;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the checkpoint from the content of an output log. Pure: no I/O.
 *
 * <p>A section counts only once its closing marker has been read, whether it records a
 * resolution or an isolated failure. A section that is opened and never closed, an end
 * marker that does not match the open section, or a start marker with an unreadable key
 * is an anomaly; the affected key is treated as not completed, so the item gets
 * reprocessed. When a key has several closed sections the last one decides whether it
 * is reported as failed.</p>
 *
 * <p>A log holding nothing but the beginning of the title line was cut off while its
 * header was being written and is reported as absent.</p>
 */
public final class CheckpointScanner {

    private CheckpointScanner() {
    }

    public static CheckpointState scan(String content) {
        if (content == null || content.isEmpty()) {
            return CheckpointState.absent();
        }

        Map<String, Boolean> lastClosedFailed = new LinkedHashMap<>();
        List<String> incomplete = new ArrayList<>();
        boolean titleSeen = false;
        boolean headerPresent = false;
        int validEnd = 0;
        int closedSections = 0;
        String openKey = null;
        boolean openFailed = false;

        int pos = 0;
        int length = content.length();
        boolean firstLine = true;
        while (pos < length) {
            int newline = content.indexOf('\n', pos);
            boolean terminated = newline >= 0;
            int lineEnd = terminated ? newline + 1 : length;
            String line = stripCarriageReturn(content.substring(pos, terminated ? newline : length));
            pos = lineEnd;

            if (firstLine) {
                firstLine = false;
                if (!terminated && SectionFormat.HEADER_TITLE.startsWith(line)) {
                    return new CheckpointState(false, false, Set.of(), Set.of(), List.of(), 0, 0, byteLength(content));
                }
                if (!line.equals(SectionFormat.HEADER_TITLE)) {
                    return new CheckpointState(false, true, Set.of(), Set.of(), List.of(), 0, 0, byteLength(content));
                }
                titleSeen = true;
                continue;
            }

            if (!headerPresent) {
                if (titleSeen && terminated && line.startsWith(SectionFormat.GENERATED_PREFIX)) {
                    headerPresent = true;
                    validEnd = lineEnd;
                }
                continue;
            }

            if (line.startsWith(SectionFormat.END_PREFIX)) {
                String key = line.substring(SectionFormat.END_PREFIX.length()).trim();
                if (openKey != null && openKey.equals(key) && terminated) {
                    lastClosedFailed.remove(key);
                    lastClosedFailed.put(key, openFailed);
                    closedSections++;
                    validEnd = lineEnd;
                } else if (openKey != null) {
                    incomplete.add(openKey);
                }
                openKey = null;
            } else if (line.startsWith(SectionFormat.START_PREFIX)) {
                if (openKey != null) {
                    incomplete.add(openKey);
                }
                openKey = parseStartKey(line);
                openFailed = false;
            } else if (openKey != null && line.equals(SectionFormat.STATUS_FAILED)) {
                openFailed = true;
            }
        }
        if (openKey != null) {
            incomplete.add(openKey);
        }

        Set<String> completed = new HashSet<>(lastClosedFailed.keySet());
        Set<String> failed = new HashSet<>();
        lastClosedFailed.forEach((key, wasFailed) -> {
            if (wasFailed) {
                failed.add(key);
            }
        });

        return new CheckpointState(headerPresent, false, completed, failed, incomplete, closedSections,
                byteLength(content.substring(0, validEnd)), byteLength(content));
    }

    /**
     * Parses {@code ITEM #key: label}; returns null if the key is not a valid work item key.
     */
    static String parseStartKey(String line) {
        String rest = line.substring(SectionFormat.START_PREFIX.length());
        int colon = rest.indexOf(':');
        String key = (colon >= 0 ? rest.substring(0, colon) : rest).trim();
        return WorkItem.isValidKey(key) ? key : null;
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private static long byteLength(String content) {
        return content.getBytes(StandardCharsets.UTF_8).length;
    }
}
