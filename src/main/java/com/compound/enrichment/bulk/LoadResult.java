package com.compound.enrichment.bulk;

import com.compound.enrichment.core.model.WorkItem;

import java.util.List;

/**
 * Result of loading a work set.
 *
 * @param items  the loaded items, in input order
 * @param errors records that were skipped, with the reason
 */
public record LoadResult(List<WorkItem> items, List<LoadError> errors) {

    public LoadResult {
        items = items != null ? List.copyOf(items) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public int size() {
        return items.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A record of the input that could not be turned into a work item.
     *
     * @param position line number (CSV) or 1-based array index (JSON)
     * @param input    the raw input, abbreviated
     * @param message  why it was skipped
     */
    public record LoadError(long position, String input, String message) {}

    @Override
    public String toString() {
        return "LoadResult{items=" + items.size() + ", errors=" + errors.size() + '}';
    }
}
