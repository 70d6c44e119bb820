package com.compound.enrichment.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One record of the work set. Immutable once loaded.
 *
 * <p>The key is the stable identifier written into the output section marker, so it is
 * restricted to characters that cannot collide with the marker syntax. The remaining
 * fields are hints for the lookup sources and descriptive attributes carried through
 * to the tabular export.</p>
 */
public final class WorkItem {

    private static final Pattern KEY_PATTERN = Pattern.compile("[A-Za-z0-9._/\\-]+");
    public static final String DEFAULT_SYNONYM_SEPARATOR = " or ";

    private final String key;
    private final String label;
    private final String secondaryKey;
    private final List<String> queryNames;
    private final Map<String, String> attributes;

    private WorkItem(Builder builder) {
        this.key = validateKey(builder.key);
        this.label = builder.label != null ? builder.label.trim() : "";
        this.secondaryKey = builder.secondaryKey != null ? builder.secondaryKey.trim() : "";
        this.queryNames = splitNames(this.label, builder.synonymSeparator);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    /**
     * High-specificity lookup key (e.g. an InChIKey). Empty when absent.
     */
    public String getSecondaryKey() {
        return secondaryKey;
    }

    /**
     * The label split into its synonyms, in declaration order.
     */
    public List<String> getQueryNames() {
        return queryNames;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public boolean hasSecondaryKey() {
        return !secondaryKey.isEmpty();
    }

    public boolean hasLabel() {
        return !label.isEmpty();
    }

    /**
     * Returns true if the given key can be used as a work item key.
     */
    public static boolean isValidKey(String key) {
        return key != null && KEY_PATTERN.matcher(key).matches();
    }

    private static String validateKey(String key) {
        String trimmed = key != null ? key.trim() : null;
        if (!isValidKey(trimmed)) {
            throw new IllegalArgumentException("Invalid work item key: '" + key + "'");
        }
        return trimmed;
    }

    private static List<String> splitNames(String label, String separator) {
        if (label.isEmpty()) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        for (String name : label.split(Pattern.quote(separator))) {
            String trimmed = name.trim();
            if (!trimmed.isEmpty()) {
                names.add(trimmed);
            }
        }
        return List.copyOf(names);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkItem workItem)) return false;
        return key.equals(workItem.key)
                && label.equals(workItem.label)
                && secondaryKey.equals(workItem.secondaryKey)
                && attributes.equals(workItem.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, label, secondaryKey, attributes);
    }

    @Override
    public String toString() {
        return "WorkItem{key='" + key + "', label='" + label + "'" +
                (secondaryKey.isEmpty() ? "" : ", secondaryKey='" + secondaryKey + "'") + '}';
    }

    public static class Builder {
        private String key;
        private String label;
        private String secondaryKey;
        private String synonymSeparator = DEFAULT_SYNONYM_SEPARATOR;
        private final Map<String, String> attributes = new LinkedHashMap<>();

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder secondaryKey(String secondaryKey) {
            this.secondaryKey = secondaryKey;
            return this;
        }

        public Builder synonymSeparator(String synonymSeparator) {
            if (synonymSeparator == null || synonymSeparator.isEmpty()) {
                throw new IllegalArgumentException("synonymSeparator must not be empty");
            }
            this.synonymSeparator = synonymSeparator;
            return this;
        }

        public Builder attribute(String name, String value) {
            attributes.put(Objects.requireNonNull(name, "attribute name is required"),
                    value != null ? value : "");
            return this;
        }

        public Builder attributes(Map<String, String> values) {
            values.forEach(this::attribute);
            return this;
        }

        public WorkItem build() {
            return new WorkItem(this);
        }
    }
}
