package com.compound.enrichment.bulk;

import com.compound.enrichment.core.model.WorkItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON work set reader.
 *
 * <p>Expected format:</p>
 * <pre>
 * {
 *   "compounds": [
 *     {"id": "c1", "compound_name": "quinine", "inchikey": "LOXJEDZZCXVOQV-UHFFFAOYSA-N",
 *      "plant_name": "Cinchona officinalis", "properties": {"molecular_weight": 324.4}},
 *     {"compound_name": "artemisinin"}
 *   ]
 * }
 * </pre>
 *
 * <p>A top-level array of the same objects is accepted too. Without an {@code id} the
 * 1-based position is the key. Other scalar fields, and the fields of the nested
 * {@code properties} object, become attributes in document order.</p>
 */
public class JsonWorkSetReader implements WorkSetReader {
    private static final Logger log = LoggerFactory.getLogger(JsonWorkSetReader.class);

    static final String ITEMS_FIELD = "compounds";
    static final String KEY_FIELD = "id";
    static final String LABEL_FIELD = "compound_name";
    static final String SECONDARY_KEY_FIELD = "inchikey";
    static final String PROPERTIES_FIELD = "properties";

    private final ObjectMapper objectMapper;
    private final int maxItems;
    private final String synonymSeparator;

    public JsonWorkSetReader() {
        this(new ObjectMapper(), 0, WorkItem.DEFAULT_SYNONYM_SEPARATOR);
    }

    public JsonWorkSetReader(ObjectMapper objectMapper, int maxItems, String synonymSeparator) {
        this.objectMapper = objectMapper;
        this.maxItems = maxItems;
        this.synonymSeparator = synonymSeparator;
    }

    @Override
    public LoadResult read(Reader reader) throws IOException {
        JsonNode root;
        try {
            root = objectMapper.readTree(reader);
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed JSON work set: " + e.getOriginalMessage(), e);
        }

        JsonNode array = root != null && root.isObject() ? root.path(ITEMS_FIELD) : root;
        if (array == null || !array.isArray()) {
            throw new IOException("JSON work set must be an array or an object with a '" + ITEMS_FIELD + "' array");
        }

        List<WorkItem> items = new ArrayList<>();
        List<LoadResult.LoadError> errors = new ArrayList<>();
        Set<String> seenKeys = new HashSet<>();

        int position = 0;
        for (JsonNode node : array) {
            position++;
            if (maxItems > 0 && items.size() >= maxItems) {
                log.info("workset.max_items_reached maxItems={} position={}", maxItems, position);
                break;
            }
            if (!node.isObject()) {
                errors.add(new LoadResult.LoadError(position, abbreviate(node.toString()), "expected an object"));
                continue;
            }

            String key = node.hasNonNull(KEY_FIELD) ? node.get(KEY_FIELD).asText().trim() : String.valueOf(position);
            if (!WorkItem.isValidKey(key)) {
                errors.add(new LoadResult.LoadError(position, abbreviate(node.toString()), "invalid key '" + key + "'"));
                continue;
            }
            if (!seenKeys.add(key)) {
                errors.add(new LoadResult.LoadError(position, abbreviate(node.toString()), "duplicate key '" + key + "'"));
                continue;
            }

            WorkItem.Builder builder = WorkItem.builder()
                    .key(key)
                    .label(node.path(LABEL_FIELD).asText(""))
                    .secondaryKey(node.path(SECONDARY_KEY_FIELD).asText(""))
                    .synonymSeparator(synonymSeparator);
            collectAttributes(node, builder);
            items.add(builder.build());
        }

        for (LoadResult.LoadError error : errors) {
            log.warn("workset.skipped position={} input='{}' reason={}", error.position(), error.input(), error.message());
        }
        LoadResult result = new LoadResult(items, errors);
        log.info("workset.loaded format=json result={}", result);
        return result;
    }

    private static void collectAttributes(JsonNode node, WorkItem.Builder builder) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode value = field.getValue();
            if (name.equals(KEY_FIELD) || name.equals(LABEL_FIELD) || name.equals(SECONDARY_KEY_FIELD)) {
                continue;
            }
            if (name.equals(PROPERTIES_FIELD) && value.isObject()) {
                value.fields().forEachRemaining(p -> {
                    if (p.getValue().isValueNode()) {
                        builder.attribute(p.getKey(), p.getValue().isNull() ? "" : p.getValue().asText());
                    }
                });
            } else if (value.isValueNode()) {
                builder.attribute(name, value.isNull() ? "" : value.asText());
            }
        }
    }

    @Override
    public String getFormat() {
        return "json";
    }

    private static String abbreviate(String value) {
        return value.length() > 80 ? value.substring(0, 77) + "..." : value;
    }
}
