package com.flashtasks.search.mapping;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of index name -> field path -> {@link FieldMapping}.
 * Anything not present reads as "no exact sub-field".
 */
public class MappingSummary {
    private static final Set<String> EXACT_TYPES = Set.of("keyword", "constant_keyword", "wildcard");

    private final Map<String, Map<String, FieldMapping>> indices;
    private final long loadedAtMs;

    public MappingSummary(Map<String, Map<String, FieldMapping>> indices, long loadedAtMs) {
        this.indices = indices == null ? Collections.emptyMap() : indices;
        this.loadedAtMs = loadedAtMs;
    }

    public static MappingSummary empty() {
        return new MappingSummary(Collections.emptyMap(), System.currentTimeMillis());
    }

    /**
     * Summarizes one index mapping ({@code {"properties": {...}}}) for the given field paths.
     */
    public static Map<String, FieldMapping> summarize(JsonNode mappings, List<String> fieldPaths) {
        Map<String, FieldMapping> fields = new LinkedHashMap<>();
        for (String fieldPath : fieldPaths) {
            fields.put(fieldPath, resolve(mappings, fieldPath));
        }
        return fields;
    }

    static FieldMapping resolve(JsonNode mappings, String fieldPath) {
        if (mappings == null || fieldPath == null || fieldPath.isBlank()) {
            return FieldMapping.UNMAPPED;
        }
        String[] segments = fieldPath.split("\\.");
        JsonNode properties = mappings.path("properties");
        JsonNode node = null;
        String nestedPath = null;
        StringBuilder walked = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            node = properties.path(segments[i]);
            if (!node.isObject()) {
                return FieldMapping.UNMAPPED;
            }
            if (walked.length() > 0) {
                walked.append('.');
            }
            walked.append(segments[i]);
            if (i < segments.length - 1) {
                if ("nested".equals(node.path("type").asText())) {
                    nestedPath = walked.toString();
                }
                properties = node.path("properties");
            }
        }
        if (EXACT_TYPES.contains(node.path("type").asText())) {
            return new FieldMapping(fieldPath, nestedPath);
        }
        return new FieldMapping(exactSubField(node.path("fields"), fieldPath), nestedPath);
    }

    private static String exactSubField(JsonNode subFields, String fieldPath) {
        if (!subFields.isObject()) {
            return null;
        }
        if (EXACT_TYPES.contains(subFields.path("keyword").path("type").asText())) {
            return fieldPath + ".keyword";
        }
        Iterator<Map.Entry<String, JsonNode>> it = subFields.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (EXACT_TYPES.contains(entry.getValue().path("type").asText())) {
                return fieldPath + "." + entry.getKey();
            }
        }
        return null;
    }

    public FieldMapping field(String index, String fieldPath) {
        Map<String, FieldMapping> fields = indices.get(index);
        if (fields == null) {
            return FieldMapping.UNMAPPED;
        }
        FieldMapping mapping = fields.get(fieldPath);
        return mapping == null ? FieldMapping.UNMAPPED : mapping;
    }

    public boolean hasExactSubField(String index, String fieldPath) {
        return field(index, fieldPath).isExact();
    }

    @JsonProperty("indices")
    public Map<String, Map<String, FieldMapping>> getIndices() {
        return indices;
    }

    @JsonProperty("loaded_at_ms")
    public long getLoadedAtMs() {
        return loadedAtMs;
    }
}
