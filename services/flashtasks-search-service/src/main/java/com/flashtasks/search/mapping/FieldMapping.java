package com.flashtasks.search.mapping;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What the index schema says about one candidate field.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldMapping {
    static final FieldMapping UNMAPPED = new FieldMapping(null, null);

    private final String exactField;
    private final String nestedPath;

    public FieldMapping(String exactField, String nestedPath) {
        this.exactField = exactField;
        this.nestedPath = nestedPath;
    }

    @JsonProperty("exact")
    public boolean isExact() {
        return exactField != null;
    }

    /**
     * The path to use for an untokenized term query: the field itself or its keyword sub-field.
     */
    @JsonProperty("exact_field")
    public String getExactField() {
        return exactField;
    }

    @JsonProperty("nested_path")
    public String getNestedPath() {
        return nestedPath;
    }
}
