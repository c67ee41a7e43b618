package com.flashtasks.search.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.flashtasks.search.mapping.MappingSummary;

public class MappingsResponse {
    private final JsonNode mappings;
    private final MappingSummary summary;

    public MappingsResponse(JsonNode mappings, MappingSummary summary) {
        this.mappings = mappings;
        this.summary = summary;
    }

    public JsonNode getMappings() {
        return mappings;
    }

    public MappingSummary getSummary() {
        return summary;
    }
}
