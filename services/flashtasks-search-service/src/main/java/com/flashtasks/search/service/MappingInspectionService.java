package com.flashtasks.search.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.flashtasks.search.api.dto.MappingsResponse;
import com.flashtasks.search.mapping.MappingSummary;
import com.flashtasks.search.mapping.MappingSummaryCache;
import com.flashtasks.search.opensearch.OpenSearchGateway;
import java.util.Arrays;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class MappingInspectionService {
    private final OpenSearchGateway openSearchGateway;
    private final MappingSummaryCache mappingSummaryCache;

    public MappingInspectionService(
        OpenSearchGateway openSearchGateway,
        MappingSummaryCache mappingSummaryCache
    ) {
        this.openSearchGateway = openSearchGateway;
        this.mappingSummaryCache = mappingSummaryCache;
    }

    /**
     * @param indexParam comma-separated index names; the configured indices when blank
     * @param refresh    reload the summary before answering
     */
    public MappingsResponse describe(String indexParam, boolean refresh) {
        List<String> indices = parseIndices(indexParam);
        JsonNode mappings = openSearchGateway.getMapping(indices);
        MappingSummary summary = refresh ? mappingSummaryCache.refresh() : mappingSummaryCache.ensureLoaded();
        return new MappingsResponse(mappings, summary);
    }

    List<String> parseIndices(String indexParam) {
        if (indexParam == null || indexParam.isBlank()) {
            return mappingSummaryCache.indices();
        }
        List<String> indices = Arrays.stream(indexParam.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
        return indices.isEmpty() ? mappingSummaryCache.indices() : indices;
    }
}
