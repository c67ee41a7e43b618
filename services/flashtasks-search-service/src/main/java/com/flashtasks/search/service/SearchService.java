package com.flashtasks.search.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flashtasks.search.api.dto.SearchRequest;
import com.flashtasks.search.api.dto.SearchResponse;
import com.flashtasks.search.common.BadRequestException;
import com.flashtasks.search.config.SearchProperties;
import com.flashtasks.search.mapping.MappingSummary;
import com.flashtasks.search.mapping.MappingSummaryCache;
import com.flashtasks.search.opensearch.OpenSearchGateway;
import com.flashtasks.search.query.VisibilityScopedQueryBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SearchService {
    private static final Logger logger = LoggerFactory.getLogger(SearchService.class);
    private static final TypeReference<LinkedHashMap<String, Object>> SOURCE_TYPE = new TypeReference<>() {
    };

    private final OpenSearchGateway openSearchGateway;
    private final MappingSummaryCache mappingSummaryCache;
    private final VisibilityScopedQueryBuilder queryBuilder;
    private final SearchProperties properties;
    private final ObjectMapper objectMapper;

    public SearchService(
        OpenSearchGateway openSearchGateway,
        MappingSummaryCache mappingSummaryCache,
        VisibilityScopedQueryBuilder queryBuilder,
        SearchProperties properties,
        ObjectMapper objectMapper
    ) {
        this.openSearchGateway = openSearchGateway;
        this.mappingSummaryCache = mappingSummaryCache;
        this.queryBuilder = queryBuilder;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public SearchResponse search(SearchRequest request) {
        String userEmail = request == null ? null : request.getUserEmail();
        if (userEmail == null || userEmail.isBlank()) {
            throw new BadRequestException("userEmail_required", "userEmail is required");
        }
        String text = request.getQuery() == null ? "" : request.getQuery().trim();
        if (text.length() < properties.getMinQueryLength()) {
            return SearchResponse.empty();
        }
        int size = clampLimit(request.getLimit());
        long started = System.nanoTime();

        MappingSummary summary = mappingSummaryCache.ensureLoaded();
        Map<String, Object> body = queryBuilder.build(text, userEmail, size, summary);
        List<Map<String, Object>> results = toItems(openSearchGateway.search(queryBuilder.indices(), body));

        SearchResponse response = new SearchResponse();
        response.setResults(results);
        if (request.isDebug()) {
            Map<String, Object> unfilteredBody = queryBuilder.buildUnfiltered(text, size);
            List<Map<String, Object>> unfiltered = toItems(openSearchGateway.search(queryBuilder.indices(), unfilteredBody));
            response.setDebug(new SearchResponse.Debug(results, unfiltered));
        }
        logger.info(
            "search_completed hits={} size={} debug={} took_ms={}",
            results.size(),
            size,
            request.isDebug(),
            (System.nanoTime() - started) / 1_000_000L
        );
        return response;
    }

    int clampLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return Math.min(properties.getDefaultLimit(), properties.getMaxLimit());
        }
        return Math.min(limit, properties.getMaxLimit());
    }

    /**
     * Flattens each hit to its stored fields plus {@code $id}, {@code _index} and {@code _score}.
     */
    List<Map<String, Object>> toItems(JsonNode response) {
        List<Map<String, Object>> items = new ArrayList<>();
        if (response == null) {
            return items;
        }
        for (JsonNode hit : response.path("hits").path("hits")) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("$id", hit.path("_id").asText(null));
            item.put("_index", hit.path("_index").asText(null));
            item.put("_score", hit.path("_score").isNumber() ? hit.path("_score").asDouble() : null);
            JsonNode source = hit.path("_source");
            if (source.isObject()) {
                Map<String, Object> fields = objectMapper.convertValue(source, SOURCE_TYPE);
                fields.forEach(item::putIfAbsent);
            }
            items.add(item);
        }
        return items;
    }
}
