package com.flashtasks.search.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.flashtasks.search.config.SearchProperties;
import com.flashtasks.search.opensearch.OpenSearchGateway;
import com.flashtasks.search.opensearch.OpenSearchProperties;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-wide summary of which candidate fields support exact matching, populated lazily on first use.
 * <p>
 * The snapshot is swapped without locking; concurrent refreshes are last-writer-wins. Only a summary in which
 * every index resolved is published: an index whose mapping cannot be read keeps its entry from the previous
 * snapshot, and without one the partial summary serves the current caller only, so the next
 * {@link #ensureLoaded()} tries again.
 */
@Component
public class MappingSummaryCache {
    private static final Logger logger = LoggerFactory.getLogger(MappingSummaryCache.class);

    public static final List<String> CANDIDATE_FIELDS = List.of(
        "userEmail",
        "docType",
        "title",
        "name",
        "slug",
        "assignee",
        "members.email",
        "members.name",
        "teams.name"
    );

    private final OpenSearchGateway openSearchGateway;
    private final OpenSearchProperties openSearchProperties;
    private final SearchProperties searchProperties;

    private volatile MappingSummary snapshot;

    public MappingSummaryCache(
        OpenSearchGateway openSearchGateway,
        OpenSearchProperties openSearchProperties,
        SearchProperties searchProperties
    ) {
        this.openSearchGateway = openSearchGateway;
        this.openSearchProperties = openSearchProperties;
        this.searchProperties = searchProperties;
    }

    /**
     * @return the last successfully loaded snapshot, or null when none has been loaded yet
     */
    public MappingSummary get() {
        return snapshot;
    }

    public MappingSummary ensureLoaded() {
        MappingSummary current = snapshot;
        if (current == null || isExpired(current)) {
            return refresh();
        }
        return current;
    }

    public MappingSummary refresh() {
        MappingSummary previous = snapshot;
        Map<String, Map<String, FieldMapping>> indices = new LinkedHashMap<>();
        boolean complete = true;
        for (String index : indices()) {
            Map<String, FieldMapping> fields = loadIndex(index);
            if (fields == null && previous != null) {
                fields = previous.getIndices().get(index);
            }
            if (fields == null) {
                complete = false;
                fields = Collections.emptyMap();
            }
            indices.put(index, fields);
        }
        MappingSummary summary = new MappingSummary(indices, System.currentTimeMillis());
        if (complete) {
            snapshot = summary;
        } else {
            logger.info("mapping_summary_incomplete indices={} published=false", indices.keySet());
        }
        return summary;
    }

    public List<String> indices() {
        return List.of(openSearchProperties.getTaskIndex(), openSearchProperties.getOrganizationIndex());
    }

    /**
     * @return the field summary, or null when the mapping could not be read
     */
    private Map<String, FieldMapping> loadIndex(String index) {
        JsonNode response;
        try {
            response = openSearchGateway.getMapping(List.of(index));
        } catch (RuntimeException e) {
            logger.warn("mapping_refresh_failed index={} error={}", index, e.getMessage());
            return null;
        }
        JsonNode mappings = firstMappings(response);
        if (mappings == null) {
            logger.info("mapping_missing index={}", index);
            return null;
        }
        Map<String, FieldMapping> fields = MappingSummary.summarize(mappings, CANDIDATE_FIELDS);
        logger.debug("mapping_loaded index={} fields={}", index, fields.keySet());
        return fields;
    }

    // An alias answers under the concrete index name, so take the first entry.
    private JsonNode firstMappings(JsonNode response) {
        if (response == null || !response.isObject()) {
            return null;
        }
        Iterator<JsonNode> it = response.elements();
        if (!it.hasNext()) {
            return null;
        }
        JsonNode mappings = it.next().path("mappings");
        return mappings.isObject() ? mappings : null;
    }

    private boolean isExpired(MappingSummary summary) {
        long intervalMs = searchProperties.getMappingRefreshIntervalMs();
        return intervalMs > 0 && System.currentTimeMillis() - summary.getLoadedAtMs() > intervalMs;
    }
}
