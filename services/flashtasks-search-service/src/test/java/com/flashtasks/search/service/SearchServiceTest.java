package com.flashtasks.search.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flashtasks.search.api.dto.SearchRequest;
import com.flashtasks.search.api.dto.SearchResponse;
import com.flashtasks.search.common.BadRequestException;
import com.flashtasks.search.config.IndexingProperties;
import com.flashtasks.search.config.SearchProperties;
import com.flashtasks.search.ingest.DocumentKind;
import com.flashtasks.search.ingest.DocumentReconciler;
import com.flashtasks.search.ingest.EventKind;
import com.flashtasks.search.ingest.WebhookEnvelope;
import com.flashtasks.search.mapping.FieldMapping;
import com.flashtasks.search.mapping.MappingSummary;
import com.flashtasks.search.mapping.MappingSummaryCache;
import com.flashtasks.search.opensearch.OpenSearchGateway;
import com.flashtasks.search.opensearch.OpenSearchProperties;
import com.flashtasks.search.query.VisibilityScopedQueryBuilder;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SearchServiceTest {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final List<String> INDICES = List.of("tasks", "organizations");

    @Mock
    private OpenSearchGateway openSearchGateway;

    @Mock
    private MappingSummaryCache mappingSummaryCache;

    private SearchService searchService;

    @BeforeEach
    void setUp() {
        searchService = new SearchService(
            openSearchGateway,
            mappingSummaryCache,
            new VisibilityScopedQueryBuilder(new OpenSearchProperties()),
            new SearchProperties(),
            OBJECT_MAPPER
        );
    }

    @Test
    void ownerFindsTaskByTitlePrefix() throws Exception {
        when(mappingSummaryCache.ensureLoaded()).thenReturn(new MappingSummary(
            Map.of("tasks", Map.of("userEmail", new FieldMapping("userEmail.keyword", null))),
            0L
        ));
        when(openSearchGateway.search(eq(INDICES), any())).thenReturn(OBJECT_MAPPER.readTree(
            "{\"hits\":{\"hits\":[{\"_id\":\"t1\",\"_index\":\"tasks\",\"_score\":1.5,"
                + "\"_source\":{\"title\":\"Design review\",\"userEmail\":\"a@x.com\",\"docType\":\"task\"}}]}}"
        ));

        SearchResponse response = searchService.search(request("desi", "a@x.com"));

        assertThat(response.getResults()).hasSize(1);
        Map<String, Object> item = response.getResults().get(0);
        assertThat(item).containsEntry("$id", "t1").containsEntry("_index", "tasks").containsEntry("_score", 1.5);
        assertThat(item).containsEntry("title", "Design review");
        assertThat(response.getDebug()).isNull();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> body = ArgumentCaptor.forClass(Map.class);
        verify(openSearchGateway).search(eq(INDICES), body.capture());
        JsonNode query = OBJECT_MAPPER.valueToTree(body.getValue());
        assertThat(query.at("/query/bool/filter/0/bool/should/0/bool/filter/1/term").path("userEmail.keyword").asText())
            .isEqualTo("a@x.com");
    }

    @Test
    void otherUserQueryIsScopedToThatUser() throws Exception {
        when(mappingSummaryCache.ensureLoaded()).thenReturn(new MappingSummary(
            Map.of("tasks", Map.of("userEmail", new FieldMapping("userEmail.keyword", null))),
            0L
        ));
        when(openSearchGateway.search(eq(INDICES), any())).thenReturn(OBJECT_MAPPER.readTree("{\"hits\":{\"hits\":[]}}"));

        SearchResponse response = searchService.search(request("desi", "b@x.com"));

        assertThat(response.getResults()).isEmpty();
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> body = ArgumentCaptor.forClass(Map.class);
        verify(openSearchGateway).search(eq(INDICES), body.capture());
        JsonNode branches = OBJECT_MAPPER.valueToTree(body.getValue()).at("/query/bool/filter/0/bool/should");
        assertThat(branches).hasSize(2);
        for (JsonNode branch : branches) {
            assertThat(branch.toString()).contains("b@x.com").doesNotContain("a@x.com");
        }
        assertThat(branches.at("/0/bool/filter/1/term").path("userEmail.keyword").asText()).isEqualTo("b@x.com");
    }

    @Test
    void deletedTaskIsRemovedAndRefreshedBeforeNextSearch() throws Exception {
        DocumentReconciler reconciler = new DocumentReconciler(
            openSearchGateway,
            new OpenSearchProperties(),
            new IndexingProperties(),
            OBJECT_MAPPER
        );
        when(openSearchGateway.deleteDocument("tasks", "t1")).thenReturn(true);
        when(mappingSummaryCache.ensureLoaded()).thenReturn(MappingSummary.empty());
        when(openSearchGateway.search(eq(INDICES), any())).thenReturn(OBJECT_MAPPER.readTree("{\"hits\":{\"hits\":[]}}"));

        reconciler.reconcile(
            new WebhookEnvelope(
                EventKind.DELETE,
                "databases.main.collections.tasks.documents.t1.delete",
                (ObjectNode) OBJECT_MAPPER.readTree("{\"$id\":\"t1\"}"),
                List.of()
            ),
            DocumentKind.TASK
        );
        SearchResponse response = searchService.search(request("desi", "a@x.com"));

        assertThat(response.getResults()).isEmpty();
        InOrder inOrder = inOrder(openSearchGateway);
        inOrder.verify(openSearchGateway).deleteDocument("tasks", "t1");
        inOrder.verify(openSearchGateway).refresh("tasks");
        inOrder.verify(openSearchGateway).search(eq(INDICES), any());
    }

    @Test
    void shortQueryReturnsEmptyWithoutTouchingStore() {
        SearchResponse response = searchService.search(request(" d ", "a@x.com"));

        assertThat(response.getResults()).isEmpty();
        verifyNoInteractions(openSearchGateway, mappingSummaryCache);
    }

    @Test
    void missingEmailIsRejected() {
        assertThatThrownBy(() -> searchService.search(request("design", null)))
            .isInstanceOf(BadRequestException.class)
            .extracting("code")
            .isEqualTo("userEmail_required");
        assertThatThrownBy(() -> searchService.search(null)).isInstanceOf(BadRequestException.class);
        verifyNoInteractions(openSearchGateway);
    }

    @Test
    void debugRunsUnfilteredSearchToo() throws Exception {
        when(mappingSummaryCache.ensureLoaded()).thenReturn(MappingSummary.empty());
        when(openSearchGateway.search(eq(INDICES), any())).thenReturn(
            OBJECT_MAPPER.readTree("{\"hits\":{\"hits\":[]}}"),
            OBJECT_MAPPER.readTree("{\"hits\":{\"hits\":[{\"_id\":\"t9\",\"_index\":\"tasks\",\"_source\":{}}]}}")
        );
        SearchRequest request = request("design", "a@x.com");
        request.setDebug(true);

        SearchResponse response = searchService.search(request);

        assertThat(response.getResults()).isEmpty();
        assertThat(response.getDebug().getFiltered()).isEmpty();
        assertThat(response.getDebug().getUnfiltered()).extracting(item -> item.get("$id")).containsExactly("t9");
        verify(openSearchGateway, times(2)).search(eq(INDICES), any());
    }

    @Test
    void clampsLimit() {
        assertThat(searchService.clampLimit(null)).isEqualTo(10);
        assertThat(searchService.clampLimit(0)).isEqualTo(10);
        assertThat(searchService.clampLimit(25)).isEqualTo(25);
        assertThat(searchService.clampLimit(500)).isEqualTo(50);
    }

    @Test
    void hitMetadataWinsOverSourceFields() throws Exception {
        List<Map<String, Object>> items = searchService.toItems(OBJECT_MAPPER.readTree(
            "{\"hits\":{\"hits\":[{\"_id\":\"o1\",\"_index\":\"organizations\",\"_score\":2.0,"
                + "\"_source\":{\"$id\":\"stale\",\"name\":\"Acme\"}}]}}"
        ));

        assertThat(items.get(0)).containsEntry("$id", "o1").containsEntry("name", "Acme");
    }

    private SearchRequest request(String query, String userEmail) {
        SearchRequest request = new SearchRequest();
        request.setQuery(query);
        request.setUserEmail(userEmail);
        return request;
    }
}
