package com.flashtasks.search.opensearch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class OpenSearchGateway {
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final OpenSearchProperties properties;

    public OpenSearchGateway(
        @Qualifier("openSearchRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        OpenSearchProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public StoredDocument getDocument(String index, String id) {
        if (id == null || id.isBlank()) {
            return null;
        }
        URI uri = uri(List.of(index, "_doc", id), null);
        JsonNode response = exchange(HttpMethod.GET, uri, null, true);
        if (response == null || !response.path("found").asBoolean(false)) {
            return null;
        }
        JsonNode source = response.path("_source");
        if (!source.isObject()) {
            return null;
        }
        Long seqNo = response.path("_seq_no").isNumber() ? response.path("_seq_no").asLong() : null;
        Long primaryTerm = response.path("_primary_term").isNumber() ? response.path("_primary_term").asLong() : null;
        return new StoredDocument((ObjectNode) source, seqNo, primaryTerm);
    }

    public void indexDocument(String index, String id, ObjectNode source) {
        indexDocument(index, id, source, null, null);
    }

    /**
     * Full replace of a document. When both sequence tokens are given the write only succeeds if the
     * stored document has not changed since it was read; otherwise {@link OpenSearchConflictException}.
     */
    public void indexDocument(String index, String id, ObjectNode source, Long ifSeqNo, Long ifPrimaryTerm) {
        Map<String, Object> params = null;
        if (ifSeqNo != null && ifPrimaryTerm != null) {
            params = new LinkedHashMap<>();
            params.put("if_seq_no", ifSeqNo);
            params.put("if_primary_term", ifPrimaryTerm);
        }
        exchange(HttpMethod.PUT, uri(List.of(index, "_doc", id), params), source, false);
    }

    /**
     * Writes only if no document with this id exists yet; otherwise {@link OpenSearchConflictException}.
     */
    public void createDocument(String index, String id, ObjectNode source) {
        exchange(HttpMethod.PUT, uri(List.of(index, "_create", id), null), source, false);
    }

    /**
     * @return false when the document did not exist
     */
    public boolean deleteDocument(String index, String id) {
        JsonNode response = exchange(HttpMethod.DELETE, uri(List.of(index, "_doc", id), null), null, true);
        return response != null && "deleted".equals(response.path("result").asText());
    }

    public void refresh(String index) {
        exchange(HttpMethod.POST, uri(List.of(index, "_refresh"), null), null, false);
    }

    public JsonNode search(List<String> indices, Map<String, Object> body) {
        URI uri = uri(List.of(String.join(",", indices), "_search"), Map.of("ignore_unavailable", true));
        return exchange(HttpMethod.POST, uri, body, false);
    }

    /**
     * @return the raw mapping response, or null when none of the indices exist
     */
    public JsonNode getMapping(List<String> indices) {
        return exchange(HttpMethod.GET, uri(List.of(String.join(",", indices), "_mapping"), null), null, true);
    }

    private JsonNode exchange(HttpMethod method, URI uri, Object body, boolean notFoundAsNull) {
        HttpHeaders headers = buildHeaders();
        try {
            HttpEntity<String> entity;
            if (body == null) {
                entity = new HttpEntity<>(headers);
            } else {
                headers.setContentType(MediaType.APPLICATION_JSON);
                entity = new HttpEntity<>(objectMapper.writeValueAsString(body), headers);
            }
            ResponseEntity<String> response = restTemplate.exchange(uri, method, entity, String.class);
            String responseBody = response.getBody();
            if (responseBody == null || responseBody.isBlank()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(responseBody);
        } catch (ResourceAccessException e) {
            throw new OpenSearchUnavailableException("OpenSearch unreachable: " + uri, e);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 404 && notFoundAsNull) {
                return null;
            }
            if (status == 409) {
                throw new OpenSearchConflictException("OpenSearch version conflict: " + uri.getPath(), e);
            }
            if (status == 502 || status == 503 || status == 504) {
                throw new OpenSearchUnavailableException("OpenSearch unavailable: " + status, e);
            }
            throw new OpenSearchRequestException("OpenSearch error: " + status, e);
        } catch (JsonProcessingException e) {
            throw new OpenSearchRequestException("Failed to parse OpenSearch response", e);
        }
    }

    private URI uri(List<String> segments, Map<String, Object> params) {
        String base = properties.getUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(base)
            .pathSegment(segments.toArray(String[]::new));
        if (params != null) {
            for (Map.Entry<String, Object> param : params.entrySet()) {
                builder.queryParam(param.getKey(), param.getValue());
            }
        }
        return builder.build().encode().toUri();
    }

    private HttpHeaders buildHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        String apiKey = properties.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set(HttpHeaders.AUTHORIZATION, "ApiKey " + apiKey);
            return headers;
        }
        String username = properties.getUsername();
        String password = properties.getPassword();
        if (username != null && !username.isBlank() && password != null && !password.isBlank()) {
            String auth = username + ":" + password;
            String encoded = Base64.getEncoder().encodeToString(auth.getBytes(StandardCharsets.UTF_8));
            headers.set(HttpHeaders.AUTHORIZATION, "Basic " + encoded);
        }
        return headers;
    }
}
