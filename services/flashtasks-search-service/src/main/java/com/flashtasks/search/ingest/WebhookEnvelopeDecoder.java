package com.flashtasks.search.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Normalizes the shapes an upstream webhook may take. The event descriptor is read from the body
 * ({@code event}, {@code events[0]}, {@code type}) before the event headers; the document from
 * {@code document}, {@code payload.document}, {@code payload}, or the body itself.
 */
@Component
public class WebhookEnvelopeDecoder {
    static final List<String> EVENT_HEADERS = List.of("x-appwrite-event", "x-appwrite-webhook-event");
    static final String TYPE_HEADER = "x-document-type";
    static final List<String> HINT_FIELDS = List.of("docType", "documentType", "collection", "collectionId");

    public WebhookEnvelope decode(JsonNode body, HttpHeaders headers) {
        String descriptor = resolveDescriptor(body, headers);
        ObjectNode document = resolveDocument(body);
        return new WebhookEnvelope(EventKind.fromDescriptor(descriptor), descriptor, document, resolveHints(body, document, headers));
    }

    private String resolveDescriptor(JsonNode body, HttpHeaders headers) {
        if (body != null) {
            for (String field : List.of("event", "events", "type")) {
                JsonNode value = body.get(field);
                if (value != null && value.isArray()) {
                    value = value.size() > 0 ? value.get(0) : null;
                }
                if (value != null && value.isTextual() && !value.asText().isBlank()) {
                    return value.asText();
                }
            }
        }
        if (headers != null) {
            for (String header : EVENT_HEADERS) {
                String value = headers.getFirst(header);
                if (value != null && !value.isBlank()) {
                    return value;
                }
            }
        }
        return "";
    }

    private ObjectNode resolveDocument(JsonNode body) {
        if (body == null || !body.isObject()) {
            return null;
        }
        JsonNode document = body.path("document");
        if (document.isObject()) {
            return (ObjectNode) document;
        }
        JsonNode payload = body.path("payload");
        if (payload.path("document").isObject()) {
            return (ObjectNode) payload.get("document");
        }
        if (payload.isObject()) {
            return (ObjectNode) payload;
        }
        if (PayloadFields.anyPresent(body, "$id", "id")) {
            return (ObjectNode) body;
        }
        return null;
    }

    private List<String> resolveHints(JsonNode body, ObjectNode document, HttpHeaders headers) {
        List<String> hints = new ArrayList<>();
        if (headers != null) {
            String header = headers.getFirst(TYPE_HEADER);
            if (header != null && !header.isBlank()) {
                hints.add(header.trim());
            }
        }
        if (body != null) {
            addHints(hints, body);
            addHints(hints, body.path("payload"));
        }
        String collection = PayloadFields.firstText(document, "$collectionId");
        if (collection != null) {
            hints.add(collection);
        }
        return hints;
    }

    private void addHints(List<String> hints, JsonNode node) {
        for (String field : HINT_FIELDS) {
            String value = PayloadFields.firstText(node, field);
            if (value != null) {
                hints.add(value);
            }
        }
    }
}
