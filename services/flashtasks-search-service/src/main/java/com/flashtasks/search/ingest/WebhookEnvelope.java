package com.flashtasks.search.ingest;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * A webhook delivery decoded once at the boundary.
 */
public class WebhookEnvelope {
    private final EventKind eventKind;
    private final String descriptor;
    private final ObjectNode document;
    private final List<String> hints;

    /**
     * @param descriptor the raw upstream event descriptor, kept for logging
     * @param document   the changed document, or null when the body carried none
     * @param hints      explicit type hints in priority order
     */
    public WebhookEnvelope(EventKind eventKind, String descriptor, ObjectNode document, List<String> hints) {
        this.eventKind = eventKind;
        this.descriptor = descriptor;
        this.document = document;
        this.hints = hints == null ? List.of() : hints;
    }

    public EventKind getEventKind() {
        return eventKind;
    }

    public String getDescriptor() {
        return descriptor;
    }

    public ObjectNode getDocument() {
        return document;
    }

    public List<String> getHints() {
        return hints;
    }

    public boolean isDelete() {
        return eventKind == EventKind.DELETE;
    }

    public String getDocumentId() {
        return PayloadFields.firstText(document, "$id", "id");
    }
}
