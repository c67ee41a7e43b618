package com.flashtasks.search.opensearch;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A document source as read from the store, with the sequence tokens needed for a conditional write.
 */
public class StoredDocument {
    private final ObjectNode source;
    private final Long seqNo;
    private final Long primaryTerm;

    public StoredDocument(ObjectNode source, Long seqNo, Long primaryTerm) {
        this.source = source;
        this.seqNo = seqNo;
        this.primaryTerm = primaryTerm;
    }

    public ObjectNode getSource() {
        return source;
    }

    public Long getSeqNo() {
        return seqNo;
    }

    public Long getPrimaryTerm() {
        return primaryTerm;
    }

    public boolean hasVersion() {
        return seqNo != null && primaryTerm != null;
    }
}
