package com.flashtasks.search.ingest;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReconcileAction {
    UPSERTED("upserted"),
    DELETED("deleted"),
    MERGED_INTO_ORGANIZATION("merged_into_organization"),
    REMOVED_FROM_ORGANIZATION("removed_from_organization");

    private final String value;

    ReconcileAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
