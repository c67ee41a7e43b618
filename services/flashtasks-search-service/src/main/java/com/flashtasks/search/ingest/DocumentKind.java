package com.flashtasks.search.ingest;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DocumentKind {
    TASK("task"),
    ORGANIZATION("organization"),
    TEAM("team"),
    ORG_MEMBER("orgMember");

    private final String value;

    DocumentKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
