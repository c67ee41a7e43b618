package com.flashtasks.search.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.function.Predicate;

/**
 * One structural heuristic: when the payload matches, it is classified as {@link #getKind()}.
 */
public class ClassificationRule {
    private final String name;
    private final DocumentKind kind;
    private final Predicate<JsonNode> matcher;

    public ClassificationRule(String name, DocumentKind kind, Predicate<JsonNode> matcher) {
        this.name = name;
        this.kind = kind;
        this.matcher = matcher;
    }

    public String getName() {
        return name;
    }

    public DocumentKind getKind() {
        return kind;
    }

    public boolean matches(JsonNode payload) {
        return matcher.test(payload);
    }
}
