package com.flashtasks.search.query;

import com.flashtasks.search.common.BadRequestException;
import com.flashtasks.search.ingest.DocumentKind;
import com.flashtasks.search.mapping.FieldMapping;
import com.flashtasks.search.mapping.MappingSummary;
import com.flashtasks.search.opensearch.OpenSearchProperties;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Builds the search body: a prefix-tolerant text clause AND a visibility filter that admits tasks the caller owns
 * OR organizations the caller is a member of.
 * <p>
 * Identity clauses use a {@code term} on the exact path only when the mapping summary reports one for that index
 * and field; otherwise a {@code match_phrase}. A term against a tokenized field silently matches nothing, so the
 * keyword sub-field is never assumed. The phrase keeps the tokens of one address adjacent, so they cannot be
 * satisfied by two different values of a flattened array.
 */
@Component
public class VisibilityScopedQueryBuilder {
    public static final List<String> TEXT_FIELDS = List.of(
        "title^3",
        "description^2",
        "category",
        "assignee",
        "invites",
        "name",
        "slug",
        "members.name",
        "members.email",
        "teams.name"
    );

    static final String DOC_TYPE_FIELD = "docType";
    static final String TASK_OWNER_FIELD = "userEmail";
    static final String MEMBER_EMAIL_FIELD = "members.email";

    private final OpenSearchProperties properties;

    public VisibilityScopedQueryBuilder(OpenSearchProperties properties) {
        this.properties = properties;
    }

    public Map<String, Object> build(String queryText, String userEmail, int size, MappingSummary summary) {
        if (userEmail == null || userEmail.isBlank()) {
            throw new BadRequestException("userEmail_required", "userEmail is required");
        }
        Map<String, Object> bool = new LinkedHashMap<>();
        bool.put("must", List.of(textClause(queryText)));
        bool.put("filter", List.of(visibilityClause(userEmail.trim(), summary)));
        return body(bool, size);
    }

    /**
     * The same text query without the visibility filter, for diagnostics only.
     */
    public Map<String, Object> buildUnfiltered(String queryText, int size) {
        Map<String, Object> bool = new LinkedHashMap<>();
        bool.put("must", List.of(textClause(queryText)));
        return body(bool, size);
    }

    public List<String> indices() {
        return List.of(properties.getTaskIndex(), properties.getOrganizationIndex());
    }

    Map<String, Object> textClause(String queryText) {
        Map<String, Object> simpleQueryString = new LinkedHashMap<>();
        simpleQueryString.put("query", queryText.trim() + "*");
        simpleQueryString.put("fields", TEXT_FIELDS);
        simpleQueryString.put("default_operator", "and");
        simpleQueryString.put("lenient", true);
        return Map.of("simple_query_string", simpleQueryString);
    }

    Map<String, Object> visibilityClause(String userEmail, MappingSummary summary) {
        String taskIndex = properties.getTaskIndex();
        String organizationIndex = properties.getOrganizationIndex();

        Map<String, Object> ownedTasks = Map.of("bool", Map.of("filter", List.of(
            fieldEquals(summary, taskIndex, DOC_TYPE_FIELD, DocumentKind.TASK.value()),
            fieldEquals(summary, taskIndex, TASK_OWNER_FIELD, userEmail)
        )));
        Map<String, Object> memberOrganizations = Map.of("bool", Map.of("filter", List.of(
            fieldEquals(summary, organizationIndex, DOC_TYPE_FIELD, DocumentKind.ORGANIZATION.value()),
            fieldEquals(summary, organizationIndex, MEMBER_EMAIL_FIELD, userEmail)
        )));

        Map<String, Object> bool = new LinkedHashMap<>();
        bool.put("should", List.of(ownedTasks, memberOrganizations));
        bool.put("minimum_should_match", 1);
        return Map.of("bool", bool);
    }

    Map<String, Object> fieldEquals(MappingSummary summary, String index, String field, String value) {
        FieldMapping mapping = (summary == null ? MappingSummary.empty() : summary).field(index, field);
        Map<String, Object> clause;
        if (mapping.isExact()) {
            clause = Map.of("term", Map.of(mapping.getExactField(), value));
        } else {
            clause = Map.of("match_phrase", Map.of(field, Map.of("query", value)));
        }
        if (mapping.getNestedPath() != null) {
            return Map.of("nested", Map.of("path", mapping.getNestedPath(), "query", clause));
        }
        return clause;
    }

    private Map<String, Object> body(Map<String, Object> bool, int size) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", size);
        body.put("query", Map.of("bool", bool));
        return body;
    }
}
