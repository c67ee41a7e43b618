package com.flashtasks.search.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Maps an inbound payload to exactly one {@link DocumentKind}.
 * <p>
 * Explicit hints win. Otherwise {@link #STRUCTURAL_RULES} are evaluated in list order and the first match wins;
 * member and organization shapes must be checked before the task rule because task fields such as
 * {@code status} also appear on nested entities. Unmatched payloads are tasks.
 */
@Component
public class DocumentTypeClassifier {

    public static final List<ClassificationRule> STRUCTURAL_RULES = List.of(
        new ClassificationRule(
            "member_fields",
            DocumentKind.ORG_MEMBER,
            payload -> PayloadFields.anyPresent(payload, "email", "role")
        ),
        new ClassificationRule(
            "organization_shape",
            DocumentKind.ORGANIZATION,
            payload -> PayloadFields.present(payload, "slug")
                || PayloadFields.nonEmptyArray(payload, "teams")
                || firstMemberIsObject(payload)
        ),
        new ClassificationRule(
            "team_shape",
            DocumentKind.TEAM,
            payload -> PayloadFields.present(payload, "name") && membersAreIdentifiers(payload)
        ),
        new ClassificationRule(
            "task_fields",
            DocumentKind.TASK,
            payload -> PayloadFields.anyPresent(payload, "title", "userEmail", "description", "status")
        )
    );

    public DocumentKind classify(JsonNode payload, List<String> hints) {
        if (hints != null) {
            for (String hint : hints) {
                DocumentKind hinted = fromHint(hint);
                if (hinted != null) {
                    return hinted;
                }
            }
        }
        for (ClassificationRule rule : STRUCTURAL_RULES) {
            if (rule.matches(payload)) {
                return rule.getKind();
            }
        }
        return DocumentKind.TASK;
    }

    /**
     * @return the hinted kind, or null when the hint names none
     */
    static DocumentKind fromHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return null;
        }
        String normalized = hint.toLowerCase(Locale.ROOT);
        if (normalized.contains("task")) {
            return DocumentKind.TASK;
        }
        if (normalized.contains("org") && normalized.contains("member")) {
            return DocumentKind.ORG_MEMBER;
        }
        if (normalized.contains("org")) {
            return DocumentKind.ORGANIZATION;
        }
        if (normalized.contains("team")) {
            return DocumentKind.TEAM;
        }
        return null;
    }

    private static boolean firstMemberIsObject(JsonNode payload) {
        return PayloadFields.nonEmptyArray(payload, "members") && payload.get("members").get(0).isObject();
    }

    private static boolean membersAreIdentifiers(JsonNode payload) {
        if (!PayloadFields.isArray(payload, "members")) {
            return false;
        }
        for (JsonNode member : payload.get("members")) {
            if (!member.isTextual()) {
                return false;
            }
        }
        return true;
    }
}
