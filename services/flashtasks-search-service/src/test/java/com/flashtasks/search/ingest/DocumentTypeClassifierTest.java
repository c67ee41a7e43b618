package com.flashtasks.search.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentTypeClassifierTest {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final DocumentTypeClassifier classifier = new DocumentTypeClassifier();

    @Test
    void memberFieldsWinOverTaskFields() throws Exception {
        JsonNode payload = json("{\"$id\":\"m1\",\"email\":\"a@x.com\",\"title\":\"Design review\"}");

        assertThat(classifier.classify(payload, List.of())).isEqualTo(DocumentKind.ORG_MEMBER);
    }

    @Test
    void roleAloneIsAMember() throws Exception {
        assertThat(classifier.classify(json("{\"role\":\"admin\",\"status\":\"active\"}"), List.of()))
            .isEqualTo(DocumentKind.ORG_MEMBER);
    }

    @Test
    void organizationShapeWinsOverTaskStatus() throws Exception {
        assertThat(classifier.classify(json("{\"slug\":\"acme\",\"status\":\"open\"}"), List.of()))
            .isEqualTo(DocumentKind.ORGANIZATION);
        assertThat(classifier.classify(json("{\"teams\":[{\"$id\":\"t1\"}],\"title\":\"x\"}"), List.of()))
            .isEqualTo(DocumentKind.ORGANIZATION);
        assertThat(classifier.classify(json("{\"name\":\"Acme\",\"members\":[{\"email\":\"a@x.com\"}]}"), List.of()))
            .isEqualTo(DocumentKind.ORGANIZATION);
    }

    @Test
    void namedIdentifierListIsATeam() throws Exception {
        assertThat(classifier.classify(json("{\"name\":\"Core\",\"members\":[\"m1\",\"m2\"]}"), List.of()))
            .isEqualTo(DocumentKind.TEAM);
    }

    @Test
    void mixedMemberListIsNotATeam() throws Exception {
        assertThat(classifier.classify(json("{\"name\":\"Core\",\"members\":[\"m1\",2]}"), List.of()))
            .isEqualTo(DocumentKind.TASK);
    }

    @Test
    void taskFieldsAndEmptyPayloadsAreTasks() throws Exception {
        assertThat(classifier.classify(json("{\"userEmail\":\"a@x.com\"}"), List.of())).isEqualTo(DocumentKind.TASK);
        assertThat(classifier.classify(json("{}"), List.of())).isEqualTo(DocumentKind.TASK);
        assertThat(classifier.classify(null, null)).isEqualTo(DocumentKind.TASK);
    }

    @Test
    void explicitHintsWinOverStructure() throws Exception {
        JsonNode memberShaped = json("{\"email\":\"a@x.com\"}");

        assertThat(classifier.classify(memberShaped, List.of("Tasks"))).isEqualTo(DocumentKind.TASK);
        assertThat(classifier.classify(memberShaped, List.of("organizations"))).isEqualTo(DocumentKind.ORGANIZATION);
        assertThat(classifier.classify(memberShaped, List.of("TEAMS"))).isEqualTo(DocumentKind.TEAM);
        assertThat(classifier.classify(json("{}"), List.of("org_members"))).isEqualTo(DocumentKind.ORG_MEMBER);
    }

    @Test
    void unrecognizedHintFallsThroughToStructure() throws Exception {
        assertThat(classifier.classify(json("{\"slug\":\"acme\"}"), List.of("webhook", "")))
            .isEqualTo(DocumentKind.ORGANIZATION);
    }

    @Test
    void structuralRulesRunInPriorityOrder() {
        assertThat(DocumentTypeClassifier.STRUCTURAL_RULES)
            .extracting(ClassificationRule::getName)
            .containsExactly("member_fields", "organization_shape", "team_shape", "task_fields");
    }

    private JsonNode json(String value) throws Exception {
        return OBJECT_MAPPER.readTree(value);
    }
}
