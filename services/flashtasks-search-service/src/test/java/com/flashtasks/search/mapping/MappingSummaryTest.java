package com.flashtasks.search.mapping;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MappingSummaryTest {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final String MAPPINGS = """
        {
          "properties": {
            "userEmail": {"type": "text", "fields": {"keyword": {"type": "keyword", "ignore_above": 256}}},
            "docType": {"type": "keyword"},
            "title": {"type": "text"},
            "slug": {"type": "text", "fields": {"raw": {"type": "keyword"}}},
            "members": {
              "type": "nested",
              "properties": {
                "email": {"type": "keyword"},
                "name": {"type": "text"}
              }
            },
            "teams": {
              "properties": {
                "name": {"type": "text", "fields": {"keyword": {"type": "keyword"}}}
              }
            }
          }
        }
        """;

    @Test
    void prefersKeywordSubField() throws Exception {
        FieldMapping mapping = MappingSummary.resolve(mappings(), "userEmail");

        assertThat(mapping.isExact()).isTrue();
        assertThat(mapping.getExactField()).isEqualTo("userEmail.keyword");
        assertThat(mapping.getNestedPath()).isNull();
    }

    @Test
    void keywordFieldIsItsOwnExactPath() throws Exception {
        assertThat(MappingSummary.resolve(mappings(), "docType").getExactField()).isEqualTo("docType");
    }

    @Test
    void acceptsOtherExactSubFieldNames() throws Exception {
        assertThat(MappingSummary.resolve(mappings(), "slug").getExactField()).isEqualTo("slug.raw");
    }

    @Test
    void recordsNestedPathForNestedParents() throws Exception {
        FieldMapping nested = MappingSummary.resolve(mappings(), "members.email");
        FieldMapping object = MappingSummary.resolve(mappings(), "teams.name");

        assertThat(nested.getExactField()).isEqualTo("members.email");
        assertThat(nested.getNestedPath()).isEqualTo("members");
        assertThat(object.getExactField()).isEqualTo("teams.name.keyword");
        assertThat(object.getNestedPath()).isNull();
    }

    @Test
    void tokenizedOrMissingFieldsAreNotExact() throws Exception {
        assertThat(MappingSummary.resolve(mappings(), "title").isExact()).isFalse();
        assertThat(MappingSummary.resolve(mappings(), "members.name").isExact()).isFalse();
        assertThat(MappingSummary.resolve(mappings(), "assignee").isExact()).isFalse();
        assertThat(MappingSummary.resolve(mappings(), "title.keyword.deeper").isExact()).isFalse();
        assertThat(MappingSummary.resolve(null, "userEmail").isExact()).isFalse();
    }

    @Test
    void unknownIndexOrFieldReadsAsUnmapped() throws Exception {
        Map<String, FieldMapping> fields = MappingSummary.summarize(mappings(), List.of("userEmail"));
        MappingSummary summary = new MappingSummary(Map.of("tasks", fields), 0L);

        assertThat(summary.hasExactSubField("tasks", "userEmail")).isTrue();
        assertThat(summary.hasExactSubField("tasks", "docType")).isFalse();
        assertThat(summary.hasExactSubField("organizations", "userEmail")).isFalse();
        assertThat(MappingSummary.empty().field("tasks", "userEmail")).isSameAs(FieldMapping.UNMAPPED);
    }

    private JsonNode mappings() throws Exception {
        return OBJECT_MAPPER.readTree(MAPPINGS);
    }
}
