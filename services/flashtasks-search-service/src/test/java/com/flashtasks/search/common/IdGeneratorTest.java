package com.flashtasks.search.common;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class IdGeneratorTest {

    @Test
    void keepsIncomingRequestId() {
        assertThat(IdGenerator.resolveRequestId(" req-1 ")).isEqualTo("req-1");
        assertThat(IdGenerator.resolveRequestId(null)).startsWith("req_");
    }

    @Test
    void readsTraceIdFromTraceparent() {
        String traceparent = "00-4BF92F3577B34DA6A3CE929D0E0E4736-00f067aa0ba902b7-01";

        assertThat(IdGenerator.resolveTraceId(null, traceparent)).isEqualTo("4bf92f3577b34da6a3ce929d0e0e4736");
        assertThat(IdGenerator.resolveTraceId("trace-1", traceparent)).isEqualTo("trace-1");
        assertThat(IdGenerator.resolveTraceId(null, "garbage")).hasSize(32);
    }

    @Test
    void prefixesGeneratedIds() {
        assertThat(IdGenerator.prefixed("team")).startsWith("team_").hasSize("team_".length() + 32);
    }
}
