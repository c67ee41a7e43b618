package com.flashtasks.search.common;

import java.util.Locale;
import java.util.UUID;

public final class IdGenerator {
    private IdGenerator() {
    }

    public static String resolveRequestId(String headerValue) {
        if (headerValue != null && !headerValue.isBlank()) {
            return headerValue.trim();
        }
        return "req_" + compactUuid();
    }

    public static String resolveTraceId(String headerValue, String traceparent) {
        if (headerValue != null && !headerValue.isBlank()) {
            return headerValue.trim();
        }
        String fromTraceparent = extractTraceId(traceparent);
        return fromTraceparent != null ? fromTraceparent : compactUuid();
    }

    public static String prefixed(String prefix) {
        return prefix + "_" + compactUuid();
    }

    private static String extractTraceId(String traceparent) {
        if (traceparent == null || traceparent.isBlank()) {
            return null;
        }
        String[] parts = traceparent.trim().split("-");
        if (parts.length != 4 || parts[1].length() != 32) {
            return null;
        }
        return parts[1].toLowerCase(Locale.ROOT);
    }

    private static String compactUuid() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
