package com.flashtasks.search.ingest;

import com.fasterxml.jackson.databind.JsonNode;

final class PayloadFields {
    private PayloadFields() {
    }

    static boolean present(JsonNode payload, String field) {
        JsonNode value = payload == null ? null : payload.get(field);
        return value != null && !value.isNull() && !value.isMissingNode();
    }

    static boolean anyPresent(JsonNode payload, String... fields) {
        for (String field : fields) {
            if (present(payload, field)) {
                return true;
            }
        }
        return false;
    }

    static boolean nonEmptyArray(JsonNode payload, String field) {
        JsonNode value = payload == null ? null : payload.get(field);
        return value != null && value.isArray() && value.size() > 0;
    }

    static boolean isArray(JsonNode payload, String field) {
        JsonNode value = payload == null ? null : payload.get(field);
        return value != null && value.isArray();
    }

    /**
     * Non-blank text of the first field present, or null.
     */
    static String firstText(JsonNode payload, String... fields) {
        if (payload == null) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = payload.get(field);
            if (value != null && value.isValueNode() && !value.isNull()) {
                String text = value.asText();
                if (!text.isBlank()) {
                    return text.trim();
                }
            }
        }
        return null;
    }
}
