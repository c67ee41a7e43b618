package com.flashtasks.search.ingest;

import java.util.Locale;

public enum EventKind {
    CREATE,
    UPDATE,
    DELETE;

    /**
     * Decodes an upstream event descriptor such as {@code databases.main.collections.tasks.documents.t1.delete}.
     * Anything that is neither a delete nor a create is treated as an update.
     */
    public static EventKind fromDescriptor(String descriptor) {
        if (descriptor == null || descriptor.isBlank()) {
            return UPDATE;
        }
        String normalized = descriptor.toLowerCase(Locale.ROOT);
        if (normalized.contains("delete")) {
            return DELETE;
        }
        if (normalized.contains("create")) {
            return CREATE;
        }
        return UPDATE;
    }
}
