package com.flashtasks.search.service;

import com.flashtasks.search.ingest.DocumentKind;

/**
 * Which kinds an indexing endpoint accepts.
 */
public enum IndexRoute {
    TASK,
    ORGANIZATION,
    ANY;

    DocumentKind narrow(DocumentKind classified) {
        return switch (this) {
            case TASK -> DocumentKind.TASK;
            case ORGANIZATION -> classified == DocumentKind.TASK ? DocumentKind.ORGANIZATION : classified;
            case ANY -> classified;
        };
    }
}
