package com.flashtasks.search.opensearch;

/**
 * A conditional write lost against a concurrent writer (HTTP 409).
 */
public class OpenSearchConflictException extends OpenSearchRequestException {
    public OpenSearchConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
