package com.flashtasks.search.common;

public class RequestContext {
    private final String requestId;
    private final String traceId;
    private final long startedAtNs;

    public RequestContext(String requestId, String traceId, long startedAtNs) {
        this.requestId = requestId;
        this.traceId = traceId;
        this.startedAtNs = startedAtNs;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getTraceId() {
        return traceId;
    }

    public long getStartedAtNs() {
        return startedAtNs;
    }
}
