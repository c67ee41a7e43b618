package com.flashtasks.search.common;

public final class RequestContextHolder {
    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static RequestContext get() {
        return CONTEXT.get();
    }

    public static String traceId() {
        RequestContext context = CONTEXT.get();
        return context == null ? null : context.getTraceId();
    }

    public static String requestId() {
        RequestContext context = CONTEXT.get();
        return context == null ? null : context.getRequestId();
    }

    public static void clear() {
        CONTEXT.remove();
    }
}
