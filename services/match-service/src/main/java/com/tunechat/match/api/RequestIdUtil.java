package com.tunechat.match.api;

import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;

/** Correlation ids: echo the caller's header when present, otherwise mint a UUID. */
public final class RequestIdUtil {
    public static final String TRACE_ID_HEADER = "x-trace-id";
    public static final String REQUEST_ID_HEADER = "x-request-id";

    private RequestIdUtil() {
    }

    public static String resolveOrGenerate(String value) {
        if (value == null || value.isBlank()) {
            return UUID.randomUUID().toString();
        }
        return value.trim();
    }

    static String traceId(HttpServletRequest request) {
        return resolveOrGenerate(request.getHeader(TRACE_ID_HEADER));
    }

    static String requestId(HttpServletRequest request) {
        return resolveOrGenerate(request.getHeader(REQUEST_ID_HEADER));
    }
}
