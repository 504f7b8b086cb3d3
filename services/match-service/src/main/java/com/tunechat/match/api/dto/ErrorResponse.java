package com.tunechat.match.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body shared by every endpoint: {@code {"error":{"code","message"},"trace_id","request_id"}}.
 */
public record ErrorResponse(
    ErrorDetail error,
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("request_id") String requestId
) {
    public ErrorResponse(String code, String message, String traceId, String requestId) {
        this(new ErrorDetail(code, message), traceId, requestId);
    }

    public record ErrorDetail(String code, String message) {
    }
}
