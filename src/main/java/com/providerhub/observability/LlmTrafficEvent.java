package com.providerhub.observability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.providerhub.providers.TokenUsage;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LlmTrafficEvent(
    String status,
    String requestId,
    String userId,
    String sessionId,
    String provider,
    String model,
    Long latencyMs,
    TokenUsage usage,
    int messageCount,
    String responseText,
    String error,
    String fallbackFrom
) {
    public static final String STARTED = "started";
    public static final String SUCCESS = "success";
    public static final String STREAM_COMPLETE = "stream_complete";
    public static final String ERROR = "error";

    public boolean terminal() {
        return !STARTED.equals(status);
    }
}
