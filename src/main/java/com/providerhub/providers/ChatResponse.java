package com.providerhub.providers;

import java.util.List;

public record ChatResponse(
    String id,
    String model,
    long created,
    String content,
    String finishReason,
    TokenUsage usage,
    List<ToolCallInfo> toolCalls
) {
    public ChatResponse {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public ChatResponse(String model, String content, TokenUsage usage) {
        this(null, model, 0L, content, "stop", usage, List.of());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
