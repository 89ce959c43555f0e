package com.providerhub.providers;

import java.util.List;
import java.util.Map;

/**
 * A provider-neutral chat completion request. {@code provider} and
 * {@code model} are optional overrides; the correlation ids are carried
 * for logging only and never influence routing.
 */
public record ChatRequest(
    List<ChatMessage> messages,
    String provider,
    String model,
    Integer maxTokens,
    Double temperature,
    List<Map<String, Object>> tools,
    String system,
    Integer reasoningBudget,
    Priority priority,
    String requestId,
    String userId,
    String sessionId
) {
    public ChatRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        priority = priority == null ? Priority.MEDIUM : priority;
    }

    public ChatRequest(List<ChatMessage> messages) {
        this(messages, null, null, null, null, null, null, null, Priority.MEDIUM, null, null, null);
    }

    public ChatRequest(List<ChatMessage> messages, String model, Priority priority) {
        this(messages, null, model, null, null, null, null, null, priority, null, null, null);
    }

    public ChatRequest withModel(String model) {
        return new ChatRequest(messages, provider, model, maxTokens, temperature, tools,
                system, reasoningBudget, priority, requestId, userId, sessionId);
    }

    public ChatRequest withProvider(String provider) {
        return new ChatRequest(messages, provider, model, maxTokens, temperature, tools,
                system, reasoningBudget, priority, requestId, userId, sessionId);
    }

    public ChatRequest withMaxTokens(Integer maxTokens) {
        return new ChatRequest(messages, provider, model, maxTokens, temperature, tools,
                system, reasoningBudget, priority, requestId, userId, sessionId);
    }

    public ChatRequest withRequestId(String requestId) {
        return new ChatRequest(messages, provider, model, maxTokens, temperature, tools,
                system, reasoningBudget, priority, requestId, userId, sessionId);
    }

    public boolean hasImages() {
        return messages.stream().anyMatch(ChatMessage::hasImages);
    }
}
