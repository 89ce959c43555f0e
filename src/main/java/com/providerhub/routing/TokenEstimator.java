package com.providerhub.routing;

import com.providerhub.providers.ChatMessage;
import com.providerhub.providers.ChatRequest;
import com.providerhub.providers.TokenUsage;

import java.util.List;

/**
 * Pre-flight usage estimate: four characters per prompt token, and the
 * request's max tokens (or 1000) for the completion.
 */
public final class TokenEstimator {

    static final int DEFAULT_COMPLETION_TOKENS = 1000;

    private TokenEstimator() {}

    public static int estimateTokens(List<ChatMessage> messages) {
        long chars = 0;
        for (var msg : messages) {
            chars += msg.text().length();
        }
        return (int) (chars / 4);
    }

    public static TokenUsage estimateUsage(ChatRequest request) {
        int completion = request.maxTokens() != null ? request.maxTokens() : DEFAULT_COMPLETION_TOKENS;
        return TokenUsage.of(estimateTokens(request.messages()), completion);
    }
}
