package com.providerhub.providers;

import java.util.Iterator;

/**
 * One LLM backend. Implementations may additionally implement
 * {@link ModelLister}, {@link CostCalculator} or {@link ConfigValidator};
 * those capabilities are detected once when the provider is registered.
 */
public interface ModelProvider {
    ChatResponse chat(ChatRequest request);
    Iterator<ChatChunk> chatStream(ChatRequest request);
}
