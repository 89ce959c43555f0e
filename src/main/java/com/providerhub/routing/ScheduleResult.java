package com.providerhub.routing;

import com.providerhub.providers.ChatResponse;
import com.providerhub.providers.ModelProvider;

/**
 * The resolved target of one attempt. Built fresh per call.
 */
public record ScheduleResult(
    RegisteredProvider provider,
    String model,
    double estimatedCost,
    long estimatedLatencyMs
) {
    public String providerId() {
        return provider.id();
    }

    public ModelProvider adapter() {
        return provider.adapter();
    }

    /** Cost of a real response's usage, zero without usage or a cost function. */
    public double costOf(ChatResponse response) {
        if (response == null || response.usage() == null) return 0.0;
        var usedModel = response.model() != null ? response.model() : model;
        return provider.costCalculator()
                .map(calc -> calc.cost(usedModel, response.usage()))
                .orElse(0.0);
    }
}
