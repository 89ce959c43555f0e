package com.providerhub.routing;

public record Candidate(
    RegisteredProvider provider,
    String model,
    double estimatedCost,
    long estimatedLatencyMs,
    double score
) {
    public String providerId() {
        return provider.id();
    }

    public ScheduleResult toSchedule() {
        return new ScheduleResult(provider, model, estimatedCost, estimatedLatencyMs);
    }
}
