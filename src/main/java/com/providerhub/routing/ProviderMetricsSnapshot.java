package com.providerhub.routing;

public record ProviderMetricsSnapshot(
    long requestCount,
    long successCount,
    long errorCount,
    long totalLatencyMs,
    double averageLatencyMs,
    double totalCost
) {
    public static final ProviderMetricsSnapshot EMPTY = new ProviderMetricsSnapshot(0, 0, 0, 0, 0.0, 0.0);
}
