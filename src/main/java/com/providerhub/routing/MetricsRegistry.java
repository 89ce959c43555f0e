package com.providerhub.routing;

import com.providerhub.observability.MetricsConfig;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-provider request counters. All updates go through one lock;
 * entries are created on first use and live for the process.
 */
public class MetricsRegistry {

    private final Map<String, Counters> counters = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final MetricsConfig meters;

    public MetricsRegistry(MetricsConfig meters) {
        this.meters = meters;
    }

    public void recordSuccess(String provider, long latencyMs, double cost) {
        record(provider, latencyMs, true, cost);
    }

    public void recordError(String provider, long latencyMs) {
        record(provider, latencyMs, false, 0.0);
    }

    public ProviderMetricsSnapshot snapshot(String provider) {
        lock.lock();
        try {
            var c = counters.get(provider);
            return c != null ? c.snapshot() : ProviderMetricsSnapshot.EMPTY;
        } finally {
            lock.unlock();
        }
    }

    public Map<String, ProviderMetricsSnapshot> snapshotAll() {
        lock.lock();
        try {
            var result = new LinkedHashMap<String, ProviderMetricsSnapshot>();
            counters.forEach((id, c) -> result.put(id, c.snapshot()));
            return result;
        } finally {
            lock.unlock();
        }
    }

    /** Observed average latency, once the provider has completed at least one attempt. */
    public Optional<Long> observedLatencyMs(String provider) {
        var s = snapshot(provider);
        return s.requestCount() > 0 ? Optional.of(Math.round(s.averageLatencyMs())) : Optional.empty();
    }

    private void record(String provider, long latencyMs, boolean success, double cost) {
        lock.lock();
        try {
            var c = counters.computeIfAbsent(provider, k -> new Counters());
            c.requestCount++;
            if (success) c.successCount++; else c.errorCount++;
            c.totalLatencyMs += latencyMs;
            c.averageLatencyMs = (double) c.totalLatencyMs / Math.max(1, c.requestCount);
            c.totalCost += cost;
        } finally {
            lock.unlock();
        }
        meters.providerRequests(provider, success ? MetricsConfig.OUTCOME_SUCCESS : MetricsConfig.OUTCOME_ERROR)
                .increment();
        meters.providerLatency(provider).record(Duration.ofMillis(latencyMs));
        if (cost > 0) meters.providerCost(provider).record(cost);
    }

    private static final class Counters {
        long requestCount;
        long successCount;
        long errorCount;
        long totalLatencyMs;
        double averageLatencyMs;
        double totalCost;

        ProviderMetricsSnapshot snapshot() {
            return new ProviderMetricsSnapshot(requestCount, successCount, errorCount,
                    totalLatencyMs, averageLatencyMs, totalCost);
        }
    }
}
