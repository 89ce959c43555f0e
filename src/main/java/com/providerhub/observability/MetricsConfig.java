package com.providerhub.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class MetricsConfig {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_ERROR = "error";

    private final MeterRegistry registry;

    public MetricsConfig() {
        this(new SimpleMeterRegistry());
    }

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter providerRequests(String provider, String outcome) {
        return Counter.builder("providerhub.provider.requests")
                .tag("provider", provider)
                .tag("outcome", outcome)
                .register(registry);
    }

    public Timer providerLatency(String provider) {
        return Timer.builder("providerhub.provider.latency")
                .tag("provider", provider)
                .register(registry);
    }

    public DistributionSummary providerCost(String provider) {
        return DistributionSummary.builder("providerhub.provider.cost")
                .baseUnit("usd")
                .tag("provider", provider)
                .register(registry);
    }
}
