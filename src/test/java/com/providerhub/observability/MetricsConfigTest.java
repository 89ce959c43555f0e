package com.providerhub.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetricsConfigTest {

    @Test
    void registersMetersPerProvider() {
        var config = new MetricsConfig();
        assertNotNull(config.registry());
        assertNotNull(config.providerRequests("openai", MetricsConfig.OUTCOME_SUCCESS));
        assertNotNull(config.providerLatency("openai"));
        assertNotNull(config.providerCost("openai"));
    }

    @Test
    void sameTagsReuseTheMeter() {
        var registry = new SimpleMeterRegistry();
        var config = new MetricsConfig(registry);
        config.providerRequests("groq", MetricsConfig.OUTCOME_ERROR).increment();
        config.providerRequests("groq", MetricsConfig.OUTCOME_ERROR).increment();
        config.providerRequests("groq", MetricsConfig.OUTCOME_SUCCESS).increment();

        assertEquals(2.0, registry.get("providerhub.provider.requests")
                .tag("provider", "groq").tag("outcome", "error").counter().count());
        assertEquals(1.0, config.providerRequests("groq", MetricsConfig.OUTCOME_SUCCESS).count());
    }
}
