package com.providerhub.shared.config;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ProviderHubConfig(
    Map<String, ProviderConfig> providers,
    String primaryProvider,
    List<String> fallbackProviders,
    int maxRetries,
    Duration retryDelay,
    Double costCeiling,
    long highPriorityLatencyThresholdMs,
    Duration catalogTtl,
    Map<String, Long> defaultLatencies
) {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);
    public static final long DEFAULT_HIGH_PRIORITY_LATENCY_MS = 5000;
    public static final Duration DEFAULT_CATALOG_TTL = Duration.ofSeconds(600);
    public static final long UNKNOWN_PROVIDER_LATENCY_MS = 3000;

    // ms, used until a provider has completed a real attempt
    public static final Map<String, Long> BUILTIN_LATENCIES = Map.of(
            "openai", 2500L,
            "openai-compatible", 2500L,
            "groq", 2000L,
            "zhipu", 2500L,
            "anthropic", 2000L,
            "openrouter", 3000L,
            "ollama", 500L
    );

    public ProviderHubConfig {
        providers = providers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(providers));
        fallbackProviders = fallbackProviders == null ? List.of() : List.copyOf(fallbackProviders);
        if (maxRetries < 0) throw new IllegalArgumentException("max-retries must be >= 0");
        retryDelay = retryDelay == null ? DEFAULT_RETRY_DELAY : retryDelay;
        if (retryDelay.isNegative()) throw new IllegalArgumentException("retry-delay must be >= 0");
        catalogTtl = catalogTtl == null ? DEFAULT_CATALOG_TTL : catalogTtl;
        var latencies = new LinkedHashMap<>(BUILTIN_LATENCIES);
        if (defaultLatencies != null) latencies.putAll(defaultLatencies);
        defaultLatencies = Collections.unmodifiableMap(latencies);
    }

    public static ProviderHubConfig defaults(String primaryProvider, Map<String, ProviderConfig> providers) {
        return new ProviderHubConfig(providers, primaryProvider, List.of(), DEFAULT_MAX_RETRIES,
                DEFAULT_RETRY_DELAY, null, DEFAULT_HIGH_PRIORITY_LATENCY_MS, DEFAULT_CATALOG_TTL, Map.of());
    }

    public ProviderHubConfig withFallbacks(List<String> fallbacks) {
        return new ProviderHubConfig(providers, primaryProvider, fallbacks, maxRetries, retryDelay,
                costCeiling, highPriorityLatencyThresholdMs, catalogTtl, defaultLatencies);
    }

    public ProviderHubConfig withRetry(int maxRetries, Duration retryDelay) {
        return new ProviderHubConfig(providers, primaryProvider, fallbackProviders, maxRetries, retryDelay,
                costCeiling, highPriorityLatencyThresholdMs, catalogTtl, defaultLatencies);
    }

    public ProviderHubConfig withCostCeiling(Double costCeiling) {
        return new ProviderHubConfig(providers, primaryProvider, fallbackProviders, maxRetries, retryDelay,
                costCeiling, highPriorityLatencyThresholdMs, catalogTtl, defaultLatencies);
    }

    public ProviderHubConfig withCatalogTtl(Duration catalogTtl) {
        return new ProviderHubConfig(providers, primaryProvider, fallbackProviders, maxRetries, retryDelay,
                costCeiling, highPriorityLatencyThresholdMs, catalogTtl, defaultLatencies);
    }

    public ProviderConfig providerConfig(String providerId) {
        return providers.getOrDefault(providerId, ProviderConfig.empty());
    }

    public long defaultLatencyMs(String providerId) {
        return defaultLatencies.getOrDefault(providerId, UNKNOWN_PROVIDER_LATENCY_MS);
    }
}
