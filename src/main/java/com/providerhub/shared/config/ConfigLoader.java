package com.providerhub.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".providerhub", "config.yaml"
    );

    public static ProviderHubConfig load() {
        return load(DEFAULT_PATH);
    }

    public static ProviderHubConfig load(Path path) {
        return load(path, System.getenv());
    }

    @SuppressWarnings("unchecked")
    static ProviderHubConfig load(Path path, Map<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var section = (Map<String, Object>) raw.getOrDefault("providers", Map.of());
        var configs = (Map<String, Object>) section.getOrDefault("configs", Map.of());
        var latencies = (Map<String, Object>) section.getOrDefault("default-latencies", Map.of());

        var providerConfigs = new LinkedHashMap<String, ProviderConfig>();
        configs.forEach((id, value) -> providerConfigs.put(id,
                new ProviderConfig(value instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of())));

        var defaultLatencies = new LinkedHashMap<String, Long>();
        latencies.forEach((id, ms) -> defaultLatencies.put(id, parseLong("default-latencies." + id, ms)));

        var fallbackRaw = section.getOrDefault("fallback", List.of());
        var fallbacks = fallbackRaw instanceof List<?> list
                ? list.stream().map(String::valueOf).toList()
                : List.<String>of();

        var primary = env.getOrDefault("PROVIDERHUB_PRIMARY",
                (String) section.getOrDefault("primary", firstKey(providerConfigs)));
        var maxRetries = parseInt("max-retries", env.getOrDefault("PROVIDERHUB_MAX_RETRIES",
                String.valueOf(section.getOrDefault("max-retries", ProviderHubConfig.DEFAULT_MAX_RETRIES))));
        var retryDelayMs = parseLong("retry-delay-ms",
                section.getOrDefault("retry-delay-ms", ProviderHubConfig.DEFAULT_RETRY_DELAY.toMillis()));
        var costCeiling = section.containsKey("cost-ceiling")
                ? parseDouble("cost-ceiling", section.get("cost-ceiling"))
                : null;
        var latencyThreshold = parseLong("high-priority-latency-threshold-ms",
                section.getOrDefault("high-priority-latency-threshold-ms",
                        ProviderHubConfig.DEFAULT_HIGH_PRIORITY_LATENCY_MS));
        var ttlSeconds = parseLong("catalog-ttl-seconds",
                section.getOrDefault("catalog-ttl-seconds", ProviderHubConfig.DEFAULT_CATALOG_TTL.toSeconds()));

        return new ProviderHubConfig(
            providerConfigs,
            primary,
            fallbacks,
            maxRetries,
            Duration.ofMillis(retryDelayMs),
            costCeiling,
            latencyThreshold,
            Duration.ofSeconds(ttlSeconds),
            defaultLatencies
        );
    }

    private static String firstKey(Map<String, ?> map) {
        return map.isEmpty() ? null : map.keySet().iterator().next();
    }

    private static long parseLong(String key, Object value) {
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for providers." + key + ": " + value, e);
        }
    }

    private static int parseInt(String key, Object value) {
        try {
            return Math.toIntExact(parseLong(key, value));
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Invalid value for providers." + key + ": " + value, e);
        }
    }

    private static double parseDouble(String key, Object value) {
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for providers." + key + ": " + value, e);
        }
    }
}
