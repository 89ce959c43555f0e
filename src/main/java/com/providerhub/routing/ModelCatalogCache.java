package com.providerhub.routing;

import com.providerhub.providers.ModelInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider model lists with a shared TTL. Two callers refreshing the
 * same stale entry at once both fetch; the later write wins.
 */
public class ModelCatalogCache {

    private static final Logger log = LoggerFactory.getLogger(ModelCatalogCache.class);

    public record Entry(List<ModelInfo> models, Instant fetchedAt) {}

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public ModelCatalogCache(Duration ttl, Clock clock) {
        if (ttl.isZero() || ttl.isNegative()) throw new IllegalArgumentException("Catalog TTL must be positive");
        this.ttl = ttl;
        this.clock = clock;
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * Models for the provider, refetched when the cached entry is missing or
     * older than the TTL. Empty when the provider has no catalog.
     * Fetch failures propagate.
     */
    public List<ModelInfo> models(RegisteredProvider provider) {
        if (provider.modelLister().isEmpty()) return List.of();
        var now = clock.instant();
        var cached = entries.get(provider.id());
        if (cached != null && isFresh(cached, now)) {
            return cached.models();
        }
        var fetched = provider.modelLister().get().listModels();
        var models = fetched == null ? List.<ModelInfo>of() : List.copyOf(fetched);
        entries.put(provider.id(), new Entry(models, clock.instant()));
        return models;
    }

    public Optional<Entry> peek(String providerId) {
        return Optional.ofNullable(entries.get(providerId));
    }

    /** Drops every entry older than the TTL; returns how many were dropped. */
    public int evictExpired() {
        var now = clock.instant();
        int removed = 0;
        for (var e : entries.entrySet()) {
            if (!isFresh(e.getValue(), now) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
                log.debug("Evicted expired model catalog for provider {}", e.getKey());
            }
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    private boolean isFresh(Entry entry, Instant now) {
        return Duration.between(entry.fetchedAt(), now).compareTo(ttl) < 0;
    }
}
