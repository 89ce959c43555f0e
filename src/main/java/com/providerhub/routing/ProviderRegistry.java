package com.providerhub.routing;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Live providers in registration order. Populated during initialization
 * only; read-only afterwards.
 */
public class ProviderRegistry {

    private final Map<String, RegisteredProvider> providers = new LinkedHashMap<>();

    public void register(RegisteredProvider provider) {
        if (providers.containsKey(provider.id())) {
            throw new IllegalArgumentException("Duplicate provider: " + provider.id());
        }
        providers.put(provider.id(), provider);
    }

    public Optional<RegisteredProvider> get(String id) {
        return Optional.ofNullable(id != null ? providers.get(id) : null);
    }

    public boolean contains(String id) {
        return id != null && providers.containsKey(id);
    }

    public Collection<RegisteredProvider> all() {
        return Collections.unmodifiableCollection(providers.values());
    }

    public List<String> ids() {
        return List.copyOf(providers.keySet());
    }

    public boolean isEmpty() {
        return providers.isEmpty();
    }

    /** Sorted ids for error messages, or "none". */
    public String describeAvailable() {
        if (providers.isEmpty()) return "none";
        return String.join(", ", providers.keySet().stream().sorted().toList());
    }
}
