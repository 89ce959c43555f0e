package com.providerhub.shared.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Opaque credentials/endpoint/model bag for one provider. Read-only.
 */
public record ProviderConfig(Map<String, Object> values) {

    public ProviderConfig {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ProviderConfig empty() {
        return new ProviderConfig(Map.of());
    }

    public static ProviderConfig ofModel(String model) {
        return new ProviderConfig(Map.of("model", model));
    }

    public Object get(String key) {
        return values.get(key);
    }

    public String getString(String key) {
        var v = values.get(key);
        return v != null ? String.valueOf(v) : null;
    }

    /** The provider's default model, used when a request names none. */
    public Optional<String> model() {
        var m = getString("model");
        return m == null || m.isBlank() ? Optional.empty() : Optional.of(m);
    }

    public boolean enabled() {
        var v = values.get("enabled");
        return v == null || Boolean.parseBoolean(String.valueOf(v));
    }
}
