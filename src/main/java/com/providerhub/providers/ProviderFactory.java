package com.providerhub.providers;

import com.providerhub.shared.config.ProviderConfig;

/**
 * Builds the adapter for one configured provider identity.
 */
@FunctionalInterface
public interface ProviderFactory {
    ModelProvider create(String providerId, ProviderConfig config);
}
