package com.providerhub.routing;

import com.providerhub.providers.CostCalculator;
import com.providerhub.providers.ModelLister;
import com.providerhub.providers.ModelProvider;
import com.providerhub.shared.config.ProviderConfig;

import java.util.Optional;

/**
 * A live adapter with its optional capabilities resolved once, at registration.
 */
public record RegisteredProvider(
    String id,
    ModelProvider adapter,
    ProviderConfig config,
    Optional<ModelLister> modelLister,
    Optional<CostCalculator> costCalculator
) {
    public static RegisteredProvider of(String id, ModelProvider adapter, ProviderConfig config) {
        return new RegisteredProvider(id, adapter, config,
                adapter instanceof ModelLister lister ? Optional.of(lister) : Optional.empty(),
                adapter instanceof CostCalculator calc ? Optional.of(calc) : Optional.empty());
    }
}
