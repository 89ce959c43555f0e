package com.providerhub.providers;

import com.providerhub.shared.config.ProviderConfig;

@FunctionalInterface
public interface ConfigValidator {
    ValidationResult validate(ProviderConfig config);
}
