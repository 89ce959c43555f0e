package com.providerhub.providers;

/** Unresolvable provider or model. Never retried. */
public class ConfigurationException extends ProviderException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
