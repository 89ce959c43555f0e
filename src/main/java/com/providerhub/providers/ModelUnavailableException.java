package com.providerhub.providers;

public class ModelUnavailableException extends ProviderException {

    private final String provider;
    private final String model;

    public ModelUnavailableException(String provider, String model) {
        super("Model " + model + " is not available for provider " + provider);
        this.provider = provider;
        this.model = model;
    }

    public String provider() {
        return provider;
    }

    public String model() {
        return model;
    }
}
