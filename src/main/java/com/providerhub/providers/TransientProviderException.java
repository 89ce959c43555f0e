package com.providerhub.providers;

/** Network, timeout or rate-limit failure reported by an adapter. */
public class TransientProviderException extends ProviderException {

    public TransientProviderException(String message) {
        super(message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
