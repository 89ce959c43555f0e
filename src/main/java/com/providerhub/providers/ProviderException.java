package com.providerhub.providers;

/**
 * Base of the routing error taxonomy. Only retryable failures are retried
 * and handed to failover; the others surface to the caller unchanged.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean retryable() {
        return false;
    }
}
