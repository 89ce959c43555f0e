package com.providerhub.providers;

import java.util.List;

/**
 * Every configured fallback was attempted and failed. The cause is the
 * primary provider's failure; each fallback failure is attached as a
 * suppressed exception, in attempt order.
 */
public class FailoverExhaustedException extends ProviderException {

    private final RuntimeException lastFallbackFailure;

    public FailoverExhaustedException(RuntimeException original, List<RuntimeException> fallbackFailures) {
        super("All fallback providers failed: " + last(fallbackFailures).getMessage(), original);
        fallbackFailures.forEach(this::addSuppressed);
        this.lastFallbackFailure = last(fallbackFailures);
    }

    public RuntimeException lastFallbackFailure() {
        return lastFallbackFailure;
    }

    private static RuntimeException last(List<RuntimeException> failures) {
        if (failures.isEmpty()) throw new IllegalArgumentException("No fallback failures");
        return failures.get(failures.size() - 1);
    }
}
