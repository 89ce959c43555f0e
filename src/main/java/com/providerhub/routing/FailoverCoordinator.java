package com.providerhub.routing;

import com.providerhub.providers.ChatRequest;
import com.providerhub.providers.FailoverExhaustedException;
import com.providerhub.providers.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Walks the configured fallback list in order after the primary's retries
 * are exhausted. One attempt per fallback, no nested retries.
 */
public class FailoverCoordinator {

    private static final Logger log = LoggerFactory.getLogger(FailoverCoordinator.class);

    private final ProviderRegistry registry;
    private final Scheduler scheduler;
    private final MetricsRegistry metrics;
    private final List<String> fallbackProviders;
    private final LongSupplier clockMs;

    public FailoverCoordinator(ProviderRegistry registry, Scheduler scheduler, MetricsRegistry metrics,
                               List<String> fallbackProviders, LongSupplier clockMs) {
        this.registry = registry;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.fallbackProviders = List.copyOf(fallbackProviders);
        this.clockMs = clockMs;
    }

    /**
     * Returns the first fallback success. Re-throws {@code failure} unchanged
     * when no fallback could be attempted.
     *
     * @throws FailoverExhaustedException when every attempted fallback failed
     */
    public RoutedResponse recover(RuntimeException failure, ChatRequest request, String failedProvider) {
        var fallbackFailures = new ArrayList<RuntimeException>();
        // the fallback may not carry the pinned model
        var unpinned = request.withModel(null).withProvider(null);

        for (var fallback : fallbackProviders) {
            if (fallback.equals(failedProvider)) continue;
            if (!registry.contains(fallback)) {
                log.debug("Fallback provider {} is not initialized, skipping", fallback);
                continue;
            }
            ScheduleResult schedule = null;
            long start = clockMs.getAsLong();
            try {
                schedule = scheduler.scheduleForProvider(fallback, unpinned);
                var response = schedule.adapter().chat(unpinned.withModel(schedule.model()));
                if (response == null) throw new ProviderException("Provider " + fallback + " returned no response");
                long latency = clockMs.getAsLong() - start;
                metrics.recordSuccess(fallback, latency, schedule.costOf(response));
                log.info("Recovered via fallback provider={} model={} after {} failed",
                        fallback, schedule.model(), failedProvider);
                return new RoutedResponse(schedule, response, latency);
            } catch (RuntimeException e) {
                if (schedule != null) {
                    metrics.recordError(fallback, clockMs.getAsLong() - start);
                }
                log.warn("Fallback provider {} failed: {}", fallback, e.getMessage());
                fallbackFailures.add(e);
            }
        }

        if (fallbackFailures.isEmpty()) throw failure;
        throw new FailoverExhaustedException(failure, fallbackFailures);
    }
}
