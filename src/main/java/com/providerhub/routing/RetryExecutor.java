package com.providerhub.routing;

import com.providerhub.observability.LlmTrafficLog;
import com.providerhub.providers.ChatRequest;
import com.providerhub.providers.ChatResponse;
import com.providerhub.providers.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Runs one scheduled call with up to {@code maxRetries} extra attempts,
 * sleeping {@code retryDelay * 2^attempt} between them. The last failure is
 * re-thrown unchanged. Non-retryable {@link ProviderException}s stop at once.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);
    private static final int MAX_BACKOFF_SHIFT = 30;

    private final int maxRetries;
    private final Duration retryDelay;
    private final Sleeper sleeper;
    private final LlmTrafficLog traffic;

    public RetryExecutor(int maxRetries, Duration retryDelay, Sleeper sleeper, LlmTrafficLog traffic) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (retryDelay.isNegative()) throw new IllegalArgumentException("retryDelay must not be negative");
        this.maxRetries = maxRetries;
        this.retryDelay = retryDelay;
        this.sleeper = sleeper;
        this.traffic = traffic;
    }

    public ChatResponse execute(ScheduleResult schedule, ChatRequest request) {
        var providerRequest = request.withModel(schedule.model());
        RuntimeException last = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                if (attempt == 0) {
                    traffic.started(schedule.providerId(), schedule.model(), request);
                }
                var response = schedule.adapter().chat(providerRequest);
                if (response == null) {
                    throw new ProviderException("Provider " + schedule.providerId() + " returned no response");
                }
                return response;
            } catch (RuntimeException e) {
                last = e;
                if (isNonRetryable(e)) break;
                if (attempt < maxRetries) {
                    var wait = backoff(attempt);
                    log.warn("Provider {} attempt {}/{} failed: {}; retrying in {} ms",
                            schedule.providerId(), attempt + 1, maxRetries + 1, e.getMessage(), wait.toMillis());
                    sleep(wait);
                }
            }
        }
        throw last;
    }

    public int maxRetries() {
        return maxRetries;
    }

    Duration backoff(int attempt) {
        return retryDelay.multipliedBy(1L << Math.min(attempt, MAX_BACKOFF_SHIFT));
    }

    static boolean isNonRetryable(RuntimeException e) {
        return e instanceof ProviderException pe && !pe.retryable();
    }

    private void sleep(Duration wait) {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted during retry backoff", ie);
        }
    }
}
