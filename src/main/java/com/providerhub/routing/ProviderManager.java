package com.providerhub.routing;

import com.providerhub.observability.LlmTrafficLog;
import com.providerhub.observability.MetricsConfig;
import com.providerhub.providers.ChatChunk;
import com.providerhub.providers.ChatRequest;
import com.providerhub.providers.ChatResponse;
import com.providerhub.providers.ConfigValidator;
import com.providerhub.providers.ConfigurationException;
import com.providerhub.providers.ModelInfo;
import com.providerhub.providers.Priority;
import com.providerhub.providers.ProviderException;
import com.providerhub.providers.ProviderFactory;
import com.providerhub.shared.config.ProviderHubConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for the application layer. Owns the live providers, routes
 * each request to the default provider (or, via {@link #chatBest}, to the
 * best-scored candidate), retries, fails over, and keeps per-provider
 * metrics. The provider set is fixed by {@link #initialize()}; build a new
 * manager to change it.
 */
public class ProviderManager implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(ProviderManager.class);
    static final String STREAM_ERROR_MESSAGE = "ERROR: An unexpected error occurred. Please try again.";
    private static final long SHUTDOWN_WAIT_SECONDS = 5;

    private final ProviderHubConfig config;
    private final Map<String, ProviderFactory> factories;
    private final ProviderRegistry registry = new ProviderRegistry();
    private final ModelCatalogCache catalog;
    private final MetricsRegistry metrics;
    private final CandidateScorer scorer;
    private final Scheduler scheduler;
    private final RetryExecutor retry;
    private final FailoverCoordinator failover;
    private final LlmTrafficLog traffic;
    private final Clock clock;

    private volatile String defaultProvider;
    private boolean initialized;
    private ScheduledExecutorService evictionExecutor;

    public ProviderManager(ProviderHubConfig config, Map<String, ProviderFactory> factories) {
        this(config, factories, new MetricsConfig(), new LlmTrafficLog(), Sleeper.THREAD, Clock.systemUTC());
    }

    public ProviderManager(ProviderHubConfig config, Map<String, ProviderFactory> factories,
                           MetricsConfig meters, LlmTrafficLog traffic, Sleeper sleeper, Clock clock) {
        this.config = config;
        this.factories = new LinkedHashMap<>(factories);
        this.traffic = traffic;
        this.clock = clock;
        this.defaultProvider = config.primaryProvider();
        this.catalog = new ModelCatalogCache(config.catalogTtl(), clock);
        this.metrics = new MetricsRegistry(meters);
        this.scorer = new CandidateScorer(config.costCeiling());
        this.scheduler = new Scheduler(registry, catalog, metrics, scorer, config);
        this.retry = new RetryExecutor(config.maxRetries(), config.retryDelay(), sleeper, traffic);
        this.failover = new FailoverCoordinator(registry, scheduler, metrics,
                config.fallbackProviders(), clock::millis);
    }

    public synchronized void initialize() {
        if (initialized) throw new IllegalStateException("Provider manager already initialized");
        initialized = true;
        log.info("Initializing providers: registry={}",
                factories.isEmpty() ? "none" : String.join(",", factories.keySet().stream().sorted().toList()));

        var allowed = config.providers().isEmpty() ? null : config.providers().keySet();
        if (allowed != null) {
            allowed.stream()
                    .filter(id -> !factories.containsKey(id))
                    .forEach(id -> log.warn("No adapter factory for configured provider {}", id));
        }

        for (var entry : factories.entrySet()) {
            var id = entry.getKey();
            if (allowed != null && !allowed.contains(id)) {
                log.debug("Skipping provider {} (not in active config)", id);
                continue;
            }
            try {
                var providerConfig = config.providerConfig(id);
                if (!providerConfig.enabled()) {
                    log.warn("Failed to initialize {}: [disabled by config]", id);
                    continue;
                }
                var adapter = entry.getValue().create(id, providerConfig);
                if (adapter == null) {
                    log.warn("Failed to initialize {}: factory returned no adapter", id);
                    continue;
                }
                if (adapter instanceof ConfigValidator validator) {
                    var validation = validator.validate(providerConfig);
                    if (!validation.valid()) {
                        log.warn("Failed to initialize {}: {}", id, validation.errors());
                        continue;
                    }
                }
                var provider = RegisteredProvider.of(id, adapter, providerConfig);
                prefetchCatalog(provider);
                registry.register(provider);
                log.info("Initialized provider: {}", id);
            } catch (RuntimeException e) {
                log.error("Error initializing provider {}", id, e);
            }
        }

        if (!registry.isEmpty() && !registry.contains(defaultProvider)) {
            var replacement = registry.ids().get(0);
            log.warn("Default provider {} is not initialized; falling back to {}", defaultProvider, replacement);
            defaultProvider = replacement;
        }

        startCatalogEviction();
    }

    public ScheduleResult schedule(ChatRequest request) {
        var providerId = request.provider() != null ? request.provider() : defaultProvider;
        if (providerId == null) {
            throw new ConfigurationException("No default provider configured. Available providers: "
                    + registry.describeAvailable());
        }
        return scheduler.scheduleForProvider(providerId, request);
    }

    public ChatResponse chat(ChatRequest request) {
        return execute(schedule(request), request);
    }

    /** Discovery mode: scores every live provider's models and runs the best pick. */
    public ChatResponse chatBest(ChatRequest request) {
        return execute(scheduleBest(request), request);
    }

    public ScheduleResult scheduleBest(ChatRequest request) {
        return scheduler.selectBest(request, defaultProvider);
    }

    public List<Candidate> discover(ChatRequest request) {
        return scheduler.discover(request);
    }

    /**
     * Streams from the scheduled provider. Scheduling errors are thrown here;
     * the returned iterator itself never throws and always ends with a chunk.
     */
    public Iterator<ChatChunk> chatStream(ChatRequest request) {
        return new ManagedStream(schedule(request), request);
    }

    public double score(double cost, long latencyMs, Priority priority) {
        return scorer.score(cost, latencyMs, priority);
    }

    public long estimatedLatency(String providerId) {
        return scheduler.estimatedLatencyMs(providerId);
    }

    public List<ModelInfo> listModels(String providerId) {
        var provider = registry.get(providerId).orElseThrow(() -> new ConfigurationException(
                "Provider " + providerId + " is not initialized. Available providers: "
                        + registry.describeAvailable()));
        return catalog.models(provider);
    }

    public ProviderMetricsSnapshot metrics(String providerId) {
        return metrics.snapshot(providerId);
    }

    public Map<String, ProviderMetricsSnapshot> allMetrics() {
        return metrics.snapshotAll();
    }

    public List<String> providers() {
        return registry.ids();
    }

    public String defaultProvider() {
        return defaultProvider;
    }

    ModelCatalogCache catalog() {
        return catalog;
    }

    public synchronized void shutdown() {
        if (evictionExecutor == null) return;
        evictionExecutor.shutdownNow();
        try {
            if (!evictionExecutor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Catalog eviction task did not stop within {}s", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        evictionExecutor = null;
    }

    @Override
    public void close() {
        shutdown();
    }

    private ChatResponse execute(ScheduleResult schedule, ChatRequest request) {
        long start = clock.millis();
        ChatResponse response;
        try {
            response = retry.execute(schedule, request);
        } catch (RuntimeException e) {
            metrics.recordError(schedule.providerId(), clock.millis() - start);
            return handleFailure(e, request, schedule, start).response();
        }
        long latency = clock.millis() - start;
        metrics.recordSuccess(schedule.providerId(), latency, schedule.costOf(response));
        traffic.success(schedule.providerId(), schedule.model(), request, response, latency, null);
        return response;
    }

    private RoutedResponse handleFailure(RuntimeException error, ChatRequest request,
                                         ScheduleResult schedule, long start) {
        log.warn("Request failed with {} ({}): {}", schedule.providerId(), schedule.model(), error.getMessage());
        try {
            if (RetryExecutor.isNonRetryable(error)) throw error;
            var routed = failover.recover(error, request, schedule.providerId());
            traffic.success(routed.schedule().providerId(), routed.schedule().model(), request,
                    routed.response(), clock.millis() - start, schedule.providerId());
            return routed;
        } catch (RuntimeException finalError) {
            traffic.error(schedule.providerId(), schedule.model(), request, clock.millis() - start, finalError);
            throw finalError;
        }
    }

    private void prefetchCatalog(RegisteredProvider provider) {
        if (provider.modelLister().isEmpty()) return;
        try {
            catalog.models(provider);
        } catch (RuntimeException e) {
            log.debug("Model prefetch failed for {}: {}", provider.id(), e.getMessage());
        }
    }

    private void startCatalogEviction() {
        long periodMs = Math.max(1, catalog.ttl().toMillis() / 2);
        evictionExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "catalog-eviction");
            t.setDaemon(true);
            return t;
        });
        evictionExecutor.scheduleWithFixedDelay(this::sweepCatalog, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    void sweepCatalog() {
        try {
            int removed = catalog.evictExpired();
            if (removed > 0) log.debug("Evicted {} expired model catalog entries", removed);
        } catch (RuntimeException e) {
            log.error("Error in catalog eviction loop", e);
        }
    }

    /**
     * Proxies the adapter's chunks. On failure the failover response is
     * replayed as a content chunk plus a terminator, or, if that fails too,
     * a single error chunk.
     */
    private final class ManagedStream implements Iterator<ChatChunk> {

        private final ScheduleResult schedule;
        private final ChatRequest request;
        private final Deque<ChatChunk> pending = new ArrayDeque<>();
        private final StringBuilder text = new StringBuilder();
        private Iterator<ChatChunk> source;
        private long start;
        private boolean done;

        ManagedStream(ScheduleResult schedule, ChatRequest request) {
            this.schedule = schedule;
            this.request = request;
        }

        @Override
        public boolean hasNext() {
            if (!pending.isEmpty()) return true;
            if (done) return false;
            try {
                if (source == null) {
                    start = clock.millis();
                    traffic.started(schedule.providerId(), schedule.model(), request);
                    source = schedule.adapter().chatStream(request.withModel(schedule.model()));
                    if (source == null) throw new ProviderException("Provider returned no stream");
                }
                if (source.hasNext()) {
                    var chunk = source.next();
                    if (chunk == null) throw new ProviderException("Provider returned an empty chunk");
                    if (chunk.content() != null) text.append(chunk.content());
                    pending.add(chunk);
                    return true;
                }
                done = true;
                long latency = clock.millis() - start;
                metrics.recordSuccess(schedule.providerId(), latency, 0.0);
                traffic.streamComplete(schedule.providerId(), schedule.model(), request, latency, text.toString());
                return false;
            } catch (RuntimeException e) {
                done = true;
                metrics.recordError(schedule.providerId(), clock.millis() - start);
                pending.addAll(recoverChunks(e));
                return true;
            }
        }

        @Override
        public ChatChunk next() {
            if (!hasNext()) throw new NoSuchElementException();
            return pending.poll();
        }

        private List<ChatChunk> recoverChunks(RuntimeException error) {
            log.warn("Stream failed with {} ({}): {}", schedule.providerId(), schedule.model(), error.getMessage());
            try {
                var response = handleFailure(error, request, schedule, start).response();
                var content = response.content() != null ? response.content() : "";
                var finish = response.finishReason() != null ? response.finishReason() : "stop";
                return List.of(
                        ChatChunk.delta(response.id(), response.model(), response.created(), content),
                        ChatChunk.finish(response.id(), response.model(), response.created(), finish));
            } catch (RuntimeException finalError) {
                long now = clock.instant().getEpochSecond();
                return List.of(new ChatChunk("error-" + now, schedule.model(), now,
                        STREAM_ERROR_MESSAGE, ChatChunk.FINISH_ERROR));
            }
        }
    }
}
