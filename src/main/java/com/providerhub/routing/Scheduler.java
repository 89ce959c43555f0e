package com.providerhub.routing;

import com.providerhub.providers.ChatRequest;
import com.providerhub.providers.ConfigurationException;
import com.providerhub.providers.ModelInfo;
import com.providerhub.providers.ModelUnavailableException;
import com.providerhub.providers.Priority;
import com.providerhub.shared.config.ProviderHubConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Resolves a request to a concrete (provider, model) pair, either for a named
 * provider or, in discovery mode, by scoring every live provider's models.
 */
public class Scheduler {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ProviderRegistry registry;
    private final ModelCatalogCache catalog;
    private final MetricsRegistry metrics;
    private final CandidateScorer scorer;
    private final ProviderHubConfig config;

    public Scheduler(ProviderRegistry registry, ModelCatalogCache catalog, MetricsRegistry metrics,
                     CandidateScorer scorer, ProviderHubConfig config) {
        this.registry = registry;
        this.catalog = catalog;
        this.metrics = metrics;
        this.scorer = scorer;
        this.config = config;
    }

    public ScheduleResult scheduleForProvider(String providerId, ChatRequest request) {
        var provider = registry.get(providerId).orElseThrow(() -> new ConfigurationException(
                "Provider " + providerId + " is not initialized. Available providers: "
                        + registry.describeAvailable()));

        var model = resolveModel(provider, request);
        ensureModelAvailable(provider, model);

        return new ScheduleResult(provider, model,
                estimateCost(provider, model, request),
                estimatedLatencyMs(provider.id()));
    }

    /** All scored candidates, best first; equal scores keep registration order. */
    public List<Candidate> discover(ChatRequest request) {
        var candidates = new ArrayList<Candidate>();
        for (var provider : registry.all()) {
            if (request.provider() != null && !request.provider().equals(provider.id())) continue;
            try {
                for (var model : suitableModels(provider, request)) {
                    if (request.model() != null && !request.model().equals(model.id())) continue;
                    var cost = estimateCost(provider, model.id(), request);
                    var latency = estimatedLatencyMs(provider.id());
                    candidates.add(new Candidate(provider, model.id(), cost, latency,
                            scorer.score(cost, latency, request.priority())));
                }
            } catch (RuntimeException e) {
                log.warn("Failed to get models from {}: {}", provider.id(), e.getMessage());
            }
        }
        candidates.sort(Comparator.comparingDouble(Candidate::score).reversed());
        return candidates;
    }

    /**
     * Picks from {@link #discover}: the requested model's best candidate, else the
     * default provider's best candidate when acceptable, else the top score.
     */
    public ScheduleResult selectBest(ChatRequest request, String defaultProvider) {
        var candidates = discover(request);
        if (candidates.isEmpty()) {
            throw new ConfigurationException("No suitable providers or models found for the request");
        }
        if (request.model() == null) {
            var preferred = candidates.stream()
                    .filter(c -> c.providerId().equals(defaultProvider))
                    .findFirst();
            if (preferred.isPresent() && isAcceptable(preferred.get(), request)) {
                return preferred.get().toSchedule();
            }
        }
        return candidates.get(0).toSchedule();
    }

    public boolean isAcceptable(Candidate candidate, ChatRequest request) {
        if (scorer.exceedsCeiling(candidate.estimatedCost())) return false;
        return !(request.priority() == Priority.HIGH
                && candidate.estimatedLatencyMs() > config.highPriorityLatencyThresholdMs());
    }

    /** Observed rolling average once the provider has a completed attempt, else the static table. */
    public long estimatedLatencyMs(String providerId) {
        return metrics.observedLatencyMs(providerId).orElse(config.defaultLatencyMs(providerId));
    }

    double estimateCost(RegisteredProvider provider, String model, ChatRequest request) {
        return provider.costCalculator()
                .map(calc -> calc.cost(model, TokenEstimator.estimateUsage(request)))
                .orElse(0.0);
    }

    private String resolveModel(RegisteredProvider provider, ChatRequest request) {
        if (request.model() != null && !request.model().isBlank()) return request.model();
        return provider.config().model().orElseThrow(() -> new ConfigurationException(
                "Model must be specified in request or provider config for " + provider.id()));
    }

    private void ensureModelAvailable(RegisteredProvider provider, String model) {
        if (provider.modelLister().isEmpty()) return;
        List<ModelInfo> models;
        try {
            models = catalog.models(provider);
        } catch (RuntimeException e) {
            log.warn("Failed to fetch models for {}: {}", provider.id(), e.getMessage());
            return;
        }
        if (models.isEmpty()) return;
        var ids = models.stream().map(ModelInfo::id).collect(Collectors.toSet());
        if (!ids.contains(model)) {
            throw new ModelUnavailableException(provider.id(), model);
        }
    }

    private List<ModelInfo> suitableModels(RegisteredProvider provider, ChatRequest request) {
        boolean multimodal = request.hasImages();
        if (provider.modelLister().isEmpty()) {
            // no catalog: only the configured model, capabilities unknown
            if (multimodal) return List.of();
            return provider.config().model().map(m -> List.of(new ModelInfo(m))).orElse(List.of());
        }
        var models = catalog.models(provider);
        if (!multimodal) return models;
        return models.stream().filter(ModelInfo::supportsImages).toList();
    }
}
