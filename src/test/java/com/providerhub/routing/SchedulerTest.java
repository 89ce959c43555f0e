package com.providerhub.routing;

import com.providerhub.observability.MetricsConfig;
import com.providerhub.providers.ChatMessage;
import com.providerhub.providers.ChatRequest;
import com.providerhub.providers.ConfigurationException;
import com.providerhub.providers.ContentPart;
import com.providerhub.providers.ModelInfo;
import com.providerhub.providers.ModelUnavailableException;
import com.providerhub.providers.Priority;
import com.providerhub.shared.config.ProviderConfig;
import com.providerhub.shared.config.ProviderHubConfig;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    private final ProviderRegistry registry = new ProviderRegistry();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final MetricsRegistry metrics = new MetricsRegistry(new MetricsConfig());

    private Scheduler scheduler(ProviderHubConfig config) {
        return new Scheduler(registry, new ModelCatalogCache(config.catalogTtl(), clock), metrics,
                new CandidateScorer(config.costCeiling()), config);
    }

    private Scheduler scheduler() {
        return scheduler(ProviderHubConfig.defaults("openai", Map.of()));
    }

    private void register(String id, StubProvider adapter, ProviderConfig config) {
        registry.register(RegisteredProvider.of(id, adapter, config));
    }

    private static ChatRequest req() {
        return new ChatRequest(List.of(ChatMessage.user("hello there")));
    }

    @Test
    void requestModelWinsOverConfiguredModel() {
        register("openai", new StubProvider("openai"), ProviderConfig.ofModel("gpt-4o-mini"));

        var result = scheduler().scheduleForProvider("openai", req().withModel("gpt-4o"));

        assertEquals("gpt-4o", result.model());
        assertEquals("openai", result.providerId());
    }

    @Test
    void fallsBackToConfiguredModel() {
        register("openai", new StubProvider("openai"), ProviderConfig.ofModel("gpt-4o-mini"));

        assertEquals("gpt-4o-mini", scheduler().scheduleForProvider("openai", req()).model());
    }

    @Test
    void unknownProviderListsAvailableOnes() {
        register("groq", new StubProvider("groq"), ProviderConfig.ofModel("m"));
        register("anthropic", new StubProvider("anthropic"), ProviderConfig.ofModel("m"));

        var e = assertThrows(ConfigurationException.class,
                () -> scheduler().scheduleForProvider("openai", req()));

        assertEquals("Provider openai is not initialized. Available providers: anthropic, groq", e.getMessage());
    }

    @Test
    void missingModelIsConfigurationError() {
        register("openai", new StubProvider("openai"), ProviderConfig.empty());

        var e = assertThrows(ConfigurationException.class,
                () -> scheduler().scheduleForProvider("openai", req()));

        assertThat(e.getMessage()).contains("Model must be specified").contains("openai");
    }

    @Test
    void modelMissingFromCatalogIsRejected() {
        register("openai", new CatalogStubProvider("openai", "gpt-4o"), ProviderConfig.empty());

        var e = assertThrows(ModelUnavailableException.class,
                () -> scheduler().scheduleForProvider("openai", req().withModel("gpt-5")));

        assertEquals("gpt-5", e.model());
        assertEquals("Model gpt-5 is not available for provider openai", e.getMessage());
    }

    @Test
    void catalogFailureTrustsTheModel() {
        var adapter = new CatalogStubProvider("openai", "gpt-4o");
        adapter.catalogFails = true;
        register("openai", adapter, ProviderConfig.empty());

        assertEquals("anything", scheduler().scheduleForProvider("openai", req().withModel("anything")).model());
    }

    @Test
    void emptyCatalogTrustsTheModel() {
        register("openai", new CatalogStubProvider("openai"), ProviderConfig.empty());

        assertEquals("x", scheduler().scheduleForProvider("openai", req().withModel("x")).model());
    }

    @Test
    void estimatesCostFromCostFunction() {
        var adapter = new CatalogStubProvider("openai", "gpt-4o")
                .priced((model, usage) -> usage.totalTokens() * 0.000001);
        register("openai", adapter, ProviderConfig.empty());

        var result = scheduler().scheduleForProvider("openai", req().withModel("gpt-4o").withMaxTokens(100));

        // "hello there" is 11 chars -> 2 prompt tokens
        assertEquals(102 * 0.000001, result.estimatedCost(), 1e-12);
    }

    @Test
    void costIsZeroWithoutCostFunction() {
        register("openai", new StubProvider("openai"), ProviderConfig.ofModel("m"));

        assertEquals(0.0, scheduler().scheduleForProvider("openai", req()).estimatedCost());
    }

    @Test
    void latencyUsesStaticTableUntilObserved() {
        var s = scheduler();

        assertEquals(2500, s.estimatedLatencyMs("openai"));
        assertEquals(500, s.estimatedLatencyMs("ollama"));
        assertEquals(3000, s.estimatedLatencyMs("unheard-of"));

        metrics.recordSuccess("openai", 800, 0.0);
        metrics.recordSuccess("openai", 1200, 0.0);
        assertEquals(1000, s.estimatedLatencyMs("openai"));
    }

    @Test
    void discoverRanksByScoreAndKeepsRegistrationOrderOnTies() {
        register("slow", new CatalogStubProvider("slow", "a"), ProviderConfig.empty());
        register("tie1", new CatalogStubProvider("tie1", "b"), ProviderConfig.empty());
        register("tie2", new CatalogStubProvider("tie2", "c"), ProviderConfig.empty());
        metrics.recordSuccess("slow", 4000, 0.0);
        metrics.recordSuccess("tie1", 200, 0.0);
        metrics.recordSuccess("tie2", 200, 0.0);

        var candidates = scheduler().discover(req());

        assertEquals(List.of("tie1", "tie2", "slow"), candidates.stream().map(Candidate::providerId).toList());
        assertTrue(candidates.get(0).score() >= candidates.get(2).score());
    }

    @Test
    void discoverSkipsProvidersWhoseCatalogFails() {
        var broken = new CatalogStubProvider("broken", "m");
        broken.catalogFails = true;
        register("broken", broken, ProviderConfig.empty());
        register("ok", new CatalogStubProvider("ok", "m"), ProviderConfig.empty());

        var candidates = scheduler().discover(req());

        assertEquals(1, candidates.size());
        assertEquals("ok", candidates.get(0).providerId());
    }

    @Test
    void discoverHonoursProviderAndModelFilters() {
        register("p1", new CatalogStubProvider("p1", "a", "b"), ProviderConfig.empty());
        register("p2", new CatalogStubProvider("p2", "a"), ProviderConfig.empty());

        assertEquals(2, scheduler().discover(req().withProvider("p1")).size());
        var onlyA = scheduler().discover(req().withModel("a"));
        assertEquals(2, onlyA.size());
        assertTrue(onlyA.stream().allMatch(c -> c.model().equals("a")));
    }

    @Test
    void imagesRequireVisionModels() {
        register("vision", new CatalogStubProvider("vision").withModels(List.of(
                new ModelInfo("text-only"),
                new ModelInfo("eyes", "Eyes", 128_000, true))), ProviderConfig.empty());
        register("plain", new StubProvider("plain"), ProviderConfig.ofModel("m"));
        var request = new ChatRequest(List.of(new ChatMessage("user",
                List.of(ContentPart.text("what is this?"), ContentPart.image("https://x/cat.png")), null)));

        var candidates = scheduler().discover(request);

        assertEquals(1, candidates.size());
        assertEquals("eyes", candidates.get(0).model());
    }

    @Test
    void providerWithoutCatalogOffersConfiguredModel() {
        register("plain", new StubProvider("plain"), ProviderConfig.ofModel("m"));

        var candidates = scheduler().discover(req());

        assertEquals(1, candidates.size());
        assertEquals("m", candidates.get(0).model());
    }

    @Test
    void selectBestPrefersAcceptableDefault() {
        register("fast", new CatalogStubProvider("fast", "f"), ProviderConfig.empty());
        register("home", new CatalogStubProvider("home", "h"), ProviderConfig.empty());
        metrics.recordSuccess("fast", 100, 0.0);
        metrics.recordSuccess("home", 3000, 0.0);

        var picked = scheduler().selectBest(req(), "home");

        assertEquals("home", picked.providerId());
    }

    @Test
    void selectBestSkipsSlowDefaultForHighPriority() {
        register("fast", new CatalogStubProvider("fast", "f"), ProviderConfig.empty());
        register("home", new CatalogStubProvider("home", "h"), ProviderConfig.empty());
        metrics.recordSuccess("fast", 100, 0.0);
        metrics.recordSuccess("home", 6000, 0.0);
        var urgent = new ChatRequest(List.of(ChatMessage.user("now")), null, Priority.HIGH);

        assertEquals("fast", scheduler().selectBest(urgent, "home").providerId());
    }

    @Test
    void selectBestSkipsDefaultOverCostCeiling() {
        register("cheap", new CatalogStubProvider("cheap", "c"), ProviderConfig.empty());
        register("home", new CatalogStubProvider("home", "h").priced((m, u) -> 1.0), ProviderConfig.empty());
        var config = ProviderHubConfig.defaults("home", Map.of()).withCostCeiling(0.5);

        assertEquals("cheap", scheduler(config).selectBest(req(), "home").providerId());
    }

    @Test
    void selectBestWithoutCandidatesFails() {
        var e = assertThrows(ConfigurationException.class, () -> scheduler().selectBest(req(), "openai"));
        assertEquals("No suitable providers or models found for the request", e.getMessage());
    }
}
