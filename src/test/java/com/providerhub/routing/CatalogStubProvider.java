package com.providerhub.routing;

import com.providerhub.providers.CostCalculator;
import com.providerhub.providers.ModelInfo;
import com.providerhub.providers.ModelLister;
import com.providerhub.providers.TokenUsage;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.ToDoubleBiFunction;

/** Adapter with a model catalog and a cost function. */
class CatalogStubProvider extends StubProvider implements ModelLister, CostCalculator {

    final AtomicInteger catalogFetches = new AtomicInteger();
    List<ModelInfo> models;
    boolean catalogFails;
    ToDoubleBiFunction<String, TokenUsage> pricing = (model, usage) -> 0.0;

    CatalogStubProvider(String name, String... modelIds) {
        super(name);
        this.models = Arrays.stream(modelIds).map(ModelInfo::new).toList();
    }

    CatalogStubProvider withModels(List<ModelInfo> models) {
        this.models = List.copyOf(models);
        return this;
    }

    CatalogStubProvider priced(ToDoubleBiFunction<String, TokenUsage> pricing) {
        this.pricing = pricing;
        return this;
    }

    @Override
    public List<ModelInfo> listModels() {
        catalogFetches.incrementAndGet();
        if (catalogFails) throw new RuntimeException("catalog endpoint down");
        return models;
    }

    @Override
    public double cost(String model, TokenUsage usage) {
        return pricing.applyAsDouble(model, usage);
    }
}
