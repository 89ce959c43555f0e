package com.providerhub.providers;

@FunctionalInterface
public interface CostCalculator {
    /** Cost in USD for the given usage on {@code model}. */
    double cost(String model, TokenUsage usage);
}
