package com.providerhub.routing;

import com.providerhub.providers.Priority;

/**
 * Scores a (provider, model) pairing in [0, 100]. Pure: depends only on its
 * arguments and the cost ceiling fixed at construction.
 */
public class CandidateScorer {

    private static final double MAX_SCORE = 100.0;
    private static final double OVER_CEILING_PENALTY = 50.0;
    private static final double MAX_COST_PENALTY = 30.0;
    private static final double MAX_LATENCY_PENALTY = 20.0;

    private final Double costCeiling;

    public CandidateScorer(Double costCeiling) {
        this.costCeiling = costCeiling;
    }

    public double score(double cost, long latencyMs, Priority priority) {
        double costPenalty = exceedsCeiling(cost)
                ? OVER_CEILING_PENALTY
                : Math.min(MAX_COST_PENALTY, cost * 1000);
        double latencyPenalty = Math.min(MAX_LATENCY_PENALTY, latencyMs / 200.0);
        double score = MAX_SCORE - costPenalty - latencyPenalty + priorityBonus(priority);
        return Math.max(0.0, Math.min(MAX_SCORE, score));
    }

    public boolean exceedsCeiling(double cost) {
        return costCeiling != null && cost > costCeiling;
    }

    private static double priorityBonus(Priority priority) {
        if (priority == null) return 0.0;
        return switch (priority) {
            case HIGH -> 20.0;
            case MEDIUM -> 10.0;
            case LOW -> 0.0;
        };
    }
}
