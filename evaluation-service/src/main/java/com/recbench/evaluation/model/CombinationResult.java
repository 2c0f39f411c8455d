package com.recbench.evaluation.model;

import java.util.List;

/**
 * Outcome of one combination against one service. Counts and averages cover evaluated samples
 * only; samples dropped after exhausting retries are reported in {@code failedSamples}.
 */
public final class CombinationResult {
    private final Combination combination;
    private final double accuracy;
    private final int totalSamples;
    private final int hitSamples;
    private final int failedSamples;
    private final double averageProcessingTimeMs;
    private final int judgeFallbacks;
    private final List<EvaluationDetail> details;

    public CombinationResult(
            Combination combination,
            int totalSamples,
            int hitSamples,
            int failedSamples,
            double averageProcessingTimeMs,
            int judgeFallbacks,
            List<EvaluationDetail> details
    ) {
        this.combination = combination;
        this.totalSamples = totalSamples;
        this.hitSamples = hitSamples;
        this.failedSamples = failedSamples;
        this.accuracy = totalSamples > 0 ? (double) hitSamples / totalSamples : 0.0;
        this.averageProcessingTimeMs = averageProcessingTimeMs;
        this.judgeFallbacks = judgeFallbacks;
        this.details = details == null ? List.of() : List.copyOf(details);
    }

    public Combination getCombination() {
        return combination;
    }

    public String getLabel() {
        return combination.getLabel();
    }

    public double getAccuracy() {
        return accuracy;
    }

    public int getTotalSamples() {
        return totalSamples;
    }

    public int getHitSamples() {
        return hitSamples;
    }

    public int getFailedSamples() {
        return failedSamples;
    }

    public double getAverageProcessingTimeMs() {
        return averageProcessingTimeMs;
    }

    public int getJudgeFallbacks() {
        return judgeFallbacks;
    }

    public List<EvaluationDetail> getDetails() {
        return details;
    }
}
