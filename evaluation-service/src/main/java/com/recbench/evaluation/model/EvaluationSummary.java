package com.recbench.evaluation.model;

public final class EvaluationSummary {
    private final int tested;
    private final int succeeded;
    private final int failed;
    private final double avgAccuracy;
    private final double avgLatencyMs;
    private final int totalSamples;
    private final int excludedSamples;

    public EvaluationSummary(
            int tested,
            int succeeded,
            int failed,
            double avgAccuracy,
            double avgLatencyMs,
            int totalSamples,
            int excludedSamples
    ) {
        this.tested = tested;
        this.succeeded = succeeded;
        this.failed = failed;
        this.avgAccuracy = avgAccuracy;
        this.avgLatencyMs = avgLatencyMs;
        this.totalSamples = totalSamples;
        this.excludedSamples = excludedSamples;
    }

    public int getTested() {
        return tested;
    }

    public int getSucceeded() {
        return succeeded;
    }

    public int getFailed() {
        return failed;
    }

    public double getAvgAccuracy() {
        return avgAccuracy;
    }

    public double getAvgLatencyMs() {
        return avgLatencyMs;
    }

    public int getTotalSamples() {
        return totalSamples;
    }

    public int getExcludedSamples() {
        return excludedSamples;
    }
}
