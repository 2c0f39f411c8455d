package com.recbench.evaluation.runner;

import com.recbench.evaluation.model.StrategyFlags;

/**
 * Knobs for one combination run. Non-positive values are clamped to sane minimums.
 */
public record RunOptions(
        int concurrencyLimit,
        int maxAttempts,
        long backoffMs,
        long callTimeoutMs,
        long combinationBudgetMs,
        StrategyFlags strategy,
        CancellationToken cancellation
) {

    public RunOptions {
        concurrencyLimit = Math.max(1, concurrencyLimit);
        maxAttempts = Math.max(1, maxAttempts);
        backoffMs = Math.max(0L, backoffMs);
        callTimeoutMs = Math.max(50L, callTimeoutMs);
        combinationBudgetMs = Math.max(callTimeoutMs, combinationBudgetMs);
        strategy = strategy == null ? StrategyFlags.defaults() : strategy;
        cancellation = cancellation == null ? CancellationToken.none() : cancellation;
    }

    public static RunOptions defaults() {
        return new RunOptions(5, 3, 200L, 120_000L, 1_800_000L, null, null);
    }

    public RunOptions withStrategy(StrategyFlags newStrategy) {
        return new RunOptions(concurrencyLimit, maxAttempts, backoffMs, callTimeoutMs, combinationBudgetMs,
                newStrategy, cancellation);
    }

    public RunOptions withCancellation(CancellationToken token) {
        return new RunOptions(concurrencyLimit, maxAttempts, backoffMs, callTimeoutMs, combinationBudgetMs,
                strategy, token);
    }
}
