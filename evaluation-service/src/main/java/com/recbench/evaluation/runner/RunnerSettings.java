package com.recbench.evaluation.runner;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class RunnerSettings {

    private final RunOptions baseOptions;

    public RunnerSettings(
            @Value("${evaluation.runner.concurrency-limit:5}") int concurrencyLimit,
            @Value("${evaluation.runner.max-attempts:3}") int maxAttempts,
            @Value("${evaluation.runner.backoff-ms:200}") long backoffMs,
            @Value("${evaluation.runner.call-timeout-ms:120000}") long callTimeoutMs,
            @Value("${evaluation.runner.combination-budget-ms:1800000}") long combinationBudgetMs
    ) {
        this.baseOptions = new RunOptions(concurrencyLimit, maxAttempts, backoffMs, callTimeoutMs,
                combinationBudgetMs, null, null);
    }

    public RunOptions baseOptions() {
        return baseOptions;
    }
}
