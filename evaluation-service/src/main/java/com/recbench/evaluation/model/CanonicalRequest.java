package com.recbench.evaluation.model;

import java.util.Map;

/**
 * Shape-agnostic request built once per (sample, combination) pair.
 */
public final class CanonicalRequest {
    private final String scenario;
    private final Map<String, Object> patientInfo;
    private final Map<String, Object> clinicalContext;
    private final StrategyFlags strategy;
    private final Combination combination;

    private CanonicalRequest(
            String scenario,
            Map<String, Object> patientInfo,
            Map<String, Object> clinicalContext,
            StrategyFlags strategy,
            Combination combination
    ) {
        this.scenario = scenario;
        this.patientInfo = patientInfo;
        this.clinicalContext = clinicalContext;
        this.strategy = strategy;
        this.combination = combination;
    }

    public static CanonicalRequest from(Sample sample, Combination combination, StrategyFlags strategy) {
        return new CanonicalRequest(
                sample.getClinicalScenario(),
                sample.getPatientInfo(),
                sample.getClinicalContext(),
                strategy == null ? StrategyFlags.defaults() : strategy,
                combination
        );
    }

    public String getScenario() {
        return scenario;
    }

    public Map<String, Object> getPatientInfo() {
        return patientInfo;
    }

    public Map<String, Object> getClinicalContext() {
        return clinicalContext;
    }

    public StrategyFlags getStrategy() {
        return strategy;
    }

    public Combination getCombination() {
        return combination;
    }
}
