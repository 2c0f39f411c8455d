package com.recbench.evaluation.model;

import java.util.List;

public final class EvaluationDetail {
    private final String clinicalScenario;
    private final String standardAnswer;
    private final List<List<String>> recommendations;
    private final List<Integer> perScenarioHits;
    private final boolean hit;
    private final long processingTimeMs;
    private final boolean judgeFallback;

    public EvaluationDetail(
            String clinicalScenario,
            String standardAnswer,
            List<List<String>> recommendations,
            List<Integer> perScenarioHits,
            boolean hit,
            long processingTimeMs,
            boolean judgeFallback
    ) {
        this.clinicalScenario = clinicalScenario;
        this.standardAnswer = standardAnswer;
        this.recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        this.perScenarioHits = perScenarioHits == null ? List.of() : List.copyOf(perScenarioHits);
        this.hit = hit;
        this.processingTimeMs = processingTimeMs;
        this.judgeFallback = judgeFallback;
    }

    public String getClinicalScenario() {
        return clinicalScenario;
    }

    public String getStandardAnswer() {
        return standardAnswer;
    }

    public List<List<String>> getRecommendations() {
        return recommendations;
    }

    public List<Integer> getPerScenarioHits() {
        return perScenarioHits;
    }

    public boolean isHit() {
        return hit;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public boolean isJudgeFallback() {
        return judgeFallback;
    }
}
