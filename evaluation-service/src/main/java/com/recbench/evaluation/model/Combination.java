package com.recbench.evaluation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How much a service is asked to return. Equality ignores the label.
 */
public final class Combination {
    private final int topScenarios;
    private final int topRecommendationsPerScenario;
    private final String label;

    @JsonCreator
    public Combination(
            @JsonProperty("top_scenarios") int topScenarios,
            @JsonProperty("top_recommendations_per_scenario") int topRecommendationsPerScenario,
            @JsonProperty("label") String label
    ) {
        this.topScenarios = topScenarios;
        this.topRecommendationsPerScenario = topRecommendationsPerScenario;
        this.label = label;
    }

    public static Combination of(int topScenarios, int topRecommendationsPerScenario) {
        return new Combination(topScenarios, topRecommendationsPerScenario, null);
    }

    public Combination withLabel(String newLabel) {
        return new Combination(topScenarios, topRecommendationsPerScenario, newLabel);
    }

    public int getTopScenarios() {
        return topScenarios;
    }

    public int getTopRecommendationsPerScenario() {
        return topRecommendationsPerScenario;
    }

    public String getLabel() {
        return label;
    }

    public boolean isSingleChoice() {
        return topScenarios == 1 && topRecommendationsPerScenario == 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Combination other)) {
            return false;
        }
        return topScenarios == other.topScenarios
                && topRecommendationsPerScenario == other.topRecommendationsPerScenario;
    }

    @Override
    public int hashCode() {
        return 31 * topScenarios + topRecommendationsPerScenario;
    }

    @Override
    public String toString() {
        return "(" + topScenarios + "," + topRecommendationsPerScenario + ")"
                + (label == null ? "" : " " + label);
    }
}
