package com.recbench.evaluation.model;

import com.recbench.evaluation.exception.ValidationException;
import lombok.Data;

/**
 * Retrieval knobs forwarded to services that accept them.
 */
@Data
public class StrategyFlags {
    private boolean enableReranking = true;
    private boolean needLlmRecommendations = true;
    private boolean applyRuleFilter = true;
    private double similarityThreshold = 0.4;
    private int minAppropriatenessRating = 4;
    private boolean showReasoning;
    private boolean includeRawData;
    private boolean debugMode;

    public static StrategyFlags defaults() {
        return new StrategyFlags();
    }

    public void validate() {
        if (similarityThreshold < 0.1 || similarityThreshold > 0.9) {
            throw new ValidationException("similarity_threshold must be within [0.1, 0.9], got " + similarityThreshold);
        }
        if (minAppropriatenessRating < 1 || minAppropriatenessRating > 9) {
            throw new ValidationException("min_appropriateness_rating must be within [1, 9], got "
                    + minAppropriatenessRating);
        }
    }
}
