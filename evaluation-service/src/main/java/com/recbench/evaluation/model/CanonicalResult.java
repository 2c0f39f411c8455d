package com.recbench.evaluation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed recommendations, one ranked list per returned scenario. Index 0 is the top scenario.
 */
public final class CanonicalResult {
    private final List<List<String>> perScenarioRecommendations;
    private final long processingTimeMs;
    private final Object raw;

    public CanonicalResult(List<List<String>> perScenarioRecommendations, long processingTimeMs, Object raw) {
        this.perScenarioRecommendations = immutableCopy(perScenarioRecommendations);
        this.processingTimeMs = Math.max(0L, processingTimeMs);
        this.raw = raw;
    }

    public static CanonicalResult of(List<List<String>> perScenarioRecommendations, Object raw) {
        return new CanonicalResult(perScenarioRecommendations, 0L, raw);
    }

    public static CanonicalResult singleScenario(List<String> recommendations, Object raw) {
        return of(List.of(recommendations == null ? List.of() : recommendations), raw);
    }

    public CanonicalResult withProcessingTime(long millis) {
        return new CanonicalResult(perScenarioRecommendations, millis, raw);
    }

    /**
     * Keeps the first {@code topScenarios} lists and the first {@code topRecommendationsPerScenario}
     * items of each.
     */
    public CanonicalResult truncateTo(Combination combination) {
        List<List<String>> truncated = new ArrayList<>();
        int scenarios = Math.min(combination.getTopScenarios(), perScenarioRecommendations.size());
        for (int i = 0; i < scenarios; i++) {
            List<String> list = perScenarioRecommendations.get(i);
            int items = Math.min(combination.getTopRecommendationsPerScenario(), list.size());
            truncated.add(new ArrayList<>(list.subList(0, items)));
        }
        return new CanonicalResult(truncated, processingTimeMs, raw);
    }

    public List<List<String>> getPerScenarioRecommendations() {
        return perScenarioRecommendations;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    @JsonIgnore
    public Object getRaw() {
        return raw;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return perScenarioRecommendations.stream().allMatch(List::isEmpty);
    }

    private static List<List<String>> immutableCopy(List<List<String>> source) {
        if (source == null) {
            return Collections.emptyList();
        }
        List<List<String>> copy = new ArrayList<>(source.size());
        for (List<String> list : source) {
            List<String> items = new ArrayList<>();
            if (list != null) {
                for (String item : list) {
                    if (item != null) {
                        items.add(item);
                    }
                }
            }
            copy.add(Collections.unmodifiableList(items));
        }
        return Collections.unmodifiableList(copy);
    }
}
