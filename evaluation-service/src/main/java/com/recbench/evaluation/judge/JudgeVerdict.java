package com.recbench.evaluation.judge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * @param fallback true when the model-assisted judge failed and exact matching decided instead
 */
public record JudgeVerdict(boolean hit, List<Integer> perScenarioHits, boolean fallback) {

    public JudgeVerdict {
        perScenarioHits = List.copyOf(perScenarioHits);
    }

    static JudgeVerdict fromFlags(List<Integer> perScenarioHits, boolean fallback) {
        boolean hit = perScenarioHits.stream().anyMatch(flag -> flag == 1);
        return new JudgeVerdict(hit, perScenarioHits, fallback);
    }

    static JudgeVerdict miss(int scenarios) {
        return new JudgeVerdict(false, new ArrayList<>(Collections.nCopies(scenarios, 0)), false);
    }

    JudgeVerdict asFallback() {
        return new JudgeVerdict(hit, perScenarioHits, true);
    }
}
