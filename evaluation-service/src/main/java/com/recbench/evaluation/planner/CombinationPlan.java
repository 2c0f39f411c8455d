package com.recbench.evaluation.planner;

import com.recbench.evaluation.model.Combination;

import java.util.List;

public record CombinationPlan(List<Combination> combinations, List<String> warnings) {

    public CombinationPlan {
        combinations = List.copyOf(combinations);
        warnings = List.copyOf(warnings);
    }
}
