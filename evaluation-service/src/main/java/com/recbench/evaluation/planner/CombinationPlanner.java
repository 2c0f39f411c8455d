package com.recbench.evaluation.planner;

import com.recbench.evaluation.config.TargetServiceProperties;
import com.recbench.evaluation.exception.ValidationException;
import com.recbench.evaluation.model.Combination;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives the combinations to run for one service: the default grid, an optional user variant,
 * minus anything the service's scenario cap forbids.
 */
@Component
public class CombinationPlanner {

    static final List<Combination> DEFAULT_COMBINATIONS = List.of(
            new Combination(1, 1, "combination_a"),
            new Combination(1, 3, "combination_b"),
            new Combination(3, 1, "combination_c"),
            new Combination(3, 3, "combination_d")
    );

    private final TargetServiceProperties targets;

    public CombinationPlanner(TargetServiceProperties targets) {
        this.targets = targets == null ? new TargetServiceProperties() : targets;
    }

    public CombinationPlan plan(Combination userCombination, String serviceId) {
        Set<Combination> planned = new LinkedHashSet<>(DEFAULT_COMBINATIONS);
        if (userCombination != null) {
            validate(userCombination);
            Combination variant = userCombination.withLabel(variantLabel(userCombination));
            // a user combination equal to a default keeps the default label
            planned.add(variant);
        }

        Integer cap = targets.find(serviceId)
                .map(TargetServiceProperties.Target::getMaxTopScenarios)
                .orElse(null);
        List<Combination> accepted = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (Combination combination : planned) {
            if (cap != null && combination.getTopScenarios() > cap) {
                warnings.add(String.format(
                        "combination %s skipped: service %s accepts at most %d scenarios",
                        combination.getLabel(), serviceId, cap));
                continue;
            }
            accepted.add(combination);
        }
        return new CombinationPlan(accepted, warnings);
    }

    public static void validate(Combination combination) {
        if (combination.getTopScenarios() < 1) {
            throw new ValidationException("top_scenarios must be >= 1, got " + combination.getTopScenarios());
        }
        if (combination.getTopRecommendationsPerScenario() < 1) {
            throw new ValidationException("top_recommendations_per_scenario must be >= 1, got "
                    + combination.getTopRecommendationsPerScenario());
        }
    }

    private static String variantLabel(Combination combination) {
        String label = combination.getLabel();
        boolean reserved = DEFAULT_COMBINATIONS.stream().anyMatch(c -> c.getLabel().equals(label));
        if (label != null && !label.isBlank() && !reserved) {
            return label;
        }
        return "variant_s" + combination.getTopScenarios() + "_r" + combination.getTopRecommendationsPerScenario();
    }
}
