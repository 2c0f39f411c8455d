package com.recbench.evaluation.judge;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks the external judge once per scenario list. A single-item list is scored on the top-1
 * verdict, longer lists on top-3. Any judge failure falls back to exact matching for the whole
 * sample and marks the verdict.
 */
public class ModelAssistedHitJudge implements HitJudge {
    private static final Logger log = LoggerFactory.getLogger(ModelAssistedHitJudge.class);

    private final JudgeClient judgeClient;
    private final ExactMatchHitJudge fallback;
    private final MeterRegistry meterRegistry;

    public ModelAssistedHitJudge(JudgeClient judgeClient, ExactMatchHitJudge fallback, MeterRegistry meterRegistry) {
        this.judgeClient = judgeClient;
        this.fallback = fallback;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public JudgeVerdict judge(List<List<String>> recommendations, String standardAnswer) {
        int scenarios = recommendations == null ? 0 : recommendations.size();
        List<String> gold = StandardAnswers.normalizedAlternatives(standardAnswer);
        if (gold.isEmpty() || StandardAnswers.isEmpty(recommendations)) {
            return JudgeVerdict.miss(scenarios);
        }

        List<Integer> flags = new ArrayList<>(scenarios);
        try {
            for (List<String> list : recommendations) {
                if (list == null || list.isEmpty()) {
                    flags.add(0);
                    continue;
                }
                List<String> predicted = new ArrayList<>(list.size());
                for (String item : list) {
                    predicted.add(StandardAnswers.normalize(item));
                }
                JudgeClient.JudgeOutcome outcome = judgeClient.judge(predicted, gold);
                boolean scenarioHit = predicted.size() == 1 ? outcome.top1Hit() : outcome.top3Hit();
                flags.add(scenarioHit ? 1 : 0);
            }
        } catch (RuntimeException ex) {
            log.warn("event=judge_fallback reason=\"{}\"", ex.getMessage());
            if (meterRegistry != null) {
                meterRegistry.counter("evaluation_judge_fallback_total").increment();
            }
            return fallback.judge(recommendations, standardAnswer).asFallback();
        }
        return JudgeVerdict.fromFlags(flags, false);
    }
}
