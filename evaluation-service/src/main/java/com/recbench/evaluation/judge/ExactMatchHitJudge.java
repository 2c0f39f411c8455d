package com.recbench.evaluation.judge;

import java.util.ArrayList;
import java.util.List;

/**
 * Case- and whitespace-insensitive string equality against the standard answer.
 */
public class ExactMatchHitJudge implements HitJudge {

    @Override
    public JudgeVerdict judge(List<List<String>> recommendations, String standardAnswer) {
        int scenarios = recommendations == null ? 0 : recommendations.size();
        List<String> accepted = StandardAnswers.acceptedAnswers(standardAnswer);
        if (accepted.isEmpty() || StandardAnswers.isEmpty(recommendations)) {
            return JudgeVerdict.miss(scenarios);
        }

        List<Integer> flags = new ArrayList<>(scenarios);
        for (List<String> list : recommendations) {
            flags.add(containsAnswer(list, accepted) ? 1 : 0);
        }
        return JudgeVerdict.fromFlags(flags, false);
    }

    private static boolean containsAnswer(List<String> list, List<String> accepted) {
        if (list == null) {
            return false;
        }
        for (String item : list) {
            if (accepted.contains(StandardAnswers.normalize(item))) {
                return true;
            }
        }
        return false;
    }
}
