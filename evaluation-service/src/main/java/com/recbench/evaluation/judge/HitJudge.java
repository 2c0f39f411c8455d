package com.recbench.evaluation.judge;

import java.util.List;

/**
 * Decides whether a standard answer is present in per-scenario recommendation lists.
 */
public interface HitJudge {

    JudgeVerdict judge(List<List<String>> recommendations, String standardAnswer);
}
