package com.recbench.evaluation.judge;

import com.recbench.evaluation.exception.JudgeException;

import java.util.List;

/**
 * External model-backed judge.
 */
public interface JudgeClient {

    /**
     * @throws JudgeException when the judge is unreachable or answers with something unusable
     */
    JudgeOutcome judge(List<String> predItems, List<String> goldItems);

    record JudgeOutcome(boolean top1Hit, boolean top3Hit) {
    }
}
