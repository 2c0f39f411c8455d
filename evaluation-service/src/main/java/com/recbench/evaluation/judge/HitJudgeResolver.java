package com.recbench.evaluation.judge;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class HitJudgeResolver {

    private final ExactMatchHitJudge exactMatchHitJudge = new ExactMatchHitJudge();
    private final ModelAssistedHitJudge modelAssistedHitJudge;
    private final JudgeMode defaultMode;

    public HitJudgeResolver(JudgeClient judgeClient) {
        this(judgeClient, null, "exact");
    }

    @Autowired
    public HitJudgeResolver(
            JudgeClient judgeClient,
            MeterRegistry meterRegistry,
            @Value("${evaluation.judge.mode:exact}") String defaultMode
    ) {
        this.modelAssistedHitJudge = new ModelAssistedHitJudge(judgeClient, exactMatchHitJudge, meterRegistry);
        this.defaultMode = JudgeMode.resolve(defaultMode, JudgeMode.EXACT);
    }

    public HitJudge resolve(String requestedMode) {
        JudgeMode mode = JudgeMode.resolve(requestedMode, defaultMode);
        return mode == JudgeMode.MODEL ? modelAssistedHitJudge : exactMatchHitJudge;
    }
}
