package com.recbench.evaluation.judge;

import com.recbench.evaluation.exception.JudgeException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ModelAssistedHitJudgeTest {

    @Test
    void usesTopOneVerdictForSingleItemLists() {
        JudgeClient client = mock(JudgeClient.class);
        when(client.judge(eq(List.of("胸片")), anyList())).thenReturn(new JudgeClient.JudgeOutcome(true, false));
        ModelAssistedHitJudge judge = new ModelAssistedHitJudge(client, new ExactMatchHitJudge(), null);

        JudgeVerdict verdict = judge.judge(List.of(List.of("胸片")), "胸部X线");

        assertThat(verdict.hit()).isTrue();
        assertThat(verdict.perScenarioHits()).containsExactly(1);
        assertThat(verdict.fallback()).isFalse();
    }

    @Test
    void usesTopThreeVerdictForLongerLists() {
        JudgeClient client = mock(JudgeClient.class);
        when(client.judge(anyList(), anyList()))
                .thenReturn(new JudgeClient.JudgeOutcome(false, false))
                .thenReturn(new JudgeClient.JudgeOutcome(false, true));
        ModelAssistedHitJudge judge = new ModelAssistedHitJudge(client, new ExactMatchHitJudge(), null);

        JudgeVerdict verdict = judge.judge(List.of(List.of("a", "b"), List.of("c", "d")), "x");

        assertThat(verdict.perScenarioHits()).containsExactly(0, 1);
        assertThat(verdict.hit()).isTrue();
        verify(client, times(2)).judge(anyList(), eq(List.of("x")));
    }

    @Test
    void fallsBackToExactMatchWhenJudgeFails() {
        JudgeClient client = mock(JudgeClient.class);
        when(client.judge(anyList(), anyList())).thenThrow(new JudgeException("judge down"));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ModelAssistedHitJudge judge = new ModelAssistedHitJudge(client, new ExactMatchHitJudge(), registry);

        JudgeVerdict verdict = judge.judge(List.of(List.of("CT", "心电图")), "心电图");

        assertThat(verdict.hit()).isTrue();
        assertThat(verdict.fallback()).isTrue();
        assertThat(registry.counter("evaluation_judge_fallback_total").count()).isEqualTo(1.0);
    }

    @Test
    void skipsJudgeCallForEmptyInputs() {
        JudgeClient client = mock(JudgeClient.class);
        ModelAssistedHitJudge judge = new ModelAssistedHitJudge(client, new ExactMatchHitJudge(), null);

        assertThat(judge.judge(List.of(List.of()), "心电图").hit()).isFalse();
        assertThat(judge.judge(List.of(List.of("心电图")), "").hit()).isFalse();
        verifyNoInteractions(client);
    }

    @Test
    void resolverHonoursRequestedAndDefaultModes() {
        HitJudgeResolver resolver = new HitJudgeResolver(mock(JudgeClient.class), null, "exact");

        assertThat(resolver.resolve(null)).isInstanceOf(ExactMatchHitJudge.class);
        assertThat(resolver.resolve("model")).isInstanceOf(ModelAssistedHitJudge.class);
        assertThat(resolver.resolve("unknown")).isInstanceOf(ExactMatchHitJudge.class);
    }
}
