package com.recbench.evaluation.judge;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExactMatchHitJudgeTest {

    private final ExactMatchHitJudge judge = new ExactMatchHitJudge();

    @Test
    void singleChoiceHitsOnlyOnEquality() {
        JudgeVerdict hit = judge.judge(List.of(List.of("心电图")), "心电图");
        JudgeVerdict miss = judge.judge(List.of(List.of("胸部CT")), "心电图");

        assertThat(hit.hit()).isTrue();
        assertThat(hit.perScenarioHits()).containsExactly(1);
        assertThat(miss.hit()).isFalse();
        assertThat(miss.perScenarioHits()).containsExactly(0);
    }

    @Test
    void flagsEveryScenarioContainingTheAnswer() {
        JudgeVerdict verdict = judge.judge(List.of(
                List.of("胸部CT", "血常规", "肌钙蛋白"),
                List.of("心脏超声", "心电图", "胸片"),
                List.of("冠脉造影", "D-二聚体", "血气分析")
        ), "心电图");

        assertThat(verdict.hit()).isTrue();
        assertThat(verdict.perScenarioHits()).containsExactly(0, 1, 0);
        assertThat(verdict.fallback()).isFalse();
    }

    @Test
    void ignoresCaseAndSurroundingWhitespace() {
        JudgeVerdict verdict = judge.judge(List.of(List.of("  MRI Brain ")), "mri brain");

        assertThat(verdict.hit()).isTrue();
    }

    @Test
    void acceptsAnyListedAlternative() {
        JudgeVerdict verdict = judge.judge(List.of(List.of("头颅MRI")), "头颅CT；头颅MRI*");

        assertThat(verdict.hit()).isTrue();
    }

    @Test
    void wholeAnswerWithSeparatorsOrMarkersStillHits() {
        assertThat(judge.judge(List.of(List.of("CT, contrast")), "CT, contrast").hit()).isTrue();
        assertThat(judge.judge(List.of(List.of("MRI*")), "MRI*").hit()).isTrue();
        assertThat(judge.judge(List.of(List.of("mri")), "MRI*").hit()).isTrue();
        assertThat(judge.judge(List.of(List.of("contrast")), "CT, contrast").hit()).isTrue();
    }

    @Test
    void acceptedAnswersListWholeAnswerFirst() {
        assertThat(StandardAnswers.acceptedAnswers(" CT, Contrast ")).containsExactly("ct, contrast", "ct", "contrast");
        assertThat(StandardAnswers.acceptedAnswers("心电图")).containsExactly("心电图");
        assertThat(StandardAnswers.acceptedAnswers("  ")).isEmpty();
    }

    @Test
    void emptyRecommendationsOrAnswerNeverHit() {
        assertThat(judge.judge(List.of(List.of()), "心电图").hit()).isFalse();
        assertThat(judge.judge(List.of(), "心电图").perScenarioHits()).isEmpty();
        assertThat(judge.judge(List.of(List.of("心电图")), "  ").hit()).isFalse();
    }

    @Test
    void splitsStandardAnswerOnMixedSeparators() {
        assertThat(StandardAnswers.alternatives("A、B，C")).containsExactly("A", "B", "C");
        assertThat(StandardAnswers.alternatives("A, B; C")).containsExactly("A, B", "C");
        assertThat(StandardAnswers.alternatives("*超声*")).containsExactly("超声");
        assertThat(StandardAnswers.alternatives(null)).isEmpty();
    }
}
