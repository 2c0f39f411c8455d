package com.recbench.evaluation.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.recbench.evaluation.adapter.AdapterException;
import com.recbench.evaluation.adapter.StreamingItemAdapter;
import com.recbench.evaluation.judge.ExactMatchHitJudge;
import com.recbench.evaluation.model.Combination;
import com.recbench.evaluation.model.CombinationResult;
import com.recbench.evaluation.model.EvaluationDetail;
import com.recbench.evaluation.model.Sample;
import com.recbench.evaluation.model.SampleSet;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CombinationRunnerTest {

    private static RunOptions options(int concurrency, int attempts, long callTimeoutMs, long budgetMs) {
        return new RunOptions(concurrency, attempts, 1L, callTimeoutMs, budgetMs, null, null);
    }

    private static SampleSet samples(int count) {
        List<Sample> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(new Sample("s" + i, "answer-" + i));
        }
        return SampleSet.of(rows);
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void detailsKeepInputOrderAndAccuracyCountsHits() {
        ScriptedAdapter adapter = ScriptedAdapter.answering("svc", scenario -> {
            pause(ThreadLocalRandom.current().nextLong(1, 30));
            int index = Integer.parseInt(scenario.substring(1));
            return List.of(List.of(index % 2 == 0 ? "answer-" + index : "other"));
        });

        CombinationResult result = new CombinationRunner().run(
                samples(10), Combination.of(1, 1).withLabel("combination_a"), adapter, new ExactMatchHitJudge(),
                options(3, 3, 2000L, 60_000L));

        assertThat(result.getDetails()).extracting(EvaluationDetail::getClinicalScenario)
                .containsExactly("s0", "s1", "s2", "s3", "s4", "s5", "s6", "s7", "s8", "s9");
        assertThat(result.getTotalSamples()).isEqualTo(10);
        assertThat(result.getHitSamples()).isEqualTo(5);
        assertThat(result.getAccuracy()).isEqualTo(0.5);
        assertThat(result.getFailedSamples()).isZero();
        assertThat(adapter.maxInFlight()).isLessThanOrEqualTo(3);
    }

    @Test
    void transientFailuresAreRetried() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ScriptedAdapter adapter = new ScriptedAdapter("svc", (request, attempt) -> {
            if (attempt < 3) {
                throw AdapterException.transientFailure("connection refused", null);
            }
            return List.of(List.of("answer-0"));
        });

        CombinationResult result = new CombinationRunner(registry).run(
                samples(1), Combination.of(1, 1), adapter, new ExactMatchHitJudge(), options(2, 3, 2000L, 60_000L));

        assertThat(result.getHitSamples()).isEqualTo(1);
        assertThat(adapter.attemptsFor("s0")).isEqualTo(3);
        assertThat(registry.counter("evaluation_sample_retry_total").count()).isEqualTo(2.0);
        assertThat(registry.counter("evaluation_sample_hit_total").count()).isEqualTo(1.0);
    }

    @Test
    void repeatedTimeoutsExcludeTheSample() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ScriptedAdapter adapter = ScriptedAdapter.answering("svc", scenario -> {
            if (scenario.equals("s1")) {
                pause(1_000L);
            }
            return List.of(List.of("answer-" + scenario.substring(1)));
        });

        CombinationResult result = new CombinationRunner(registry).run(
                samples(3), Combination.of(1, 1), adapter, new ExactMatchHitJudge(), options(3, 3, 60L, 60_000L));

        assertThat(adapter.attemptsFor("s1")).isEqualTo(3);
        assertThat(result.getTotalSamples()).isEqualTo(2);
        assertThat(result.getHitSamples()).isEqualTo(2);
        assertThat(result.getFailedSamples()).isEqualTo(1);
        assertThat(result.getAccuracy()).isEqualTo(1.0);
        assertThat(result.getDetails()).extracting(EvaluationDetail::getClinicalScenario).containsExactly("s0", "s2");
        assertThat(registry.counter("evaluation_sample_failed_total").count()).isEqualTo(1.0);
        assertThat(registry.counter("evaluation_sample_retry_total").count()).isEqualTo(2.0);
    }

    @Test
    void permanentFailuresAreNotRetried() {
        ScriptedAdapter adapter = new ScriptedAdapter("svc", (request, attempt) -> {
            throw AdapterException.permanent("malformed body from svc");
        });

        CombinationResult result = new CombinationRunner().run(
                samples(2), Combination.of(1, 1), adapter, new ExactMatchHitJudge(), options(2, 3, 2000L, 60_000L));

        assertThat(adapter.calls()).isEqualTo(2);
        assertThat(result.getTotalSamples()).isZero();
        assertThat(result.getFailedSamples()).isEqualTo(2);
        assertThat(result.getAccuracy()).isZero();
    }

    @Test
    void resultsAreTruncatedToTheCombinationBeforeJudging() {
        ScriptedAdapter adapter = ScriptedAdapter.answering("svc", scenario -> List.of(
                List.of("x", "answer-0", "y", "z"),
                List.of("answer-0"),
                List.of("q")));

        CombinationResult single = new CombinationRunner().run(
                samples(1), Combination.of(1, 1), adapter, new ExactMatchHitJudge(), options(1, 1, 2000L, 60_000L));
        CombinationResult wide = new CombinationRunner().run(
                samples(1), Combination.of(3, 3), adapter, new ExactMatchHitJudge(), options(1, 1, 2000L, 60_000L));

        assertThat(single.getDetails().get(0).getRecommendations()).containsExactly(List.of("x"));
        assertThat(single.getHitSamples()).isZero();
        assertThat(wide.getDetails().get(0).getRecommendations())
                .containsExactly(List.of("x", "answer-0", "y"), List.of("answer-0"), List.of("q"));
        assertThat(wide.getDetails().get(0).getPerScenarioHits()).containsExactly(1, 1, 0);
    }

    @Test
    void emptyResponsesCountAsMisses() {
        ScriptedAdapter adapter = ScriptedAdapter.answering("svc", scenario -> List.of());

        CombinationResult result = new CombinationRunner().run(
                samples(2), Combination.of(3, 3), adapter, new ExactMatchHitJudge(), options(2, 1, 2000L, 60_000L));

        assertThat(result.getTotalSamples()).isEqualTo(2);
        assertThat(result.getHitSamples()).isZero();
    }

    @Test
    void cancelledRunDispatchesNoCalls() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        ScriptedAdapter adapter = ScriptedAdapter.answering("svc", scenario -> List.of(List.of("answer-0")));

        CombinationResult result = new CombinationRunner().run(
                samples(4), Combination.of(1, 1), adapter, new ExactMatchHitJudge(),
                options(2, 1, 2000L, 60_000L).withCancellation(token));

        assertThat(adapter.calls()).isZero();
        assertThat(result.getFailedSamples()).isEqualTo(4);
    }

    @Test
    void combinationBudgetCutsOffRemainingSamples() {
        ScriptedAdapter adapter = ScriptedAdapter.answering("svc", scenario -> {
            pause(300L);
            return List.of(List.of("answer-" + scenario.substring(1)));
        });
        long start = System.currentTimeMillis();

        CombinationResult result = new CombinationRunner().run(
                samples(8), Combination.of(1, 1), adapter, new ExactMatchHitJudge(), options(1, 1, 1000L, 1000L));

        assertThat(System.currentTimeMillis() - start).isLessThan(2_000L);
        assertThat(result.getFailedSamples()).isGreaterThan(0);
        assertThat(result.getTotalSamples() + result.getFailedSamples()).isEqualTo(8);
    }

    @Test
    void stalledStreamFailsOnceAsIncompleteWithoutRetry() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        AtomicInteger opened = new AtomicInteger();
        StreamingItemAdapter adapter = new StreamingItemAdapter("recommend_item_with_reason",
                "/recommend_item_with_reason", null, new ObjectMapper(), 80L) {
            @Override
            protected Flux<String> openStream(Map<String, Object> payload) {
                opened.incrementAndGet();
                return Flux.never();
            }
        };

        CombinationResult result = new CombinationRunner(registry).run(
                samples(1), Combination.of(1, 1), adapter, new ExactMatchHitJudge(), options(1, 3, 2000L, 60_000L));

        assertThat(opened.get()).isEqualTo(1);
        assertThat(result.getFailedSamples()).isEqualTo(1);
        assertThat(result.getTotalSamples()).isZero();
        assertThat(registry.counter("evaluation_sample_retry_total").count()).isZero();
    }
}
