package com.recbench.evaluation.runner;

import com.recbench.evaluation.adapter.AdapterException;
import com.recbench.evaluation.adapter.ServiceAdapter;
import com.recbench.evaluation.judge.HitJudge;
import com.recbench.evaluation.judge.JudgeVerdict;
import com.recbench.evaluation.model.CanonicalRequest;
import com.recbench.evaluation.model.CanonicalResult;
import com.recbench.evaluation.model.Combination;
import com.recbench.evaluation.model.CombinationResult;
import com.recbench.evaluation.model.EvaluationDetail;
import com.recbench.evaluation.model.Sample;
import com.recbench.evaluation.model.SampleSet;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Evaluates every sample of a {@link SampleSet} under one combination against one adapter.
 *
 * <p>Samples run on a pool bounded by {@link RunOptions#concurrencyLimit()}. Each worker writes
 * into the slot matching its sample index, so details keep input order regardless of completion
 * order. Samples whose calls keep failing are tallied as failed and left out of the accuracy.
 */
@Component
public class CombinationRunner {
    private static final Logger log = LoggerFactory.getLogger(CombinationRunner.class);
    private static final long MAX_BACKOFF_MS = 10_000L;

    private final MeterRegistry meterRegistry;

    public CombinationRunner() {
        this(null);
    }

    @Autowired
    public CombinationRunner(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public CombinationResult run(
            SampleSet samples,
            Combination combination,
            ServiceAdapter<?, ?> adapter,
            HitJudge judge,
            RunOptions options
    ) {
        int size = samples.size();
        AtomicReferenceArray<SampleOutcome> slots = new AtomicReferenceArray<>(size);
        long start = System.nanoTime();

        ExecutorService workers = Executors.newFixedThreadPool(
                options.concurrencyLimit(), namedThreads("eval-" + adapter.serviceId() + "-worker"));
        ExecutorService calls = Executors.newCachedThreadPool(namedThreads("eval-" + adapter.serviceId() + "-call"));
        try {
            for (int i = 0; i < size; i++) {
                final int index = i;
                workers.execute(() -> slots.set(index,
                        evaluateSample(samples.get(index), combination, adapter, judge, options, calls)));
            }
            workers.shutdown();
            if (!awaitQuietly(workers, options.combinationBudgetMs())) {
                workers.shutdownNow();
                log.warn(
                        "service_id={} combination={} event=combination_budget_exceeded budget_ms={}",
                        adapter.serviceId(), combination.getLabel(), options.combinationBudgetMs());
            }
        } finally {
            workers.shutdownNow();
            calls.shutdownNow();
        }

        CombinationResult result = aggregate(combination, slots);
        log.info(
                "service_id={} combination={} event=combination_complete evaluated={} hits={} failed={} accuracy={} duration_ms={}",
                adapter.serviceId(),
                combination.getLabel(),
                result.getTotalSamples(),
                result.getHitSamples(),
                result.getFailedSamples(),
                String.format("%.4f", result.getAccuracy()),
                (System.nanoTime() - start) / 1_000_000L);
        return result;
    }

    private SampleOutcome evaluateSample(
            Sample sample,
            Combination combination,
            ServiceAdapter<?, ?> adapter,
            HitJudge judge,
            RunOptions options,
            ExecutorService calls
    ) {
        CanonicalRequest request = CanonicalRequest.from(sample, combination, options.strategy());
        for (int attempt = 1; attempt <= options.maxAttempts(); attempt++) {
            if (options.cancellation().isCancelled() || Thread.currentThread().isInterrupted()) {
                return SampleOutcome.failed("cancelled");
            }
            try {
                CanonicalResult result = timedCall(adapter, request, options.callTimeoutMs(), calls)
                        .truncateTo(combination);
                return SampleOutcome.evaluated(judgeSample(sample, result, judge));
            } catch (AdapterException ex) {
                if (!ex.isTransient() || attempt == options.maxAttempts()) {
                    return failSample(adapter.serviceId(), combination, attempt, ex);
                }
                incrementCounter("evaluation_sample_retry_total");
                log.debug(
                        "service_id={} combination={} event=sample_retry attempt={} reason=\"{}\"",
                        adapter.serviceId(), combination.getLabel(), attempt, ex.getReason());
                if (!sleepBackoff(options.backoffMs(), attempt)) {
                    return SampleOutcome.failed("interrupted");
                }
            }
        }
        return SampleOutcome.failed("no attempts");
    }

    private CanonicalResult timedCall(
            ServiceAdapter<?, ?> adapter,
            CanonicalRequest request,
            long timeoutMs,
            ExecutorService calls
    ) throws AdapterException {
        long callStart = System.nanoTime();
        Future<CanonicalResult> future = calls.submit(() -> adapter.execute(request));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw AdapterException.transientFailure("timeout after " + timeoutMs + " ms calling " + adapter.serviceId(), ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof AdapterException adapterException) {
                throw adapterException;
            }
            throw AdapterException.permanent("adapter " + adapter.serviceId() + " failed: " + cause, cause);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw AdapterException.permanent("interrupted calling " + adapter.serviceId(), ex);
        } finally {
            recordTimer("evaluation_adapter_call_latency_ms", callStart);
        }
    }

    private EvaluationDetail judgeSample(Sample sample, CanonicalResult result, HitJudge judge) {
        List<List<String>> recommendations = result.getPerScenarioRecommendations();
        JudgeVerdict verdict = judge.judge(recommendations, sample.getStandardAnswer());
        if (verdict.hit()) {
            incrementCounter("evaluation_sample_hit_total");
        }
        return new EvaluationDetail(
                sample.getClinicalScenario(),
                sample.getStandardAnswer(),
                recommendations,
                verdict.perScenarioHits(),
                verdict.hit(),
                result.getProcessingTimeMs(),
                verdict.fallback());
    }

    private SampleOutcome failSample(String serviceId, Combination combination, int attempts, AdapterException ex) {
        incrementCounter("evaluation_sample_failed_total");
        log.warn(
                "service_id={} combination={} event=sample_failed attempts={} transient={} reason=\"{}\"",
                serviceId, combination.getLabel(), attempts, ex.isTransient(), ex.getReason());
        return SampleOutcome.failed(ex.getReason());
    }

    private static CombinationResult aggregate(Combination combination, AtomicReferenceArray<SampleOutcome> slots) {
        List<EvaluationDetail> details = new ArrayList<>();
        int hits = 0;
        int failed = 0;
        int fallbacks = 0;
        long totalTimeMs = 0L;
        for (int i = 0; i < slots.length(); i++) {
            SampleOutcome outcome = slots.get(i);
            if (outcome == null || outcome.detail == null) {
                // unfinished slots are samples cut off by the combination budget
                failed++;
                continue;
            }
            EvaluationDetail detail = outcome.detail;
            details.add(detail);
            totalTimeMs += detail.getProcessingTimeMs();
            if (detail.isHit()) {
                hits++;
            }
            if (detail.isJudgeFallback()) {
                fallbacks++;
            }
        }
        double averageMs = details.isEmpty() ? 0.0 : (double) totalTimeMs / details.size();
        return new CombinationResult(combination, details.size(), hits, failed, averageMs, fallbacks, details);
    }

    private static boolean sleepBackoff(long backoffMs, int attempt) {
        long delay = Math.min(MAX_BACKOFF_MS, backoffMs * (1L << Math.min(attempt - 1, 16)));
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static boolean awaitQuietly(ExecutorService executor, long budgetMs) {
        try {
            return executor.awaitTermination(budgetMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private void recordTimer(String metricName, long startNanos) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.timer(metricName).record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private void incrementCounter(String metricName) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName).increment();
    }

    private static final class SampleOutcome {
        private final EvaluationDetail detail;
        private final String failureReason;

        private SampleOutcome(EvaluationDetail detail, String failureReason) {
            this.detail = detail;
            this.failureReason = failureReason;
        }

        static SampleOutcome evaluated(EvaluationDetail detail) {
            return new SampleOutcome(detail, null);
        }

        static SampleOutcome failed(String reason) {
            return new SampleOutcome(null, reason);
        }

        @Override
        public String toString() {
            return detail != null ? "evaluated" : "failed(" + failureReason + ")";
        }
    }
}
