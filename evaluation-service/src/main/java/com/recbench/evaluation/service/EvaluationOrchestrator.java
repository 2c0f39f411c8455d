package com.recbench.evaluation.service;

import com.recbench.evaluation.config.TargetServiceProperties;
import com.recbench.evaluation.exception.ServiceUnavailableException;
import com.recbench.evaluation.exception.ValidationException;
import com.recbench.evaluation.export.EvaluationExporter;
import com.recbench.evaluation.judge.HitJudge;
import com.recbench.evaluation.judge.HitJudgeResolver;
import com.recbench.evaluation.model.AggregateResult;
import com.recbench.evaluation.model.EvaluationRequest;
import com.recbench.evaluation.model.SampleSet;
import com.recbench.evaluation.model.ServiceResult;
import com.recbench.evaluation.model.TaskSnapshot;
import com.recbench.evaluation.planner.CombinationPlanner;
import com.recbench.evaluation.runner.CancellationToken;
import com.recbench.evaluation.runner.RunOptions;
import com.recbench.evaluation.runner.RunnerSettings;
import com.recbench.evaluation.task.TaskRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns evaluation tasks from submission to a terminal state.
 *
 * <p>Each task gets one coordinator thread. The coordinator fans out a {@link ServiceEvaluator}
 * per target service and is the only writer of the task's snapshot: evaluators hand their
 * {@link ServiceResult} back over a queue, and the coordinator turns each arrival into a progress
 * update. Cancellation and the run-time ceiling are observed by the coordinator as well.
 */
@Service
public class EvaluationOrchestrator implements DisposableBean {
    private static final Logger log = LoggerFactory.getLogger(EvaluationOrchestrator.class);
    private static final long DEFAULT_MAX_RUN_MS = 3_600_000L;
    private static final long COMPLETION_POLL_MS = 250L;

    private final TaskRegistry registry;
    private final ServiceEvaluator evaluator;
    private final HitJudgeResolver judgeResolver;
    private final EvaluationExporter exporter;
    private final TargetServiceProperties targets;
    private final RunOptions baseOptions;
    private final MeterRegistry meterRegistry;
    private final long maxRunMs;
    private final ExecutorService coordinators = Executors.newCachedThreadPool(namedThreads("eval-task"));
    private final ExecutorService serviceWorkers = Executors.newCachedThreadPool(namedThreads("eval-service"));

    public EvaluationOrchestrator(
            TaskRegistry registry,
            ServiceEvaluator evaluator,
            HitJudgeResolver judgeResolver,
            EvaluationExporter exporter,
            TargetServiceProperties targets,
            RunOptions baseOptions
    ) {
        this(registry, evaluator, judgeResolver, exporter, targets, baseOptions, null, DEFAULT_MAX_RUN_MS);
    }

    public EvaluationOrchestrator(
            TaskRegistry registry,
            ServiceEvaluator evaluator,
            HitJudgeResolver judgeResolver,
            EvaluationExporter exporter,
            TargetServiceProperties targets,
            RunOptions baseOptions,
            MeterRegistry meterRegistry,
            long maxRunMs
    ) {
        this.registry = registry;
        this.evaluator = evaluator;
        this.judgeResolver = judgeResolver;
        this.exporter = exporter;
        this.targets = targets;
        this.baseOptions = baseOptions == null ? RunOptions.defaults() : baseOptions;
        this.meterRegistry = meterRegistry;
        this.maxRunMs = Math.max(1L, maxRunMs);
    }

    @Autowired
    public EvaluationOrchestrator(
            TaskRegistry registry,
            ServiceEvaluator evaluator,
            HitJudgeResolver judgeResolver,
            EvaluationExporter exporter,
            TargetServiceProperties targets,
            RunnerSettings runnerSettings,
            MeterRegistry meterRegistry,
            @Value("${evaluation.task.max-run-ms:3600000}") long maxRunMs
    ) {
        this(registry, evaluator, judgeResolver, exporter, targets, runnerSettings.baseOptions(), meterRegistry, maxRunMs);
    }

    /**
     * Registers a batch task and schedules it. Never blocks on evaluation work.
     *
     * @throws ValidationException when the combination or strategy is malformed or no target is known
     */
    public String submit(EvaluationRequest request) {
        preflight(request);
        List<String> serviceIds = resolveTargets(request.getTargetServices());

        TaskRegistry.TaskEntry entry = registry.register();
        incrementCounter("evaluation_task_submitted_total");
        log.info("task_id={} event=task_submitted services={} samples={}",
                entry.taskId(), serviceIds, request.getSamples() == null ? 0 : request.getSamples().size());
        try {
            coordinators.execute(() -> runTask(entry, request, serviceIds));
        } catch (RejectedExecutionException ex) {
            fail(entry, "could not schedule evaluation: " + ex.getMessage());
        }
        return entry.taskId();
    }

    /**
     * Synchronous evaluation of a single service.
     *
     * @throws ServiceUnavailableException when the service id is not configured
     */
    public ServiceResult evaluateSingle(EvaluationRequest request) {
        preflight(request);
        String serviceId = request.getServiceId();
        if (serviceId == null || serviceId.isBlank()) {
            throw new ValidationException("service_id is required");
        }
        if (targets.find(serviceId).isEmpty()) {
            throw new ServiceUnavailableException(serviceId, "unknown target service: " + serviceId);
        }
        SampleSet samples = SampleSet.of(request.getSamples(), request.getLimit());
        HitJudge judge = judgeResolver.resolve(request.getJudgeMode());
        RunOptions options = baseOptions.withStrategy(request.getStrategy()).withCancellation(CancellationToken.none());
        return evaluator.evaluate(samples, request.getCombination(), serviceId, judge, options);
    }

    public TaskSnapshot poll(String taskId) {
        return registry.get(taskId);
    }

    /**
     * Flags the task for cancellation. The coordinator performs the transition to Failure.
     */
    public TaskSnapshot cancel(String taskId) {
        TaskRegistry.TaskEntry entry = registry.entry(taskId);
        if (!entry.snapshot().getStatus().isTerminal() && entry.cancellation().cancel()) {
            log.info("task_id={} event=task_cancel_requested", taskId);
        }
        return entry.snapshot();
    }

    private void runTask(TaskRegistry.TaskEntry entry, EvaluationRequest request, List<String> serviceIds) {
        String taskId = entry.taskId();
        try {
            SampleSet samples;
            try {
                samples = SampleSet.of(request.getSamples(), request.getLimit());
            } catch (ValidationException ex) {
                fail(entry, ex.getMessage());
                return;
            }

            int total = serviceIds.size();
            entry.update(s -> s.started("evaluating " + total + " services with " + samples.size() + " samples"));
            HitJudge judge = judgeResolver.resolve(request.getJudgeMode());
            CancellationToken cancellation = entry.cancellation();
            RunOptions options = baseOptions.withStrategy(request.getStrategy()).withCancellation(cancellation);

            BlockingQueue<ServiceResult> completions = new LinkedBlockingQueue<>();
            List<Future<?>> running = new ArrayList<>();
            try {
                for (String serviceId : serviceIds) {
                    running.add(serviceWorkers.submit(() -> completions.add(
                            evaluateIsolated(taskId, samples, request, serviceId, judge, options))));
                }
            } catch (RejectedExecutionException ex) {
                cancellation.cancel();
                fail(entry, "could not schedule evaluation: " + ex.getMessage());
                return;
            }
            entry.update(s -> s.progress(0, "0/" + total + " services complete"));

            Map<String, ServiceResult> results = new LinkedHashMap<>();
            long deadline = System.currentTimeMillis() + maxRunMs;
            while (results.size() < total) {
                if (cancellation.isCancelled()) {
                    fail(entry, "cancelled");
                    return;
                }
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    cancellation.cancel();
                    running.forEach(future -> future.cancel(true));
                    fail(entry, "timeout");
                    return;
                }
                ServiceResult result = completions.poll(Math.min(remaining, COMPLETION_POLL_MS), TimeUnit.MILLISECONDS);
                if (result == null) {
                    continue;
                }
                results.put(result.getServiceId(), result);
                int done = results.size();
                log.info("task_id={} event=service_complete service_id={} accuracy={} failed={} completed={}/{}",
                        taskId, result.getServiceId(), String.format("%.4f", result.getOverallAccuracy()),
                        result.isFailed(), done, total);
                entry.update(s -> s.progress(done * 100 / total,
                        done + "/" + total + " services complete, last: " + result.getServiceId()));
            }

            AggregateResult aggregate = export(taskId, request, AggregateResult.of(results, null));
            entry.update(s -> s.success(aggregate, "evaluated " + total + " services"));
            incrementCounter("evaluation_task_success_total");
            log.info("task_id={} event=task_success services={} avg_accuracy={}",
                    taskId, total, String.format("%.4f", aggregate.getSummary().getAvgAccuracy()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            fail(entry, "interrupted");
        } catch (RuntimeException ex) {
            log.error("task_id={} event=task_crashed", taskId, ex);
            fail(entry, "internal error: " + ex.getMessage());
        }
    }

    private ServiceResult evaluateIsolated(
            String taskId,
            SampleSet samples,
            EvaluationRequest request,
            String serviceId,
            HitJudge judge,
            RunOptions options
    ) {
        try {
            return evaluator.evaluate(samples, request.getCombination(), serviceId, judge, options);
        } catch (RuntimeException | Error ex) {
            log.warn("task_id={} event=service_failed service_id={}", taskId, serviceId, ex);
            return ServiceResult.failed(serviceId, ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
    }

    private AggregateResult export(String taskId, EvaluationRequest request, AggregateResult aggregate) {
        Path target = exporter.resolveTarget(request.getExportPath(), taskId);
        if (target == null) {
            return aggregate;
        }
        try {
            return aggregate.withExportPath(exporter.write(aggregate, target).toString());
        } catch (IOException | RuntimeException ex) {
            log.warn("task_id={} event=export_failed path={}", taskId, target, ex);
            return aggregate;
        }
    }

    private void fail(TaskRegistry.TaskEntry entry, String reason) {
        if (entry.snapshot().getStatus().isTerminal()) {
            return;
        }
        entry.update(s -> s.failure(reason));
        incrementCounter("evaluation_task_failure_total");
        log.warn("task_id={} event=task_failure reason=\"{}\"", entry.taskId(), reason);
    }

    private void preflight(EvaluationRequest request) {
        if (request == null) {
            throw new ValidationException("request body is required");
        }
        if (request.getCombination() != null) {
            CombinationPlanner.validate(request.getCombination());
        }
        if (request.getStrategy() != null) {
            request.getStrategy().validate();
        }
    }

    private List<String> resolveTargets(List<String> requested) {
        List<String> ids = requested == null || requested.isEmpty()
                ? targets.ids()
                : new ArrayList<>(new LinkedHashSet<>(requested));
        if (ids.isEmpty()) {
            throw new ValidationException("no target services configured");
        }
        return ids;
    }

    private void incrementCounter(String metricName) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName).increment();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void destroy() {
        coordinators.shutdownNow();
        serviceWorkers.shutdownNow();
    }
}
