package com.recbench.evaluation.service;

import com.recbench.evaluation.adapter.ServiceAdapter;
import com.recbench.evaluation.adapter.ServiceAdapterFactory;
import com.recbench.evaluation.exception.ServiceUnavailableException;
import com.recbench.evaluation.judge.HitJudge;
import com.recbench.evaluation.model.Combination;
import com.recbench.evaluation.model.CombinationResult;
import com.recbench.evaluation.model.SampleSet;
import com.recbench.evaluation.model.ServiceResult;
import com.recbench.evaluation.planner.CombinationPlan;
import com.recbench.evaluation.planner.CombinationPlanner;
import com.recbench.evaluation.runner.CombinationRunner;
import com.recbench.evaluation.runner.RunOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every planned combination for one target service and folds the results into a
 * {@link ServiceResult}. Combinations run one after another; samples inside each run in parallel.
 */
@Service
public class ServiceEvaluator {
    private static final Logger log = LoggerFactory.getLogger(ServiceEvaluator.class);

    private final ServiceAdapterFactory adapterFactory;
    private final CombinationPlanner planner;
    private final CombinationRunner runner;

    public ServiceEvaluator(ServiceAdapterFactory adapterFactory, CombinationPlanner planner, CombinationRunner runner) {
        this.adapterFactory = adapterFactory;
        this.planner = planner;
        this.runner = runner;
    }

    public ServiceResult evaluate(
            SampleSet samples,
            Combination userCombination,
            String serviceId,
            HitJudge judge,
            RunOptions options
    ) {
        CombinationPlan plan = planner.plan(userCombination, serviceId);
        for (String warning : plan.warnings()) {
            log.warn("service_id={} event=combination_skipped detail=\"{}\"", serviceId, warning);
        }
        return evaluate(samples, plan.combinations(), plan.warnings(), serviceId, judge, options);
    }

    public ServiceResult evaluate(
            SampleSet samples,
            List<Combination> combinations,
            List<String> warnings,
            String serviceId,
            HitJudge judge,
            RunOptions options
    ) {
        ServiceAdapter<?, ?> adapter;
        try {
            adapter = adapterFactory.create(serviceId);
        } catch (ServiceUnavailableException ex) {
            log.warn("service_id={} event=service_unavailable reason=\"{}\"", serviceId, ex.getMessage());
            return ServiceResult.failed(serviceId, ex.getMessage());
        }

        Map<String, CombinationResult> results = new LinkedHashMap<>();
        for (Combination combination : combinations) {
            if (options.cancellation().isCancelled()) {
                log.info("service_id={} event=evaluation_cancelled remaining_from={}", serviceId, combination.getLabel());
                break;
            }
            results.put(combination.getLabel(), runner.run(samples, combination, adapter, judge, options));
        }
        return summarize(serviceId, results, warnings);
    }

    static ServiceResult summarize(String serviceId, Map<String, CombinationResult> results, List<String> warnings) {
        int total = 0;
        int hits = 0;
        int failed = 0;
        double weightedTimeMs = 0.0;
        for (CombinationResult result : results.values()) {
            total += result.getTotalSamples();
            hits += result.getHitSamples();
            failed += result.getFailedSamples();
            weightedTimeMs += result.getAverageProcessingTimeMs() * result.getTotalSamples();
        }

        String error = null;
        if (total == 0 && failed > 0) {
            error = "no usable response from " + serviceId + ": all " + failed + " sample calls failed";
        }
        return new ServiceResult(
                serviceId,
                total > 0 ? (double) hits / total : 0.0,
                results,
                total > 0 ? weightedTimeMs / total : 0.0,
                total,
                failed,
                warnings == null ? new ArrayList<>() : warnings,
                error
        );
    }
}
