package com.recbench.evaluation.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class AggregateResult {
    private final Map<String, ServiceResult> perService;
    private final EvaluationSummary summary;
    private final String exportPath;

    public AggregateResult(Map<String, ServiceResult> perService, EvaluationSummary summary, String exportPath) {
        this.perService = Collections.unmodifiableMap(new LinkedHashMap<>(perService));
        this.summary = summary;
        this.exportPath = exportPath;
    }

    /**
     * Builds the cross-service summary. Accuracy and latency are averaged over services that
     * produced a usable response.
     */
    public static AggregateResult of(Map<String, ServiceResult> perService, String exportPath) {
        int succeeded = 0;
        double accuracySum = 0.0;
        double latencySum = 0.0;
        int totalSamples = 0;
        int excluded = 0;
        for (ServiceResult result : perService.values()) {
            if (result.isFailed()) {
                continue;
            }
            succeeded++;
            accuracySum += result.getOverallAccuracy();
            latencySum += result.getAverageProcessingTimeMs();
            totalSamples += result.getTotalSamples();
            excluded += result.getFailedSamples();
        }
        int tested = perService.size();
        EvaluationSummary summary = new EvaluationSummary(
                tested,
                succeeded,
                tested - succeeded,
                succeeded > 0 ? accuracySum / succeeded : 0.0,
                succeeded > 0 ? latencySum / succeeded : 0.0,
                totalSamples,
                excluded
        );
        return new AggregateResult(perService, summary, exportPath);
    }

    public AggregateResult withExportPath(String path) {
        return new AggregateResult(perService, summary, path);
    }

    public Map<String, ServiceResult> getPerService() {
        return perService;
    }

    public EvaluationSummary getSummary() {
        return summary;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getExportPath() {
        return exportPath;
    }
}
