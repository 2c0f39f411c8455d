package com.recbench.evaluation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ServiceResult {
    private final String serviceId;
    private final double overallAccuracy;
    private final Map<String, CombinationResult> combinationResults;
    private final double averageProcessingTimeMs;
    private final int totalSamples;
    private final int failedSamples;
    private final List<String> warnings;
    private final String error;

    public ServiceResult(
            String serviceId,
            double overallAccuracy,
            Map<String, CombinationResult> combinationResults,
            double averageProcessingTimeMs,
            int totalSamples,
            int failedSamples,
            List<String> warnings,
            String error
    ) {
        this.serviceId = serviceId;
        this.overallAccuracy = overallAccuracy;
        this.combinationResults = combinationResults == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(combinationResults));
        this.averageProcessingTimeMs = averageProcessingTimeMs;
        this.totalSamples = totalSamples;
        this.failedSamples = failedSamples;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.error = error;
    }

    public static ServiceResult failed(String serviceId, String error) {
        return new ServiceResult(serviceId, 0.0, null, 0.0, 0, 0, null, error);
    }

    public String getServiceId() {
        return serviceId;
    }

    public double getOverallAccuracy() {
        return overallAccuracy;
    }

    public Map<String, CombinationResult> getCombinationResults() {
        return combinationResults;
    }

    public double getAverageProcessingTimeMs() {
        return averageProcessingTimeMs;
    }

    public int getTotalSamples() {
        return totalSamples;
    }

    public int getFailedSamples() {
        return failedSamples;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getError() {
        return error;
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}
