package com.recbench.evaluation.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;

/**
 * One CSV row: a single sample evaluated under one combination of one service.
 */
@Data
@JsonPropertyOrder({
        "service_id",
        "combination_label",
        "top_scenarios",
        "top_recommendations_per_scenario",
        "clinical_scenario",
        "standard_answer",
        "recommendations",
        "hit",
        "processing_time_ms"
})
public class ExportRecord {
    @JsonProperty("service_id")
    private String serviceId;
    @JsonProperty("combination_label")
    private String combinationLabel;
    @JsonProperty("top_scenarios")
    private int topScenarios;
    @JsonProperty("top_recommendations_per_scenario")
    private int topRecommendationsPerScenario;
    @JsonProperty("clinical_scenario")
    private String clinicalScenario;
    @JsonProperty("standard_answer")
    private String standardAnswer;
    @JsonProperty("recommendations")
    private String recommendations;
    @JsonProperty("hit")
    private int hit;
    @JsonProperty("processing_time_ms")
    private long processingTimeMs;
}
