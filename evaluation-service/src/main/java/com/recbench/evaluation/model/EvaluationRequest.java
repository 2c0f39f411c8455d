package com.recbench.evaluation.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a single-service or batch evaluation call.
 */
@Data
public class EvaluationRequest {
    private String serviceId;
    private List<String> targetServices;
    private List<Sample> samples = new ArrayList<>();
    private Combination combination;
    private StrategyFlags strategy;
    private String judgeMode;
    private Integer limit;
    private String exportPath;
}
