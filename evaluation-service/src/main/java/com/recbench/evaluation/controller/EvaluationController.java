package com.recbench.evaluation.controller;

import com.recbench.evaluation.adapter.ServiceShape;
import com.recbench.evaluation.config.TargetServiceProperties;
import com.recbench.evaluation.model.EvaluationRequest;
import com.recbench.evaluation.model.ServiceResult;
import com.recbench.evaluation.model.TaskSnapshot;
import com.recbench.evaluation.service.EvaluationOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/evaluate-recommend")
public class EvaluationController {

    private final EvaluationOrchestrator orchestrator;
    private final TargetServiceProperties targets;

    public EvaluationController(EvaluationOrchestrator orchestrator, TargetServiceProperties targets) {
        this.orchestrator = orchestrator;
        this.targets = targets;
    }

    @PostMapping
    public ServiceResult evaluateSingle(@RequestBody EvaluationRequest request) {
        return orchestrator.evaluateSingle(request);
    }

    @PostMapping("/all")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, String> evaluateAll(@RequestBody EvaluationRequest request) {
        return Map.of("task_id", orchestrator.submit(request));
    }

    @GetMapping("/tasks/{taskId}")
    public TaskSnapshot taskStatus(@PathVariable("taskId") String taskId) {
        return orchestrator.poll(taskId);
    }

    @PostMapping("/tasks/{taskId}/cancel")
    public TaskSnapshot cancel(@PathVariable("taskId") String taskId) {
        return orchestrator.cancel(taskId);
    }

    @GetMapping("/targets")
    public List<TargetView> targets() {
        return targets.getTargets().stream()
                .map(target -> new TargetView(target.getId(), target.getShape(), target.getMaxTopScenarios()))
                .collect(Collectors.toList());
    }

    public record TargetView(String id, ServiceShape shape, Integer maxTopScenarios) {
    }
}
