package com.recbench.evaluation.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.recbench.evaluation.adapter.ServiceShape;
import com.recbench.evaluation.config.TargetServiceProperties;
import com.recbench.evaluation.exception.ServiceUnavailableException;
import com.recbench.evaluation.exception.TaskNotFoundException;
import com.recbench.evaluation.exception.ValidationException;
import com.recbench.evaluation.model.EvaluationRequest;
import com.recbench.evaluation.model.ServiceResult;
import com.recbench.evaluation.model.TaskSnapshot;
import com.recbench.evaluation.service.EvaluationOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class EvaluationControllerTest {

    private EvaluationOrchestrator orchestrator;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(EvaluationOrchestrator.class);
        TargetServiceProperties targets = new TargetServiceProperties();
        targets.setTargets(List.of(
                new TargetServiceProperties.Target("recommend-simple", ServiceShape.SIMPLIFIED_STRUCTURED, "http://localhost:8000", null, 4)));
        ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .build();
        mockMvc = MockMvcBuilders.standaloneSetup(new EvaluationController(orchestrator, targets))
                .setControllerAdvice(new EvaluationExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
                .build();
    }

    @Test
    void batchSubmissionIsAccepted() throws Exception {
        when(orchestrator.submit(any(EvaluationRequest.class))).thenReturn("task-1");

        mockMvc.perform(post("/api/v1/evaluate-recommend/all")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"samples\":[{\"clinical_scenario\":\"胸痛\",\"standard_answer\":\"心电图\"}],"
                                + "\"combination\":{\"top_scenarios\":2,\"top_recommendations_per_scenario\":5},"
                                + "\"target_services\":[\"recommend\"],\"judge_mode\":\"model\",\"limit\":10}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.task_id").value("task-1"));

        ArgumentCaptor<EvaluationRequest> captor = ArgumentCaptor.forClass(EvaluationRequest.class);
        verify(orchestrator).submit(captor.capture());
        EvaluationRequest request = captor.getValue();
        assertThat(request.getSamples()).hasSize(1);
        assertThat(request.getSamples().get(0).getStandardAnswer()).isEqualTo("心电图");
        assertThat(request.getCombination().getTopRecommendationsPerScenario()).isEqualTo(5);
        assertThat(request.getTargetServices()).containsExactly("recommend");
        assertThat(request.getJudgeMode()).isEqualTo("model");
        assertThat(request.getLimit()).isEqualTo(10);
    }

    @Test
    void singleEvaluationReturnsServiceResult() throws Exception {
        when(orchestrator.evaluateSingle(any(EvaluationRequest.class)))
                .thenReturn(new ServiceResult("recommend", 0.75, null, 1200.0, 4, 0, List.of(), null));

        mockMvc.perform(post("/api/v1/evaluate-recommend")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"service_id\":\"recommend\",\"samples\":[{\"clinical_scenario\":\"胸痛\",\"standard_answer\":\"心电图\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service_id").value("recommend"))
                .andExpect(jsonPath("$.overall_accuracy").value(0.75))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void validationErrorsMapToBadRequest() throws Exception {
        when(orchestrator.evaluateSingle(any(EvaluationRequest.class)))
                .thenThrow(new ValidationException("top_scenarios must be >= 1, got 0"));

        mockMvc.perform(post("/api/v1/evaluate-recommend")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"service_id\":\"recommend\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_failed"))
                .andExpect(jsonPath("$.message").value("top_scenarios must be >= 1, got 0"));
    }

    @Test
    void unknownServiceMapsToServiceUnavailable() throws Exception {
        when(orchestrator.evaluateSingle(any(EvaluationRequest.class)))
                .thenThrow(new ServiceUnavailableException("nowhere", "unknown target service: nowhere"));

        mockMvc.perform(post("/api/v1/evaluate-recommend")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"service_id\":\"nowhere\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("service_unavailable"));
    }

    @Test
    void pollingReturnsSnapshotOrNotFound() throws Exception {
        when(orchestrator.poll("task-1")).thenReturn(TaskSnapshot.pending("task-1").progress(50, "1/2 services complete"));
        when(orchestrator.poll("gone")).thenThrow(new TaskNotFoundException("gone"));

        mockMvc.perform(get("/api/v1/evaluate-recommend/tasks/task-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.task_id").value("task-1"))
                .andExpect(jsonPath("$.status").value("progress"))
                .andExpect(jsonPath("$.progress_percentage").value(50))
                .andExpect(jsonPath("$.result").doesNotExist());

        mockMvc.perform(get("/api/v1/evaluate-recommend/tasks/gone"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("task_not_found"));
    }

    @Test
    void cancelReturnsCurrentSnapshot() throws Exception {
        when(orchestrator.cancel("task-1")).thenReturn(TaskSnapshot.pending("task-1").started("evaluating"));

        mockMvc.perform(post("/api/v1/evaluate-recommend/tasks/task-1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("started"));
        verify(orchestrator).cancel("task-1");
    }

    @Test
    void listsConfiguredTargets() throws Exception {
        mockMvc.perform(get("/api/v1/evaluate-recommend/targets"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("recommend-simple"))
                .andExpect(jsonPath("$[0].shape").value("SIMPLIFIED_STRUCTURED"))
                .andExpect(jsonPath("$[0].max_top_scenarios").value(4));
    }
}
