package com.recbench.evaluation.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.recbench.evaluation.model.CanonicalRequest;
import com.recbench.evaluation.model.CanonicalResult;
import com.recbench.evaluation.model.StrategyFlags;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Services answering with {@code Data.best_recommendations[]}, one entry per matched scenario.
 */
public class StructuredRecommendationAdapter extends AbstractJsonServiceAdapter {

    public StructuredRecommendationAdapter(
            String serviceId,
            String path,
            WebClient webClient,
            ObjectMapper objectMapper,
            long requestTimeoutMs
    ) {
        super(serviceId, path, webClient, objectMapper, requestTimeoutMs);
    }

    @Override
    public ServiceShape shape() {
        return ServiceShape.STRUCTURED;
    }

    @Override
    public Map<String, Object> buildRequest(CanonicalRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("patient_info", request.getPatientInfo());
        payload.put("clinical_context", request.getClinicalContext());
        payload.put("search_strategy", Map.of());
        payload.put("retrieval_strategy", retrievalStrategy(request));
        payload.put("direct_return", false);
        // without structured context the scenario text is the only query the service gets
        boolean noContext = request.getPatientInfo().isEmpty() && request.getClinicalContext().isEmpty();
        payload.put("standard_query", noContext ? request.getScenario() : "");
        return payload;
    }

    protected Map<String, Object> retrievalStrategy(CanonicalRequest request) {
        StrategyFlags flags = request.getStrategy();
        Map<String, Object> strategy = new LinkedHashMap<>();
        strategy.put("enable_reranking", flags.isEnableReranking());
        strategy.put("need_llm_recommendations", flags.isNeedLlmRecommendations());
        strategy.put("apply_rule_filter", flags.isApplyRuleFilter());
        strategy.put("top_scenarios", request.getCombination().getTopScenarios());
        strategy.put("top_recommendations_per_scenario", request.getCombination().getTopRecommendationsPerScenario());
        strategy.put("similarity_threshold", flags.getSimilarityThreshold());
        strategy.put("min_appropriateness_rating", flags.getMinAppropriatenessRating());
        return strategy;
    }

    @Override
    protected CanonicalResult parseDocument(JsonNode root) {
        JsonNode data = root.has("Data") ? root.path("Data") : root.path("data");
        JsonNode groups = data.path("best_recommendations");
        List<List<String>> perScenario = new ArrayList<>();
        if (groups.isArray()) {
            for (JsonNode group : groups) {
                perScenario.add(readGroup(group));
            }
        }
        return CanonicalResult.of(perScenario, root);
    }

    private static List<String> readGroup(JsonNode group) {
        if (group == null || !group.isObject()) {
            return List.of();
        }
        JsonNode finalChoices = group.get("final_choices");
        if (finalChoices != null && !finalChoices.isNull()) {
            return readItems(finalChoices, "procedure_name", "name");
        }
        return readItems(group.get("recommendations"), "procedure_name", "name", "check_item_name");
    }
}
