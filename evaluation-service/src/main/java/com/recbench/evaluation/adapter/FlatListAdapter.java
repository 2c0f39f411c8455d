package com.recbench.evaluation.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.recbench.evaluation.model.CanonicalRequest;
import com.recbench.evaluation.model.CanonicalResult;
import com.recbench.evaluation.model.StrategyFlags;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Services returning a single ranked list for the whole query. The list is treated as one scenario.
 */
public class FlatListAdapter extends AbstractJsonServiceAdapter {

    public FlatListAdapter(
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
        return ServiceShape.FLAT_LIST;
    }

    @Override
    public Map<String, Object> buildRequest(CanonicalRequest request) {
        StrategyFlags flags = request.getStrategy();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("clinical_query", request.getScenario());
        payload.put("include_raw_data", flags.isIncludeRawData());
        payload.put("debug_mode", flags.isDebugMode());
        payload.put("top_scenarios", request.getCombination().getTopScenarios());
        payload.put("top_recommendations_per_scenario", request.getCombination().getTopRecommendationsPerScenario());
        payload.put("show_reasoning", flags.isShowReasoning());
        payload.put("similarity_threshold", flags.getSimilarityThreshold());
        payload.put("compute_ragas", false);
        payload.put("ground_truth", "");
        return payload;
    }

    @Override
    protected CanonicalResult parseDocument(JsonNode root) {
        JsonNode recommendations = root.path("llm_recommendations").path("recommendations");
        return CanonicalResult.singleScenario(readItems(recommendations, "procedure_name", "name"), root);
    }
}
