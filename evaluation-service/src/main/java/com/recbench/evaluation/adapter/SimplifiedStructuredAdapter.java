package com.recbench.evaluation.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.recbench.evaluation.model.CanonicalRequest;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Same response shape as the structured service; the request carries only sizing and thresholds.
 */
public class SimplifiedStructuredAdapter extends StructuredRecommendationAdapter {

    public SimplifiedStructuredAdapter(
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
        return ServiceShape.SIMPLIFIED_STRUCTURED;
    }

    @Override
    protected Map<String, Object> retrievalStrategy(CanonicalRequest request) {
        Map<String, Object> strategy = new LinkedHashMap<>();
        strategy.put("top_scenarios", request.getCombination().getTopScenarios());
        strategy.put("top_recommendations_per_scenario", request.getCombination().getTopRecommendationsPerScenario());
        strategy.put("similarity_threshold", request.getStrategy().getSimilarityThreshold());
        strategy.put("min_appropriateness_rating", request.getStrategy().getMinAppropriatenessRating());
        return strategy;
    }
}
