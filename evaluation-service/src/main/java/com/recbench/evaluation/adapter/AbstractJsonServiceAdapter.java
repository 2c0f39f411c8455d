package com.recbench.evaluation.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.recbench.evaluation.model.CanonicalResult;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request/response adapters that POST a JSON body and read a JSON document back.
 */
public abstract class AbstractJsonServiceAdapter implements ServiceAdapter<Map<String, Object>, String> {

    protected final String serviceId;
    protected final String path;
    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;
    private final long requestTimeoutMs;

    protected AbstractJsonServiceAdapter(
            String serviceId,
            String path,
            WebClient webClient,
            ObjectMapper objectMapper,
            long requestTimeoutMs
    ) {
        this.serviceId = serviceId;
        this.path = path;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.requestTimeoutMs = Math.max(50L, requestTimeoutMs);
    }

    @Override
    public String serviceId() {
        return serviceId;
    }

    @Override
    public String call(Map<String, Object> payload) throws AdapterException {
        try {
            return webClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofMillis(requestTimeoutMs));
        } catch (Exception ex) {
            throw AdapterErrors.classify(serviceId, ex);
        }
    }

    @Override
    public CanonicalResult parse(String body) throws AdapterException {
        if (body == null || body.isBlank()) {
            throw AdapterException.permanent("malformed body from " + serviceId + ": empty response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException ex) {
            throw AdapterException.permanent("malformed body from " + serviceId, ex);
        }
        if (root == null || !root.isObject()) {
            throw AdapterException.permanent("malformed body from " + serviceId + ": expected a JSON object");
        }
        return parseDocument(root);
    }

    protected abstract CanonicalResult parseDocument(JsonNode root);

    /**
     * Reads a ranked list that may hold plain strings or objects naming the item.
     */
    protected static List<String> readItems(JsonNode array, String... nameFields) {
        List<String> items = new ArrayList<>();
        if (array == null || array.isNull()) {
            return items;
        }
        if (array.isTextual()) {
            String single = array.asText("").trim();
            if (!single.isEmpty()) {
                items.add(single);
            }
            return items;
        }
        if (!array.isArray()) {
            return items;
        }
        for (JsonNode node : array) {
            String value = "";
            if (node.isTextual()) {
                value = node.asText("");
            } else if (node.isObject()) {
                for (String field : nameFields) {
                    value = node.path(field).asText("");
                    if (!value.isBlank()) {
                        break;
                    }
                }
            }
            if (!value.isBlank()) {
                items.add(value.trim());
            }
        }
        return items;
    }
}
