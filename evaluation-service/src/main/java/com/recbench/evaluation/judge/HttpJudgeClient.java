package com.recbench.evaluation.judge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.recbench.evaluation.exception.JudgeException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class HttpJudgeClient implements JudgeClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final boolean configured;
    private final long timeoutMs;

    public HttpJudgeClient(WebClient webClient, ObjectMapper objectMapper, long timeoutMs) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.configured = webClient != null;
        this.timeoutMs = Math.max(50L, timeoutMs);
    }

    @Autowired
    public HttpJudgeClient(
            @Value("${evaluation.judge.url:}") String judgeUrl,
            @Value("${evaluation.judge.timeout-ms:30000}") long timeoutMs,
            ObjectMapper objectMapper
    ) {
        this(
                judgeUrl == null || judgeUrl.isBlank() ? null : WebClient.builder().baseUrl(judgeUrl).build(),
                objectMapper,
                timeoutMs
        );
    }

    @Override
    public JudgeOutcome judge(List<String> predItems, List<String> goldItems) {
        if (!configured) {
            throw new JudgeException("model judge url is not configured");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("pred_items", predItems);
        payload.put("gold_items", goldItems);

        String body;
        try {
            body = webClient.post()
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofMillis(timeoutMs));
        } catch (Exception ex) {
            throw new JudgeException("model judge call failed: " + ex.getMessage(), ex);
        }
        return readOutcome(body);
    }

    JudgeOutcome readOutcome(String body) {
        if (body == null || body.isBlank()) {
            throw new JudgeException("model judge returned an empty body");
        }
        JsonNode result;
        try {
            result = objectMapper.readTree(body).path("judge_result");
        } catch (IOException ex) {
            throw new JudgeException("model judge returned malformed json", ex);
        }
        if (result.isArray()) {
            result = result.path(0);
        }
        if (!result.isObject()) {
            throw new JudgeException("model judge returned no judge_result");
        }
        return new JudgeOutcome(flag(result, "top1_hit", "top_1"), flag(result, "top3_hit", "top_3"));
    }

    private static boolean flag(JsonNode result, String field, String alias) {
        JsonNode node = result.has(field) ? result.get(field) : result.get(alias);
        if (node == null || node.isNull()) {
            throw new JudgeException("model judge verdict missing " + field);
        }
        String value = node.asText("").trim();
        if ("1".equals(value)) {
            return true;
        }
        if ("0".equals(value)) {
            return false;
        }
        throw new JudgeException("model judge verdict " + field + " is not 0/1: " + value);
    }
}
