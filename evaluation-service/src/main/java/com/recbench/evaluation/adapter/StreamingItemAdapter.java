package com.recbench.evaluation.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.recbench.evaluation.model.CanonicalRequest;
import com.recbench.evaluation.model.CanonicalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Item recommendation service that streams reasoning fragments per check item over SSE.
 * A stream that closes or stalls before the terminal marker is a permanent failure.
 */
public class StreamingItemAdapter implements ServiceAdapter<Map<String, Object>, ItemStreamAccumulator> {

    private static final Logger log = LoggerFactory.getLogger(StreamingItemAdapter.class);
    static final String INCOMPLETE_STREAM = "incomplete stream";

    private final String serviceId;
    private final String path;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final long streamDeadlineMs;

    public StreamingItemAdapter(
            String serviceId,
            String path,
            WebClient webClient,
            ObjectMapper objectMapper,
            long streamDeadlineMs
    ) {
        this.serviceId = serviceId;
        this.path = path;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.streamDeadlineMs = Math.max(50L, streamDeadlineMs);
    }

    @Override
    public String serviceId() {
        return serviceId;
    }

    @Override
    public ServiceShape shape() {
        return ServiceShape.STREAMING;
    }

    @Override
    public Map<String, Object> buildRequest(CanonicalRequest request) {
        Map<String, Object> patient = request.getPatientInfo();
        Map<String, Object> clinical = request.getClinicalContext();
        ThreadLocalRandom random = ThreadLocalRandom.current();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("session_id", String.valueOf(random.nextInt(1, 889)));
        payload.put("patient_id", String.valueOf(random.nextInt(1, 889)));
        payload.put("doctor_id", String.valueOf(random.nextInt(1, 889)));
        payload.put("department", text(clinical, "department", "内科"));
        payload.put("source", "test");
        payload.put("patient_sex", text(patient, "gender", ""));
        payload.put("patient_age", text(patient, "age", "未知"));
        payload.put("clinic_info", text(clinical, "chief_complaint", request.getScenario()));
        payload.put("diagnose_name", text(clinical, "diagnosis", ""));
        String history = text(clinical, "present_illness", text(clinical, "medical_history", request.getScenario()));
        payload.put("abstract_history", history);
        payload.put("recommend_count", request.getCombination().getTopRecommendationsPerScenario());
        return payload;
    }

    @Override
    public ItemStreamAccumulator call(Map<String, Object> payload) throws AdapterException {
        ItemStreamAccumulator accumulator = new ItemStreamAccumulator(objectMapper);
        try {
            openStream(payload)
                    .take(Duration.ofMillis(streamDeadlineMs))
                    .doOnNext(accumulator::accept)
                    .takeUntil(ignored -> accumulator.isComplete())
                    .then()
                    .block();
        } catch (Exception ex) {
            throw AdapterErrors.classify(serviceId, ex);
        }
        if (!accumulator.isComplete()) {
            log.warn("service_id={} event=stream_incomplete items={} deadline_ms={}",
                    serviceId, accumulator.itemNames().size(), streamDeadlineMs);
        }
        return accumulator;
    }

    protected Flux<String> openStream(Map<String, Object> payload) {
        return webClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(payload)
                .retrieve()
                .bodyToFlux(String.class);
    }

    @Override
    public CanonicalResult parse(ItemStreamAccumulator accumulator) throws AdapterException {
        if (accumulator == null || !accumulator.isComplete()) {
            throw AdapterException.permanent(INCOMPLETE_STREAM);
        }
        if (accumulator.getMalformedFragments() > 0) {
            log.debug("service_id={} event=stream_fragments_skipped count={}",
                    serviceId, accumulator.getMalformedFragments());
        }
        return CanonicalResult.singleScenario(accumulator.itemNames(), accumulator.textBlocks());
    }

    private static String text(Map<String, Object> source, String key, String fallback) {
        Object value = source == null ? null : source.get(key);
        if (value == null || value.toString().isBlank()) {
            return fallback;
        }
        return value.toString();
    }
}
