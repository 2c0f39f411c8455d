package com.recbench.evaluation.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.recbench.evaluation.config.TargetServiceProperties;
import com.recbench.evaluation.exception.ServiceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds and caches one adapter per configured target service.
 */
@Component
public class ServiceAdapterFactory {

    private static final Logger log = LoggerFactory.getLogger(ServiceAdapterFactory.class);

    private final TargetServiceProperties targets;
    private final ObjectMapper objectMapper;
    private final long requestTimeoutMs;
    private final long streamDeadlineMs;
    private final ConcurrentHashMap<String, ServiceAdapter<?, ?>> adapters = new ConcurrentHashMap<>();

    public ServiceAdapterFactory(TargetServiceProperties targets, ObjectMapper objectMapper) {
        this(targets, objectMapper, 120_000L, 100_000L);
    }

    @Autowired
    public ServiceAdapterFactory(
            TargetServiceProperties targets,
            ObjectMapper objectMapper,
            @Value("${evaluation.runner.call-timeout-ms:120000}") long requestTimeoutMs,
            @Value("${evaluation.adapter.stream-deadline-ms:100000}") long streamDeadlineMs
    ) {
        this.targets = targets;
        this.objectMapper = objectMapper;
        this.requestTimeoutMs = requestTimeoutMs;
        this.streamDeadlineMs = streamDeadlineMs;
        if (streamDeadlineMs >= requestTimeoutMs) {
            log.warn("event=stream_deadline_exceeds_call_timeout stream_deadline_ms={} call_timeout_ms={}",
                    streamDeadlineMs, requestTimeoutMs);
        }
    }

    /**
     * @throws ServiceUnavailableException when the service is unknown or its configuration is incomplete
     */
    public ServiceAdapter<?, ?> create(String serviceId) {
        return adapters.computeIfAbsent(serviceId, this::build);
    }

    private ServiceAdapter<?, ?> build(String serviceId) {
        TargetServiceProperties.Target target = targets.find(serviceId)
                .orElseThrow(() -> new ServiceUnavailableException(serviceId, "unknown target service: " + serviceId));
        if (target.getShape() == null) {
            throw new ServiceUnavailableException(serviceId, "no response shape configured for " + serviceId);
        }
        if (target.getBaseUrl() == null || target.getBaseUrl().isBlank()) {
            throw new ServiceUnavailableException(serviceId, "no base url configured for " + serviceId);
        }
        String path = target.getPath() == null || target.getPath().isBlank() ? "/" + serviceId : target.getPath();
        WebClient webClient = WebClient.builder().baseUrl(target.getBaseUrl()).build();

        switch (target.getShape()) {
            case STRUCTURED:
                return new StructuredRecommendationAdapter(serviceId, path, webClient, objectMapper, requestTimeoutMs);
            case SIMPLIFIED_STRUCTURED:
                return new SimplifiedStructuredAdapter(serviceId, path, webClient, objectMapper, requestTimeoutMs);
            case FLAT_LIST:
                return new FlatListAdapter(serviceId, path, webClient, objectMapper, requestTimeoutMs);
            case STREAMING:
                return new StreamingItemAdapter(serviceId, path, webClient, objectMapper, streamDeadlineMs);
            default:
                throw new ServiceUnavailableException(serviceId, "unsupported shape " + target.getShape());
        }
    }
}
