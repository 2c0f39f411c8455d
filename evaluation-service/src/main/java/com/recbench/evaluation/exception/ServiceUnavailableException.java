package com.recbench.evaluation.exception;

/**
 * A whole target service is unknown, misconfigured or unreachable.
 */
public class ServiceUnavailableException extends EvaluationException {

    private final String serviceId;

    public ServiceUnavailableException(String serviceId, String message) {
        super(message);
        this.serviceId = serviceId;
    }

    public String getServiceId() {
        return serviceId;
    }
}
