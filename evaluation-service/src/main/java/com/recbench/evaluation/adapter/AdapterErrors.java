package com.recbench.evaluation.adapter;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Maps client-side failures onto {@link AdapterException}.
 */
final class AdapterErrors {

    private AdapterErrors() {
    }

    static AdapterException classify(String serviceId, Throwable error) {
        if (error instanceof AdapterException adapterException) {
            return adapterException;
        }
        WebClientResponseException responseError = find(error, WebClientResponseException.class);
        if (responseError != null) {
            int status = responseError.getStatusCode().value();
            String reason = "HTTP " + status + " from " + serviceId;
            if (status >= 500 || status == 429) {
                return AdapterException.transientFailure(reason, error);
            }
            return AdapterException.permanent(reason, error);
        }
        if (find(error, TimeoutException.class) != null) {
            return AdapterException.transientFailure("timeout calling " + serviceId, error);
        }
        if (find(error, WebClientRequestException.class) != null || find(error, IOException.class) != null) {
            return AdapterException.transientFailure("connection failed for " + serviceId + ": " + rootMessage(error), error);
        }
        return AdapterException.permanent("call to " + serviceId + " failed: " + rootMessage(error), error);
    }

    private static <T extends Throwable> T find(Throwable error, Class<T> type) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 16) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause();
            depth++;
        }
        return null;
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.getClass().getSimpleName() : current.getMessage();
    }
}
