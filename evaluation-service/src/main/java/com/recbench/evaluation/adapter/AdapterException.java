package com.recbench.evaluation.adapter;

/**
 * Failure of a single adapter call. Transient failures (connection refused, timeout, 5xx) are
 * retried by the combination runner; anything else is final for that sample.
 */
public class AdapterException extends Exception {

    private final boolean transientFailure;
    private final String reason;

    public AdapterException(boolean transientFailure, String reason) {
        super(reason);
        this.transientFailure = transientFailure;
        this.reason = reason;
    }

    public AdapterException(boolean transientFailure, String reason, Throwable cause) {
        super(reason, cause);
        this.transientFailure = transientFailure;
        this.reason = reason;
    }

    public static AdapterException transientFailure(String reason, Throwable cause) {
        return new AdapterException(true, reason, cause);
    }

    public static AdapterException permanent(String reason) {
        return new AdapterException(false, reason);
    }

    public static AdapterException permanent(String reason, Throwable cause) {
        return new AdapterException(false, reason, cause);
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public String getReason() {
        return reason;
    }
}
