package com.recbench.evaluation.exception;

/**
 * Rejected combination, sample or strategy input. Raised before any work is scheduled.
 */
public class ValidationException extends EvaluationException {

    public ValidationException(String message) {
        super(message);
    }
}
