package com.recbench.evaluation.exception;

public class JudgeException extends EvaluationException {

    public JudgeException(String message) {
        super(message);
    }

    public JudgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
