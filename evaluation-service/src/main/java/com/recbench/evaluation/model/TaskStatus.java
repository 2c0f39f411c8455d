package com.recbench.evaluation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskStatus {
    PENDING,
    STARTED,
    PROGRESS,
    SUCCESS,
    FAILURE;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
