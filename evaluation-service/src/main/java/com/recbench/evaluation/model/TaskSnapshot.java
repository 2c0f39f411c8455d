package com.recbench.evaluation.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Immutable view of a task. The orchestrator publishes a new snapshot on every transition;
 * pollers only ever read a complete one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TaskSnapshot {
    private final String taskId;
    private final TaskStatus status;
    private final int progressPercentage;
    private final String message;
    private final AggregateResult result;
    private final String error;
    private final Instant createdAt;
    private final Instant updatedAt;

    private TaskSnapshot(
            String taskId,
            TaskStatus status,
            int progressPercentage,
            String message,
            AggregateResult result,
            String error,
            Instant createdAt,
            Instant updatedAt
    ) {
        this.taskId = taskId;
        this.status = status;
        this.progressPercentage = progressPercentage;
        this.message = message;
        this.result = result;
        this.error = error;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static TaskSnapshot pending(String taskId) {
        Instant now = Instant.now();
        return new TaskSnapshot(taskId, TaskStatus.PENDING, 0, "task is waiting to run", null, null, now, now);
    }

    public TaskSnapshot started(String newMessage) {
        return next(TaskStatus.STARTED, progressPercentage, newMessage, null, null);
    }

    public TaskSnapshot progress(int percentage, String newMessage) {
        int clamped = Math.max(progressPercentage, Math.min(100, Math.max(0, percentage)));
        return next(TaskStatus.PROGRESS, clamped, newMessage, null, null);
    }

    public TaskSnapshot success(AggregateResult aggregateResult, String newMessage) {
        return next(TaskStatus.SUCCESS, 100, newMessage, aggregateResult, null);
    }

    public TaskSnapshot failure(String reason) {
        return next(TaskStatus.FAILURE, progressPercentage, "task failed", null, reason);
    }

    private TaskSnapshot next(
            TaskStatus nextStatus,
            int percentage,
            String newMessage,
            AggregateResult aggregateResult,
            String failureReason
    ) {
        if (status.isTerminal()) {
            throw new IllegalStateException("task " + taskId + " is already " + status.label());
        }
        return new TaskSnapshot(
                taskId,
                nextStatus,
                percentage,
                newMessage,
                aggregateResult,
                failureReason,
                createdAt,
                Instant.now()
        );
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public int getProgressPercentage() {
        return progressPercentage;
    }

    public String getMessage() {
        return message;
    }

    public AggregateResult getResult() {
        return result;
    }

    public String getError() {
        return error;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
