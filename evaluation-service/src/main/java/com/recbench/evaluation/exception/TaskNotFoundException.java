package com.recbench.evaluation.exception;

public class TaskNotFoundException extends EvaluationException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("task not found: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
