package com.taskenv.exception;

/**
 * Exception thrown when a mutation targets a task id the store does not hold.
 */
public class TaskNotFoundException extends TaskEnvironmentException {

    private final long taskId;

    public TaskNotFoundException(long taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }

    public long getTaskId() {
        return taskId;
    }
}
