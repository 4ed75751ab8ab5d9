package com.taskenv.exception;

/**
 * Base exception for the task environment.
 */
public class TaskEnvironmentException extends RuntimeException {

    public TaskEnvironmentException(String message) {
        super(message);
    }

    public TaskEnvironmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
