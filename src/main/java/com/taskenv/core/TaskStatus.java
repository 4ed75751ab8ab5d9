package com.taskenv.core;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Workflow status of a task record.
 */
public enum TaskStatus {
    TODO("todo"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    ARCHIVED("archived");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    /**
     * Wire value as used in observations and seed files.
     */
    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parse a wire value (case-insensitive, '-' accepted for '_').
     *
     * @throws IllegalArgumentException if the value is not a known status
     */
    public static TaskStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Task status cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (TaskStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
