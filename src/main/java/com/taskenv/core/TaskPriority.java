package com.taskenv.core;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Priority level of a task record.
 */
public enum TaskPriority {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    URGENT("urgent");

    private final String value;

    TaskPriority(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parse a wire value (case-insensitive).
     *
     * @throws IllegalArgumentException if the value is not a known priority
     */
    public static TaskPriority fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Task priority cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TaskPriority priority : values()) {
            if (priority.value.equals(normalized)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown task priority: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
