package com.taskenv.rule;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Difficulty tier of a rule.
 */
public enum Difficulty {
    EASY("easy"),
    MEDIUM("medium"),
    HARD("hard"),
    VERY_HARD("very_hard");

    private final String value;

    Difficulty(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
