package com.taskenv.rule;

/**
 * Public listing entry for a rule (no evaluation function).
 */
public record RuleSummary(
        String name,
        String description,
        double reward,
        Difficulty difficulty
) {
}
