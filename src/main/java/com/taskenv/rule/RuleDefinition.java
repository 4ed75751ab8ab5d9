package com.taskenv.rule;

import com.taskenv.core.TaskSnapshot;
import com.taskenv.verdict.Evaluation;

import java.util.Objects;

/**
 * Immutable definition of a rule in the catalog.
 *
 * @param name        Unique rule name (e.g. "complete_three_tasks")
 * @param description What the agent has to achieve
 * @param reward      Positive reward granted each time the rule validates as completed
 * @param difficulty  Difficulty tier
 * @param evaluator   Evaluation function
 */
public record RuleDefinition(
        String name,
        String description,
        double reward,
        Difficulty difficulty,
        RuleEvaluator evaluator
) {
    public RuleDefinition {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(difficulty, "difficulty cannot be null");
        Objects.requireNonNull(evaluator, "evaluator cannot be null");
    }

    public Evaluation evaluate(TaskSnapshot snapshot) {
        return evaluator.evaluate(snapshot);
    }

    public RuleSummary toSummary() {
        return new RuleSummary(name, description, reward, difficulty);
    }
}
