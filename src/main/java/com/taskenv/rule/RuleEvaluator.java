package com.taskenv.rule;

import com.taskenv.core.TaskSnapshot;
import com.taskenv.verdict.Evaluation;

/**
 * Decides whether a rule holds for a task snapshot.
 * Implementations are pure: no hidden state, no side effects.
 */
@FunctionalInterface
public interface RuleEvaluator {

    /**
     * Evaluate the rule against the given snapshot.
     *
     * @param snapshot Tasks and the instant they were observed
     * @return Completion flag, feedback and diagnostics
     */
    Evaluation evaluate(TaskSnapshot snapshot);
}
