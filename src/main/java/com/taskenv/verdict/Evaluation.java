package com.taskenv.verdict;

import java.util.Objects;

/**
 * Raw outcome of one rule evaluator, before reward is attached.
 *
 * @param completed Whether the rule's predicate holds
 * @param feedback  Human-readable summary with the relevant counts
 * @param details   Rule-specific diagnostics
 */
public record Evaluation(boolean completed, String feedback, VerdictDetails details) {

    public Evaluation {
        Objects.requireNonNull(feedback, "feedback cannot be null");
        details = details == null ? NoDetails.INSTANCE : details;
    }

    public static Evaluation of(boolean completed, String passFeedback, String failFeedback,
                                VerdictDetails details) {
        return new Evaluation(completed, completed ? passFeedback : failFeedback, details);
    }

    public static Evaluation passed(String feedback, VerdictDetails details) {
        return new Evaluation(true, feedback, details);
    }

    public static Evaluation failed(String feedback, VerdictDetails details) {
        return new Evaluation(false, feedback, details);
    }
}
