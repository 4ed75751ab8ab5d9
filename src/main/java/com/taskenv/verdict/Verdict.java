package com.taskenv.verdict;

import java.util.Map;
import java.util.Objects;

/**
 * Result of validating one rule against one task snapshot.
 *
 * @param ruleName  Rule that was validated (echoed back even when unknown)
 * @param completed Whether the rule is currently satisfied
 * @param reward    Reward granted by this call (rule weight if completed, else 0.0)
 * @param feedback  Human-readable summary
 * @param details   Rule-specific diagnostics
 */
public record Verdict(
        String ruleName,
        boolean completed,
        double reward,
        String feedback,
        VerdictDetails details
) {
    public Verdict {
        Objects.requireNonNull(ruleName, "ruleName cannot be null");
        Objects.requireNonNull(feedback, "feedback cannot be null");
        details = details == null ? NoDetails.INSTANCE : details;
    }

    /**
     * Attach the rule's reward to an evaluator outcome.
     */
    public static Verdict of(String ruleName, double ruleReward, Evaluation evaluation) {
        return new Verdict(
                ruleName,
                evaluation.completed(),
                evaluation.completed() ? ruleReward : 0.0,
                evaluation.feedback(),
                evaluation.details());
    }

    /**
     * A failing verdict for a name the catalog does not know.
     * Not an error: agents may ask for any rule name.
     */
    public static Verdict unknownRule(String ruleName) {
        return new Verdict(ruleName, false, 0.0, "Unknown rule: " + ruleName, NoDetails.INSTANCE);
    }

    public Map<String, Object> detailsAsMap() {
        return details.asMap();
    }
}
