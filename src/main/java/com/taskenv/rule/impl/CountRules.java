package com.taskenv.rule.impl;

import com.taskenv.core.TaskPriority;
import com.taskenv.core.TaskSnapshot;
import com.taskenv.core.TaskStatus;
import com.taskenv.verdict.CompletionRateDetails;
import com.taskenv.verdict.Evaluation;
import com.taskenv.verdict.FlowDetails;
import com.taskenv.verdict.ThresholdDetails;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rules decided by counting tasks in a given status or priority.
 */
public final class CountRules {

    static final int COMPLETE_THREE_TARGET = 3;
    static final int MILESTONE_TARGET = 10;
    static final int WIP_LIMIT = 5;
    static final double COMPLETION_RATE_TARGET = 80.0;

    private CountRules() {
    }

    public static Evaluation createUrgentTask(TaskSnapshot snapshot) {
        int urgent = snapshot.count(t -> t.hasPriority(TaskPriority.URGENT));
        return Evaluation.of(urgent > 0,
                "✅ Found " + urgent + " urgent task(s)",
                "❌ No urgent tasks found. Create a task with 'urgent' priority.",
                new ThresholdDetails(urgent, 1));
    }

    public static Evaluation completeThreeTasks(TaskSnapshot snapshot) {
        int completed = snapshot.countByStatus(TaskStatus.COMPLETED);
        return Evaluation.of(completed >= COMPLETE_THREE_TARGET,
                "✅ " + completed + " tasks completed (target: " + COMPLETE_THREE_TARGET + ")",
                "❌ Only " + completed + " tasks completed. Need " + COMPLETE_THREE_TARGET + " or more.",
                new ThresholdDetails(completed, COMPLETE_THREE_TARGET));
    }

    public static Evaluation milestoneAchievement(TaskSnapshot snapshot) {
        int completed = snapshot.countByStatus(TaskStatus.COMPLETED);
        return Evaluation.of(completed >= MILESTONE_TARGET,
                "✅ Milestone! " + completed + " tasks completed",
                "❌ " + completed + "/" + MILESTONE_TARGET + " tasks completed",
                new ThresholdDetails(completed, MILESTONE_TARGET));
    }

    public static Evaluation reduceWip(TaskSnapshot snapshot) {
        int wip = snapshot.countByStatus(TaskStatus.IN_PROGRESS);
        return Evaluation.of(wip <= WIP_LIMIT,
                "✅ WIP limited to " + wip + " tasks",
                "❌ Too much WIP: " + wip + " tasks (max: " + WIP_LIMIT + ")",
                new ThresholdDetails(wip, WIP_LIMIT));
    }

    /**
     * Completed share of all tasks must reach 80%. An empty snapshot fails.
     */
    public static Evaluation achieve80Completion(TaskSnapshot snapshot) {
        int total = snapshot.size();
        if (total == 0) {
            return Evaluation.failed("❌ No tasks exist", new CompletionRateDetails(0.0, 0, 0));
        }
        int completed = snapshot.countByStatus(TaskStatus.COMPLETED);
        double rate = completed * 100.0 / total;
        String formatted = formatRate(rate);
        return Evaluation.of(rate >= COMPLETION_RATE_TARGET,
                "✅ Completion rate: " + formatted + "%",
                "❌ Completion rate: " + formatted + "% (target: 80%)",
                new CompletionRateDetails(rate, completed, total));
    }

    /**
     * Strict pipeline shape: todo &lt; in_progress &lt; completed.
     */
    public static Evaluation optimizeTaskFlow(TaskSnapshot snapshot) {
        int todo = snapshot.countByStatus(TaskStatus.TODO);
        int inProgress = snapshot.countByStatus(TaskStatus.IN_PROGRESS);
        int completed = snapshot.countByStatus(TaskStatus.COMPLETED);
        boolean optimal = todo < inProgress && inProgress < completed;
        return Evaluation.of(optimal,
                "✅ Optimal flow: todo(" + todo + ") < in_progress(" + inProgress
                        + ") < completed(" + completed + ")",
                "❌ Flow needs optimization: todo(" + todo + "), in_progress(" + inProgress
                        + "), completed(" + completed + ")",
                new FlowDetails(todo, inProgress, completed));
    }

    /**
     * One decimal place, rounding the exact binary value half-even (6.25 -> "6.2").
     */
    static String formatRate(double rate) {
        return new BigDecimal(rate).setScale(1, RoundingMode.HALF_EVEN).toPlainString();
    }
}
