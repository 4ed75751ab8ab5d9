package com.taskenv.rule.impl;

import com.taskenv.core.TaskPriority;
import com.taskenv.core.TaskRecord;
import com.taskenv.core.TaskSnapshot;
import com.taskenv.core.TaskStatus;
import com.taskenv.verdict.CoverageDetails;
import com.taskenv.verdict.Evaluation;
import com.taskenv.verdict.PriorityConflictDetails;

import java.util.List;

/**
 * Rules about how work is ordered by priority.
 */
public final class PriorityRules {

    private PriorityRules() {
    }

    /**
     * Every high priority task must be in progress or completed.
     * Unlike the other coverage rules, an empty high-priority set is a failure.
     */
    public static Evaluation organizeByPriority(TaskSnapshot snapshot) {
        List<TaskRecord> high = snapshot.filter(t -> t.hasPriority(TaskPriority.HIGH));
        int organized = (int) high.stream()
                .filter(t -> t.hasStatus(TaskStatus.IN_PROGRESS) || t.hasStatus(TaskStatus.COMPLETED))
                .count();
        CoverageDetails details = new CoverageDetails(high.size(), organized);
        boolean completed = !high.isEmpty() && details.isComplete();
        return Evaluation.of(completed,
                "✅ All " + high.size() + " high priority tasks are organized",
                "❌ " + details.unsatisfied() + " high priority tasks still in 'todo' state",
                details);
    }

    /**
     * Every urgent task must be in progress. Holds vacuously when there are none.
     */
    public static Evaluation prioritizeUrgentItems(TaskSnapshot snapshot) {
        List<TaskRecord> urgent = snapshot.filter(t -> t.hasPriority(TaskPriority.URGENT));
        if (urgent.isEmpty()) {
            return Evaluation.passed("✅ No urgent tasks (or create some to complete this task)",
                    new CoverageDetails(0, 0));
        }
        int inProgress = (int) urgent.stream().filter(t -> t.hasStatus(TaskStatus.IN_PROGRESS)).count();
        CoverageDetails details = new CoverageDetails(urgent.size(), inProgress);
        return Evaluation.of(details.isComplete(),
                "✅ All " + urgent.size() + " urgent tasks are in progress",
                "❌ " + details.unsatisfied() + " urgent task(s) not in progress",
                details);
    }

    /**
     * Fails only when a high/urgent task waits in todo while a low priority task is in progress.
     */
    public static Evaluation noLowPriorityInProgress(TaskSnapshot snapshot) {
        int highWaiting = snapshot.count(t -> t.hasStatus(TaskStatus.TODO)
                && (t.hasPriority(TaskPriority.HIGH) || t.hasPriority(TaskPriority.URGENT)));
        int lowInProgress = snapshot.count(t -> t.hasStatus(TaskStatus.IN_PROGRESS)
                && t.hasPriority(TaskPriority.LOW));
        PriorityConflictDetails details = new PriorityConflictDetails(highWaiting, lowInProgress);
        return Evaluation.of(!details.hasConflict(),
                "✅ Priority management optimal",
                "❌ " + lowInProgress + " low priority task(s) in progress while "
                        + highWaiting + " high priority task(s) wait",
                details);
    }
}
