package com.taskenv.rule.impl;

import com.taskenv.core.TaskRecord;
import com.taskenv.core.TaskSnapshot;
import com.taskenv.core.TaskStatus;
import com.taskenv.verdict.CoverageDetails;
import com.taskenv.verdict.Evaluation;
import com.taskenv.verdict.OutstandingDetails;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Rules comparing due dates against the snapshot instant.
 * Tasks without a due date never qualify.
 */
public final class DeadlineRules {

    static final Duration DUE_SOON_WINDOW = Duration.ofDays(3);

    private DeadlineRules() {
    }

    public static Evaluation clearOverdueTasks(TaskSnapshot snapshot) {
        Instant now = snapshot.observedAt();
        int overdue = snapshot.count(t -> t.isOpen() && t.dueDate() != null && t.dueDate().isBefore(now));
        return Evaluation.of(overdue == 0,
                "✅ No overdue tasks remaining",
                "❌ " + overdue + " overdue task(s) need attention",
                new OutstandingDetails(overdue));
    }

    /**
     * Tasks due within [now, now + 3 days] must be in progress or completed.
     */
    public static Evaluation deadlineManagement(TaskSnapshot snapshot) {
        Instant now = snapshot.observedAt();
        Instant horizon = now.plus(DUE_SOON_WINDOW);
        List<TaskRecord> upcoming = snapshot.filter(t -> t.dueDate() != null
                && !t.dueDate().isBefore(now)
                && !t.dueDate().isAfter(horizon));
        if (upcoming.isEmpty()) {
            return Evaluation.passed("✅ No upcoming deadlines", new CoverageDetails(0, 0));
        }
        int managed = (int) upcoming.stream()
                .filter(t -> t.hasStatus(TaskStatus.IN_PROGRESS) || t.hasStatus(TaskStatus.COMPLETED))
                .count();
        CoverageDetails details = new CoverageDetails(upcoming.size(), managed);
        return Evaluation.of(details.isComplete(),
                "✅ All " + upcoming.size() + " upcoming deadlines are managed",
                "❌ " + details.unsatisfied() + " upcoming task(s) not in progress",
                details);
    }
}
