package com.taskenv.rule.impl;

import com.taskenv.core.TaskRecord;
import com.taskenv.core.TaskSnapshot;
import com.taskenv.core.TaskStatus;
import com.taskenv.verdict.CoverageDetails;
import com.taskenv.verdict.Evaluation;
import com.taskenv.verdict.OutstandingDetails;

/**
 * Rules about task bookkeeping: assignment, tagging, archiving.
 * Rules that require "every task" fail on an empty board.
 */
public final class OrganizationRules {

    static final int MIN_TAGS = 2;

    private OrganizationRules() {
    }

    public static Evaluation assignAllTasks(TaskSnapshot snapshot) {
        int assigned = snapshot.count(TaskRecord::isAssigned);
        CoverageDetails details = new CoverageDetails(snapshot.size(), assigned);
        boolean completed = !snapshot.isEmpty() && details.isComplete();
        return Evaluation.of(completed,
                "✅ All tasks are assigned",
                "❌ " + details.unsatisfied() + " task(s) need assignment",
                details);
    }

    public static Evaluation organizeWithTags(TaskSnapshot snapshot) {
        int tagged = snapshot.count(t -> t.tags().size() >= MIN_TAGS);
        CoverageDetails details = new CoverageDetails(snapshot.size(), tagged);
        boolean completed = !snapshot.isEmpty() && details.isComplete();
        return Evaluation.of(completed,
                "✅ All tasks have 2+ tags",
                "❌ " + details.unsatisfied() + " task(s) need more tags",
                details);
    }

    /**
     * Every task needs an assignee, at least two tags and a due date.
     */
    public static Evaluation perfectOrganization(TaskSnapshot snapshot) {
        if (snapshot.isEmpty()) {
            return Evaluation.failed("❌ No tasks exist", new CoverageDetails(0, 0));
        }
        int organized = snapshot.count(t -> t.isAssigned()
                && t.tags().size() >= MIN_TAGS
                && t.dueDate() != null);
        CoverageDetails details = new CoverageDetails(snapshot.size(), organized);
        return Evaluation.of(details.isComplete(),
                "✅ All " + snapshot.size() + " tasks are perfectly organized",
                "❌ " + details.unsatisfied() + " task(s) need: assignee, 2+ tags, and due date",
                details);
    }

    public static Evaluation archiveCompleted(TaskSnapshot snapshot) {
        int notArchived = snapshot.countByStatus(TaskStatus.COMPLETED);
        return Evaluation.of(notArchived == 0,
                "✅ All completed tasks are archived",
                "❌ " + notArchived + " completed task(s) need archiving",
                new OutstandingDetails(notArchived));
    }

    public static Evaluation cleanSlate(TaskSnapshot snapshot) {
        int archived = snapshot.countByStatus(TaskStatus.ARCHIVED);
        CoverageDetails details = new CoverageDetails(snapshot.size(), archived);
        boolean completed = !snapshot.isEmpty() && details.isComplete();
        return Evaluation.of(completed,
                "✅ Clean slate achieved - all tasks archived",
                "❌ " + details.unsatisfied() + " task(s) still active (archive or complete them)",
                details);
    }
}
