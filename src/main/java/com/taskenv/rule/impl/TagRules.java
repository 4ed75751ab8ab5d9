package com.taskenv.rule.impl;

import com.taskenv.core.TaskRecord;
import com.taskenv.core.TaskSnapshot;
import com.taskenv.core.TaskStatus;
import com.taskenv.verdict.CoverageDetails;
import com.taskenv.verdict.Evaluation;
import com.taskenv.verdict.OutstandingDetails;
import com.taskenv.verdict.ThresholdDetails;

import java.util.List;
import java.util.Set;

/**
 * Rules keyed on task tags. All tag matching is case-insensitive.
 */
public final class TagRules {

    static final int SPRINT_BACKLOG_TARGET = 5;
    static final Set<String> DEBT_TAGS = Set.of("refactor", "technical-debt", "debt");
    static final Set<String> QA_TAGS = Set.of("tested", "reviewed", "qa", "approved");

    private TagRules() {
    }

    /**
     * Counts assigned tasks with any tag containing "sprint" (sprint-1, Sprint, ...).
     */
    public static Evaluation createSprintBacklog(TaskSnapshot snapshot) {
        int sprintTasks = snapshot.count(t -> t.hasTagContaining("sprint") && t.isAssigned());
        return Evaluation.of(sprintTasks >= SPRINT_BACKLOG_TARGET,
                "✅ Sprint backlog created with " + sprintTasks + " tasks",
                "❌ Only " + sprintTasks + " sprint tasks created (need " + SPRINT_BACKLOG_TARGET + "+)",
                new ThresholdDetails(sprintTasks, SPRINT_BACKLOG_TARGET));
    }

    public static Evaluation eliminateTechnicalDebt(TaskSnapshot snapshot) {
        int remaining = snapshot.count(t -> t.isOpen() && t.hasAnyTag(DEBT_TAGS));
        return Evaluation.of(remaining == 0,
                "✅ All technical debt eliminated",
                "❌ " + remaining + " technical debt task(s) remaining",
                new OutstandingDetails(remaining));
    }

    public static Evaluation achieveZeroBugs(TaskSnapshot snapshot) {
        int openBugs = snapshot.count(t -> t.isOpen() && t.hasTag("bug"));
        return Evaluation.of(openBugs == 0,
                "✅ Zero bugs! All bug tasks resolved",
                "❌ " + openBugs + " bug(s) still open",
                new OutstandingDetails(openBugs));
    }

    /**
     * Every completed task must carry a QA tag. Fails when nothing is completed.
     */
    public static Evaluation qualityAssurance(TaskSnapshot snapshot) {
        List<TaskRecord> completed = snapshot.filter(t -> t.hasStatus(TaskStatus.COMPLETED));
        if (completed.isEmpty()) {
            return Evaluation.failed("❌ No completed tasks to validate", new CoverageDetails(0, 0));
        }
        int withQa = (int) completed.stream().filter(t -> t.hasAnyTag(QA_TAGS)).count();
        CoverageDetails details = new CoverageDetails(completed.size(), withQa);
        return Evaluation.of(details.isComplete(),
                "✅ All " + completed.size() + " completed tasks have QA tags",
                "❌ " + details.unsatisfied() + " completed task(s) missing QA tags",
                details);
    }

    public static Evaluation featureCompletion(TaskSnapshot snapshot) {
        List<TaskRecord> features = snapshot.filter(t -> t.hasTag("feature"));
        if (features.isEmpty()) {
            return Evaluation.passed("✅ No feature tasks exist", new CoverageDetails(0, 0));
        }
        CoverageDetails details = completedCoverage(features);
        return Evaluation.of(details.isComplete(),
                "✅ All " + features.size() + " features completed",
                "❌ " + details.unsatisfied() + " feature(s) still in progress",
                details);
    }

    /**
     * Any tag containing "doc" counts (doc, docs, documentation).
     */
    public static Evaluation documentationComplete(TaskSnapshot snapshot) {
        List<TaskRecord> docs = snapshot.filter(t -> t.hasTagContaining("doc"));
        if (docs.isEmpty()) {
            return Evaluation.passed("✅ No documentation tasks exist", new CoverageDetails(0, 0));
        }
        CoverageDetails details = completedCoverage(docs);
        return Evaluation.of(details.isComplete(),
                "✅ All " + docs.size() + " documentation tasks completed",
                "❌ " + details.unsatisfied() + " documentation task(s) incomplete",
                details);
    }

    private static CoverageDetails completedCoverage(List<TaskRecord> tasks) {
        int completed = (int) tasks.stream().filter(t -> t.hasStatus(TaskStatus.COMPLETED)).count();
        return new CoverageDetails(tasks.size(), completed);
    }
}
