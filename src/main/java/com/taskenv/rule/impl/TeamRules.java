package com.taskenv.rule.impl;

import com.taskenv.core.TaskRecord;
import com.taskenv.core.TaskSnapshot;
import com.taskenv.core.TaskStatus;
import com.taskenv.verdict.CollaborationDetails;
import com.taskenv.verdict.Evaluation;
import com.taskenv.verdict.WorkloadDetails;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Rules over the distribution of work among assignees.
 * Both require at least two distinct assignees.
 */
public final class TeamRules {

    static final int MAX_WORKLOAD_DIFFERENCE = 2;
    static final int MIN_TEAM_SIZE = 2;

    private static final Set<TaskStatus> ACTIVE_STATUSES =
            EnumSet.of(TaskStatus.TODO, TaskStatus.IN_PROGRESS, TaskStatus.COMPLETED);

    private TeamRules() {
    }

    /**
     * Largest and smallest non-archived workloads may differ by at most two.
     */
    public static Evaluation balanceWorkload(TaskSnapshot snapshot) {
        Map<String, Integer> workload = new LinkedHashMap<>();
        for (TaskRecord task : snapshot.tasks()) {
            if (task.isAssigned() && !task.hasStatus(TaskStatus.ARCHIVED)) {
                workload.merge(task.assignee(), 1, Integer::sum);
            }
        }

        if (workload.isEmpty()) {
            return Evaluation.failed("❌ No assigned tasks found", new WorkloadDetails(workload, 0));
        }
        if (workload.size() < MIN_TEAM_SIZE) {
            return Evaluation.failed("❌ Need at least 2 team members with tasks",
                    new WorkloadDetails(workload, 0));
        }

        int maxDiff = Collections.max(workload.values()) - Collections.min(workload.values());
        return Evaluation.of(maxDiff <= MAX_WORKLOAD_DIFFERENCE,
                "✅ Workload balanced (max difference: " + maxDiff + ")",
                "❌ Workload imbalanced (difference: " + maxDiff + ", max allowed: "
                        + MAX_WORKLOAD_DIFFERENCE + ")",
                new WorkloadDetails(workload, maxDiff));
    }

    /**
     * Every assignee must hold a todo, an in_progress and a completed task.
     */
    public static Evaluation teamCollaboration(TaskSnapshot snapshot) {
        Map<String, Set<TaskStatus>> statusesByMember = new LinkedHashMap<>();
        for (TaskRecord task : snapshot.tasks()) {
            if (task.isAssigned()) {
                statusesByMember
                        .computeIfAbsent(task.assignee(), k -> EnumSet.noneOf(TaskStatus.class))
                        .add(task.status());
            }
        }

        Map<String, Boolean> coverage = new LinkedHashMap<>();
        statusesByMember.forEach((member, statuses) -> coverage.put(member, statuses.containsAll(ACTIVE_STATUSES)));
        CollaborationDetails details = new CollaborationDetails(coverage);

        if (details.members() < MIN_TEAM_SIZE) {
            return Evaluation.failed("❌ Need at least 2 team members with tasks", details);
        }
        return Evaluation.of(details.membersMissingStatuses() == 0,
                "✅ Full team collaboration achieved",
                "❌ " + details.membersMissingStatuses() + " team member(s) need tasks in all statuses",
                details);
    }
}
