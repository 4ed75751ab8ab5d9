package com.taskenv.rule.impl;

import com.taskenv.core.TaskRecord;
import com.taskenv.core.TaskStatus;
import com.taskenv.verdict.CollaborationDetails;
import com.taskenv.verdict.Evaluation;
import com.taskenv.verdict.WorkloadDetails;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static com.taskenv.core.TaskFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for workload balance and team collaboration.
 */
class TeamRulesTest {

    // ==================== balance_workload ====================

    @ParameterizedTest(name = "{0} vs {1} tasks -> {2}")
    @DisplayName("Workload difference of two passes, three fails")
    @CsvSource({
            "4, 6, true",
            "4, 7, false",
            "3, 3, true",
            "1, 3, true",
            "1, 4, false"
    })
    void balanceBoundary(int aliceTasks, int bobTasks, boolean expected) {
        List<TaskRecord> tasks = new ArrayList<>();
        for (int i = 0; i < aliceTasks; i++) {
            tasks.add(assigned("Alice", TaskStatus.TODO));
        }
        for (int i = 0; i < bobTasks; i++) {
            tasks.add(assigned("Bob", TaskStatus.IN_PROGRESS));
        }

        Evaluation evaluation = TeamRules.balanceWorkload(snapshot(tasks));

        assertEquals(expected, evaluation.completed(), evaluation.feedback());
        WorkloadDetails details = (WorkloadDetails) evaluation.details();
        assertEquals(Math.abs(aliceTasks - bobTasks), details.maxDifference());
        assertEquals(aliceTasks, details.workload().get("Alice"));
    }

    @Test
    @DisplayName("Archived tasks do not count toward workload")
    void archivedIgnored() {
        List<TaskRecord> tasks = new ArrayList<>();
        tasks.add(assigned("Alice", TaskStatus.TODO));
        tasks.add(assigned("Bob", TaskStatus.TODO));
        for (int i = 0; i < 5; i++) {
            tasks.add(assigned("Bob", TaskStatus.ARCHIVED));
        }

        Evaluation evaluation = TeamRules.balanceWorkload(snapshot(tasks));

        assertTrue(evaluation.completed());
        assertEquals(1, ((WorkloadDetails) evaluation.details()).workload().get("Bob"));
    }

    @Test
    @DisplayName("No assigned tasks fails")
    void noAssignees() {
        Evaluation evaluation = TeamRules.balanceWorkload(snapshot(task(TaskStatus.TODO)));

        assertFalse(evaluation.completed());
        assertEquals("❌ No assigned tasks found", evaluation.feedback());
    }

    @Test
    @DisplayName("A single assignee fails")
    void singleAssignee() {
        Evaluation evaluation = TeamRules.balanceWorkload(snapshot(
                assigned("Alice", TaskStatus.TODO),
                assigned("Alice", TaskStatus.TODO)));

        assertFalse(evaluation.completed());
        assertEquals("❌ Need at least 2 team members with tasks", evaluation.feedback());
    }

    // ==================== team_collaboration ====================

    @Test
    @DisplayName("Every member with todo, in_progress and completed passes")
    void fullCollaboration() {
        List<TaskRecord> tasks = new ArrayList<>();
        for (String member : List.of("Alice", "Bob")) {
            tasks.add(assigned(member, TaskStatus.TODO));
            tasks.add(assigned(member, TaskStatus.IN_PROGRESS));
            tasks.add(assigned(member, TaskStatus.COMPLETED));
        }

        Evaluation evaluation = TeamRules.teamCollaboration(snapshot(tasks));

        assertTrue(evaluation.completed(), evaluation.feedback());
    }

    @Test
    @DisplayName("A member missing a status fails and is counted")
    void memberMissingStatus() {
        Evaluation evaluation = TeamRules.teamCollaboration(snapshot(
                assigned("Alice", TaskStatus.TODO),
                assigned("Alice", TaskStatus.IN_PROGRESS),
                assigned("Alice", TaskStatus.COMPLETED),
                assigned("Bob", TaskStatus.TODO),
                assigned("Bob", TaskStatus.ARCHIVED)));

        assertFalse(evaluation.completed());
        CollaborationDetails details = (CollaborationDetails) evaluation.details();
        assertEquals(2, details.members());
        assertEquals(1, details.membersMissingStatuses());
        assertFalse(details.coverage().get("Bob"));
    }

    @Test
    @DisplayName("Collaboration needs at least two members")
    void collaborationNeedsTeam() {
        Evaluation evaluation = TeamRules.teamCollaboration(snapshot(
                assigned("Alice", TaskStatus.TODO),
                assigned("Alice", TaskStatus.IN_PROGRESS),
                assigned("Alice", TaskStatus.COMPLETED)));

        assertFalse(evaluation.completed());
    }
}
