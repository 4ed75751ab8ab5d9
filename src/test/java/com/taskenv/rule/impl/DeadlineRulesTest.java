package com.taskenv.rule.impl;

import com.taskenv.core.TaskStatus;
import com.taskenv.verdict.CoverageDetails;
import com.taskenv.verdict.Evaluation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static com.taskenv.core.TaskFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for due-date rules against a fixed observation instant.
 */
class DeadlineRulesTest {

    // ==================== clear_overdue_tasks ====================

    @ParameterizedTest(name = "{0} task overdue by a day -> pass={1}")
    @DisplayName("Only open tasks count as overdue")
    @CsvSource({
            "todo, false",
            "in_progress, false",
            "completed, true",
            "archived, true"
    })
    void overdueByStatus(String status, boolean expected) {
        Evaluation evaluation = DeadlineRules.clearOverdueTasks(
                snapshot(dueIn(Duration.ofDays(-1), TaskStatus.fromValue(status))));

        assertEquals(expected, evaluation.completed());
    }

    @Test
    @DisplayName("Tasks due in the future or without a due date are not overdue")
    void notOverdue() {
        Evaluation evaluation = DeadlineRules.clearOverdueTasks(snapshot(
                dueIn(Duration.ofHours(1), TaskStatus.TODO),
                task(TaskStatus.TODO)));

        assertTrue(evaluation.completed());
    }

    @Test
    @DisplayName("Overdue count is reported")
    void overdueCount() {
        Evaluation evaluation = DeadlineRules.clearOverdueTasks(snapshot(
                dueIn(Duration.ofDays(-2), TaskStatus.TODO),
                dueIn(Duration.ofDays(-4), TaskStatus.IN_PROGRESS)));

        assertFalse(evaluation.completed());
        assertEquals("❌ 2 overdue task(s) need attention", evaluation.feedback());
    }

    // ==================== deadline_management ====================

    @ParameterizedTest(name = "todo due in {0}h -> pass={1}")
    @DisplayName("Window covers now through now plus three days")
    @CsvSource({
            "0, false",
            "24, false",
            "72, false",
            "73, true",
            "-1, true"
    })
    void windowBoundaries(long hours, boolean expected) {
        Evaluation evaluation = DeadlineRules.deadlineManagement(
                snapshot(dueIn(Duration.ofHours(hours), TaskStatus.TODO)));

        assertEquals(expected, evaluation.completed(), evaluation.feedback());
    }

    @Test
    @DisplayName("Upcoming tasks in progress or completed are managed")
    void managedDeadlines() {
        Evaluation evaluation = DeadlineRules.deadlineManagement(snapshot(
                dueIn(Duration.ofDays(1), TaskStatus.IN_PROGRESS),
                dueIn(Duration.ofDays(2), TaskStatus.COMPLETED),
                dueIn(Duration.ofDays(10), TaskStatus.TODO)));

        assertTrue(evaluation.completed());
        assertEquals(2, ((CoverageDetails) evaluation.details()).qualifying());
    }

    @Test
    @DisplayName("No upcoming deadlines passes")
    void noUpcoming() {
        Evaluation evaluation = DeadlineRules.deadlineManagement(snapshot(task(TaskStatus.TODO)));

        assertTrue(evaluation.completed());
        assertEquals("✅ No upcoming deadlines", evaluation.feedback());
    }
}
