package com.taskenv.observation;

import com.taskenv.core.TaskPriority;
import com.taskenv.core.TaskRecord;
import com.taskenv.core.TaskStatus;
import com.taskenv.episode.EpisodeSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.taskenv.core.TaskFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StateAggregator.
 */
class StateAggregatorTest {

    private StateAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new StateAggregator();
    }

    @Test
    @DisplayName("Empty board yields zero totals and 0.0 completion")
    void emptyBoard() {
        Observation observation = aggregator.observe(List.of(), new EpisodeSnapshot(0, 0.0, 1));

        assertEquals(0, observation.totalTasks());
        assertEquals(0.0, observation.completionRate());
        assertTrue(observation.tasksByStatus().isEmpty());
        assertTrue(observation.tasksByPriority().isEmpty());
    }

    @Test
    @DisplayName("Counts are grouped by wire value and only present keys appear")
    void groupByCounts() {
        List<TaskRecord> tasks = List.of(
                task(TaskStatus.TODO, TaskPriority.HIGH).build(),
                task(TaskStatus.TODO, TaskPriority.LOW).build(),
                task(TaskStatus.IN_PROGRESS, TaskPriority.HIGH).build(),
                task(TaskStatus.COMPLETED, TaskPriority.URGENT).build());

        Observation observation = aggregator.observe(tasks, new EpisodeSnapshot(3, 25.0, 2));

        assertEquals(4, observation.totalTasks());
        assertEquals(2, observation.statusCount("todo"));
        assertEquals(1, observation.statusCount("in_progress"));
        assertFalse(observation.tasksByStatus().containsKey("archived"));
        assertEquals(2, observation.priorityCount("high"));
        assertEquals(0, observation.priorityCount("medium"));
        assertEquals(25.0, observation.completionRate());
        assertEquals(3, observation.actionsTaken());
        assertEquals(25.0, observation.cumulativeReward());
        assertEquals(2, observation.episodeNumber());
    }

    @ParameterizedTest
    @DisplayName("Completion rate stays within 0 and 100")
    @CsvSource({
            "0, 0, 0.0",
            "0, 3, 0.0",
            "1, 3, 33.333333",
            "3, 3, 100.0"
    })
    void completionRateRange(int completed, int total, double expected) {
        double rate = StateAggregator.completionRate(completed, total);

        assertEquals(expected, rate, 0.0001);
        assertTrue(rate >= 0.0 && rate <= 100.0);
    }

    @Test
    @DisplayName("Observation maps are read-only")
    void observationImmutable() {
        Observation observation = aggregator.observe(List.of(task(TaskStatus.TODO)), new EpisodeSnapshot(0, 0.0, 1));

        assertThrows(UnsupportedOperationException.class, () -> observation.tasksByStatus().put("todo", 9));
    }
}
