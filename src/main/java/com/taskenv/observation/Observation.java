package com.taskenv.observation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Environment observation handed to the agent.
 *
 * @param totalTasks       Number of tasks in the snapshot
 * @param tasksByStatus    Status wire value to count (only statuses present)
 * @param tasksByPriority  Priority wire value to count (only priorities present)
 * @param completionRate   100 * completed / total, or 0.0 for an empty snapshot
 * @param actionsTaken     Actions tracked in the current episode
 * @param cumulativeReward Reward accumulated in the current episode
 * @param episodeNumber    Current episode number
 */
public record Observation(
        int totalTasks,
        Map<String, Integer> tasksByStatus,
        Map<String, Integer> tasksByPriority,
        double completionRate,
        int actionsTaken,
        double cumulativeReward,
        int episodeNumber
) {
    public Observation {
        tasksByStatus = Collections.unmodifiableMap(new LinkedHashMap<>(tasksByStatus));
        tasksByPriority = Collections.unmodifiableMap(new LinkedHashMap<>(tasksByPriority));
    }

    public int statusCount(String status) {
        return tasksByStatus.getOrDefault(status, 0);
    }

    public int priorityCount(String priority) {
        return tasksByPriority.getOrDefault(priority, 0);
    }
}
