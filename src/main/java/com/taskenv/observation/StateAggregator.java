package com.taskenv.observation;

import com.taskenv.core.TaskRecord;
import com.taskenv.core.TaskStatus;
import com.taskenv.episode.EpisodeSnapshot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes group-by statistics over a task snapshot and merges them with the
 * episode counters. Stateless.
 */
public class StateAggregator {

    public Observation observe(List<TaskRecord> tasks, EpisodeSnapshot episode) {
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        Map<String, Integer> byPriority = new LinkedHashMap<>();
        for (TaskRecord task : tasks) {
            byStatus.merge(task.status().value(), 1, Integer::sum);
            byPriority.merge(task.priority().value(), 1, Integer::sum);
        }

        int total = tasks.size();
        int completed = byStatus.getOrDefault(TaskStatus.COMPLETED.value(), 0);

        return new Observation(
                total,
                byStatus,
                byPriority,
                completionRate(completed, total),
                episode.actionsTaken(),
                episode.cumulativeReward(),
                episode.episodeNumber());
    }

    /**
     * Percentage of completed tasks; 0.0 when there are no tasks.
     */
    static double completionRate(int completed, int total) {
        return total > 0 ? completed * 100.0 / total : 0.0;
    }
}
