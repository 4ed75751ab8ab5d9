package com.taskenv.verdict;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Open workload per assignee.
 *
 * @param workload      Assignee to number of non-archived tasks, in first-seen order
 * @param maxDifference Largest minus smallest workload (0 when fewer than two assignees)
 */
public record WorkloadDetails(Map<String, Integer> workload, int maxDifference) implements VerdictDetails {

    public WorkloadDetails {
        workload = Collections.unmodifiableMap(new LinkedHashMap<>(workload));
    }

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("workload", workload);
        map.put("assignees", workload.size());
        map.put("max_difference", maxDifference);
        return map;
    }
}
