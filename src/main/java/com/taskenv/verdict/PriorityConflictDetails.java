package com.taskenv.verdict;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts behind the "low priority work while high priority waits" check.
 *
 * @param highPriorityWaiting   High or urgent tasks still in todo
 * @param lowPriorityInProgress Low priority tasks in progress
 */
public record PriorityConflictDetails(int highPriorityWaiting, int lowPriorityInProgress) implements VerdictDetails {

    public boolean hasConflict() {
        return highPriorityWaiting > 0 && lowPriorityInProgress > 0;
    }

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("high_priority_waiting", highPriorityWaiting);
        map.put("low_priority_in_progress", lowPriorityInProgress);
        return map;
    }
}
