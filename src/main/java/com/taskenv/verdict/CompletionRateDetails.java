package com.taskenv.verdict;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Completion percentage of the snapshot.
 *
 * @param completionRate Percentage in [0, 100]
 * @param completed      Tasks with status completed
 * @param total          All tasks
 */
public record CompletionRateDetails(double completionRate, int completed, int total) implements VerdictDetails {

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("completion_rate", completionRate);
        map.put("completed", completed);
        map.put("total", total);
        return map;
    }
}
