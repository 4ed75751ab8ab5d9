package com.taskenv.verdict;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pipeline stage counts.
 */
public record FlowDetails(int todo, int inProgress, int completed) implements VerdictDetails {

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("todo", todo);
        map.put("in_progress", inProgress);
        map.put("completed", completed);
        return map;
    }
}
