package com.taskenv.verdict;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-assignee flag: does the member hold a todo, an in_progress and a completed task.
 *
 * @param coverage Assignee to coverage flag, in first-seen order
 */
public record CollaborationDetails(Map<String, Boolean> coverage) implements VerdictDetails {

    public CollaborationDetails {
        coverage = Collections.unmodifiableMap(new LinkedHashMap<>(coverage));
    }

    public int members() {
        return coverage.size();
    }

    public int membersMissingStatuses() {
        return (int) coverage.values().stream().filter(covered -> !covered).count();
    }

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("coverage", coverage);
        map.put("members", coverage.size());
        map.put("members_missing_statuses", membersMissingStatuses());
        return map;
    }
}
