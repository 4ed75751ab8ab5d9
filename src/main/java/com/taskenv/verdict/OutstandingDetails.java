package com.taskenv.verdict;

import java.util.Map;

/**
 * Number of tasks still blocking the rule.
 *
 * @param remaining Offending tasks left in the snapshot
 */
public record OutstandingDetails(int remaining) implements VerdictDetails {

    @Override
    public Map<String, Object> asMap() {
        return Map.of("remaining", remaining);
    }
}
