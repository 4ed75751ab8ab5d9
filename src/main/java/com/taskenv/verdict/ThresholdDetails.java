package com.taskenv.verdict;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single count compared against a fixed threshold.
 *
 * @param count  Observed count
 * @param target Threshold the count is compared against (minimum or maximum, per rule)
 */
public record ThresholdDetails(int count, int target) implements VerdictDetails {

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("count", count);
        map.put("target", target);
        return map;
    }
}
