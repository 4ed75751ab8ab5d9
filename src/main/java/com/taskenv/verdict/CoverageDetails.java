package com.taskenv.verdict;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How many tasks of a qualifying subset satisfy the rule's requirement.
 *
 * @param qualifying Size of the subset the rule inspects
 * @param satisfying Members of that subset meeting the requirement
 */
public record CoverageDetails(int qualifying, int satisfying) implements VerdictDetails {

    public int unsatisfied() {
        return qualifying - satisfying;
    }

    public boolean isComplete() {
        return satisfying == qualifying;
    }

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("qualifying", qualifying);
        map.put("satisfying", satisfying);
        map.put("unsatisfied", unsatisfied());
        return map;
    }
}
