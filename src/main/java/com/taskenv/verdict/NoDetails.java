package com.taskenv.verdict;

import java.util.Map;

/**
 * Empty diagnostics, used when there is nothing to report (e.g. unknown rule).
 */
public final class NoDetails implements VerdictDetails {

    public static final NoDetails INSTANCE = new NoDetails();

    private NoDetails() {
    }

    @Override
    public Map<String, Object> asMap() {
        return Map.of();
    }

    @Override
    public String toString() {
        return "NoDetails";
    }
}
