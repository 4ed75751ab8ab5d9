package com.taskenv.verdict;

import java.util.Map;

/**
 * Rule-specific diagnostic payload attached to a verdict.
 * Each shape carries the counts its rule's predicate was decided on.
 */
public interface VerdictDetails {

    /**
     * Render the diagnostics as an ordered key/value map (for logs and transport).
     */
    Map<String, Object> asMap();
}
