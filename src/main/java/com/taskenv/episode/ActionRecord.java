package com.taskenv.episode;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of the episode's action log.
 *
 * @param type      Action type tag (e.g. "create_task")
 * @param payload   Small description of the mutation
 * @param timestamp When the action was tracked
 */
public record ActionRecord(String type, Map<String, Object> payload, Instant timestamp) {

    public ActionRecord {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
