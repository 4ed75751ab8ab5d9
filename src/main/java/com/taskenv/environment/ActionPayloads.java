package com.taskenv.environment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.taskenv.core.TaskRecord;
import com.taskenv.store.TaskPatch;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the small payloads attached to tracked actions.
 * Timestamps render as ISO-8601 strings and enums as their wire values.
 */
public final class ActionPayloads {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private ActionPayloads() {
    }

    public static Map<String, Object> created(TaskRecord task) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_id", task.id());
        payload.put("title", task.title());
        payload.put("priority", task.priority().value());
        return payload;
    }

    /**
     * Payload for an update: the task id plus only the fields the patch touches.
     * Cleared fields appear with a null value.
     */
    public static Map<String, Object> updated(long taskId, TaskPatch patch) {
        Map<String, Object> updates = new LinkedHashMap<>(objectMapper.convertValue(patch, MAP_TYPE));
        if (patch.descriptionCleared()) {
            updates.put("description", null);
        }
        if (patch.assigneeCleared()) {
            updates.put("assignee", null);
        }
        if (patch.dueDateCleared()) {
            updates.put("dueDate", null);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_id", taskId);
        payload.put("updates", updates);
        return payload;
    }

    public static Map<String, Object> deleted(long taskId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_id", taskId);
        return payload;
    }

    /**
     * Render any value (observation, verdict) as pretty JSON for logs.
     */
    public static String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot render value as JSON: " + e.getOriginalMessage(), e);
        }
    }
}
