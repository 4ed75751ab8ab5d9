package com.taskenv.store;

import com.taskenv.core.TaskPriority;
import com.taskenv.core.TaskStatus;

import java.time.Instant;
import java.util.List;

/**
 * Input for creating a task. Status defaults to todo and priority to medium.
 */
public record TaskDraft(
        String title,
        String description,
        TaskStatus status,
        TaskPriority priority,
        List<String> tags,
        String assignee,
        Instant dueDate
) {
    static final int MAX_TITLE_LENGTH = 200;

    public TaskDraft {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Task title cannot be blank");
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new IllegalArgumentException("Task title exceeds " + MAX_TITLE_LENGTH + " characters");
        }
        status = status == null ? TaskStatus.TODO : status;
        priority = priority == null ? TaskPriority.MEDIUM : priority;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static TaskDraft of(String title, TaskStatus status, TaskPriority priority) {
        return new TaskDraft(title, null, status, priority, List.of(), null, null);
    }
}
