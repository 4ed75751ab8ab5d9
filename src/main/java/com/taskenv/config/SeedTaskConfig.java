package com.taskenv.config;

import com.taskenv.core.TaskPriority;
import com.taskenv.core.TaskStatus;
import com.taskenv.store.TaskDraft;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A task to place in the store at the start of every episode.
 *
 * @param title          Task title
 * @param description    Optional description
 * @param status         Initial status
 * @param priority       Initial priority
 * @param tags           Tags
 * @param assignee       Optional assignee
 * @param dueInDays      Due date relative to seeding time (negative = overdue), null for none
 * @param createdDaysAgo How long ago the task was created (0 = at seeding time)
 */
public record SeedTaskConfig(
        String title,
        String description,
        TaskStatus status,
        TaskPriority priority,
        List<String> tags,
        String assignee,
        Integer dueInDays,
        int createdDaysAgo
) {
    public SeedTaskConfig {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public TaskDraft toDraft(Instant seededAt) {
        Instant dueDate = dueInDays == null ? null : seededAt.plus(Duration.ofDays(dueInDays));
        return new TaskDraft(title, description, status, priority, tags, assignee, dueDate);
    }

    public Instant createdAt(Instant seededAt) {
        return seededAt.minus(Duration.ofDays(createdDaysAgo));
    }
}
