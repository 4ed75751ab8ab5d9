package com.taskenv.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.taskenv.core.TaskPriority;
import com.taskenv.core.TaskRecord;
import com.taskenv.core.TaskStatus;

import java.time.Instant;
import java.util.List;

/**
 * Partial update of a task. Null fields are left unchanged.
 * The optional fields (description, assignee, due date) can also be cleared
 * explicitly with the matching {@code ...Cleared} flag.
 *
 * @param descriptionCleared Remove the description
 * @param assigneeCleared    Unassign the task
 * @param dueDateCleared     Remove the due date
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskPatch(
        String title,
        String description,
        TaskStatus status,
        TaskPriority priority,
        List<String> tags,
        String assignee,
        Instant dueDate,
        @JsonIgnore boolean descriptionCleared,
        @JsonIgnore boolean assigneeCleared,
        @JsonIgnore boolean dueDateCleared
) {
    public TaskPatch {
        if (title != null && title.isBlank()) {
            throw new IllegalArgumentException("Task title cannot be blank");
        }
        if (title != null && title.length() > TaskDraft.MAX_TITLE_LENGTH) {
            throw new IllegalArgumentException("Task title exceeds " + TaskDraft.MAX_TITLE_LENGTH + " characters");
        }
        requireNotBoth("description", description != null, descriptionCleared);
        requireNotBoth("assignee", assignee != null, assigneeCleared);
        requireNotBoth("dueDate", dueDate != null, dueDateCleared);
        tags = tags == null ? null : List.copyOf(tags);
    }

    /**
     * Patch that only sets values; nothing is cleared.
     */
    public TaskPatch(String title, String description, TaskStatus status, TaskPriority priority,
                     List<String> tags, String assignee, Instant dueDate) {
        this(title, description, status, priority, tags, assignee, dueDate, false, false, false);
    }

    public static TaskPatch status(TaskStatus status) {
        return new TaskPatch(null, null, status, null, null, null, null);
    }

    public static TaskPatch assignee(String assignee) {
        return new TaskPatch(null, null, null, null, null, assignee, null);
    }

    public static TaskPatch tags(List<String> tags) {
        return new TaskPatch(null, null, null, null, tags, null, null);
    }

    public static TaskPatch unassign() {
        return new TaskPatch(null, null, null, null, null, null, null, false, true, false);
    }

    /**
     * Apply the patch to a task, stamping the update time.
     */
    public TaskRecord applyTo(TaskRecord task, Instant updatedAt) {
        TaskRecord.Builder builder = task.toBuilder().updatedAt(updatedAt);
        if (title != null) {
            builder.title(title);
        }
        if (description != null || descriptionCleared) {
            builder.description(description);
        }
        if (status != null) {
            builder.status(status);
        }
        if (priority != null) {
            builder.priority(priority);
        }
        if (tags != null) {
            builder.tags(tags);
        }
        if (assignee != null || assigneeCleared) {
            builder.assignee(assignee);
        }
        if (dueDate != null || dueDateCleared) {
            builder.dueDate(dueDate);
        }
        return builder.build();
    }

    private static void requireNotBoth(String field, boolean set, boolean cleared) {
        if (set && cleared) {
            throw new IllegalArgumentException("Cannot both set and clear " + field);
        }
    }
}
