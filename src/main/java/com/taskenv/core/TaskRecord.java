package com.taskenv.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A single task as seen by the feedback engine.
 * Immutable - rules only ever read snapshots of these.
 *
 * @param id          Identifier assigned by the store
 * @param title       Task title
 * @param description Optional free-text description (may be null)
 * @param status      Workflow status
 * @param priority    Priority level
 * @param tags        Ordered tags (never null, may be empty, duplicates allowed)
 * @param assignee    Optional assignee identifier (may be null)
 * @param dueDate     Optional due timestamp (may be null)
 * @param createdAt   Creation timestamp
 * @param updatedAt   Last update timestamp
 */
public record TaskRecord(
        long id,
        String title,
        String description,
        TaskStatus status,
        TaskPriority priority,
        List<String> tags,
        String assignee,
        Instant dueDate,
        Instant createdAt,
        Instant updatedAt
) {
    public TaskRecord {
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(priority, "priority cannot be null");
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * True if the task has a non-empty assignee. Whitespace counts as an assignee.
     */
    public boolean isAssigned() {
        return assignee != null && !assignee.isEmpty();
    }

    /**
     * True while the task still needs work (neither completed nor archived).
     */
    public boolean isOpen() {
        return status != TaskStatus.COMPLETED && status != TaskStatus.ARCHIVED;
    }

    public boolean hasStatus(TaskStatus expected) {
        return status == expected;
    }

    public boolean hasPriority(TaskPriority expected) {
        return priority == expected;
    }

    /**
     * Case-insensitive exact tag match.
     */
    public boolean hasTag(String tag) {
        return tags.stream().anyMatch(t -> t.equalsIgnoreCase(tag));
    }

    /**
     * Case-insensitive match against any of the given tags.
     */
    public boolean hasAnyTag(Collection<String> candidates) {
        return candidates.stream().anyMatch(this::hasTag);
    }

    /**
     * Case-insensitive substring match ("doc" matches "documentation").
     */
    public boolean hasTagContaining(String fragment) {
        String needle = fragment.toLowerCase(Locale.ROOT);
        return tags.stream().anyMatch(t -> t.toLowerCase(Locale.ROOT).contains(needle));
    }

    /**
     * Copy into a builder for modification.
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .title(title)
                .description(description)
                .status(status)
                .priority(priority)
                .tags(tags)
                .assignee(assignee)
                .dueDate(dueDate)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for TaskRecord. Status defaults to todo, priority to medium.
     */
    public static class Builder {
        private long id;
        private String title;
        private String description;
        private TaskStatus status = TaskStatus.TODO;
        private TaskPriority priority = TaskPriority.MEDIUM;
        private final List<String> tags = new ArrayList<>();
        private String assignee;
        private Instant dueDate;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder tags(Collection<String> tags) {
            this.tags.clear();
            if (tags != null) {
                this.tags.addAll(tags);
            }
            return this;
        }

        public Builder assignee(String assignee) {
            this.assignee = assignee;
            return this;
        }

        public Builder dueDate(Instant dueDate) {
            this.dueDate = dueDate;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public TaskRecord build() {
            return new TaskRecord(id, title, description, status, priority,
                    tags, assignee, dueDate, createdAt, updatedAt);
        }
    }
}
