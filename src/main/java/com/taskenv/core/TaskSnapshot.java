package com.taskenv.core;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Read-only view of the task collection at the moment of evaluation.
 * Rules that compare against "now" use {@link #observedAt()}, which keeps
 * evaluation a pure function of the snapshot.
 *
 * @param tasks      Tasks in store order
 * @param observedAt Instant the snapshot was taken
 */
public record TaskSnapshot(List<TaskRecord> tasks, Instant observedAt) {

    public TaskSnapshot {
        tasks = List.copyOf(Objects.requireNonNull(tasks, "tasks cannot be null"));
        Objects.requireNonNull(observedAt, "observedAt cannot be null");
    }

    public static TaskSnapshot of(List<TaskRecord> tasks, Instant observedAt) {
        return new TaskSnapshot(tasks, observedAt);
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    public List<TaskRecord> filter(Predicate<TaskRecord> predicate) {
        return tasks.stream().filter(predicate).toList();
    }

    public int count(Predicate<TaskRecord> predicate) {
        return (int) tasks.stream().filter(predicate).count();
    }

    public int countByStatus(TaskStatus status) {
        return count(t -> t.hasStatus(status));
    }
}
