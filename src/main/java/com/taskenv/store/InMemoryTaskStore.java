package com.taskenv.store;

import com.taskenv.core.TaskPriority;
import com.taskenv.core.TaskRecord;
import com.taskenv.core.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe in-memory task store. Ids are assigned from a sequence and never reused.
 */
public class InMemoryTaskStore implements TaskSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskStore.class);

    private final ConcurrentSkipListMap<Long, TaskRecord> tasks = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong(0);
    private final Clock clock;

    public InMemoryTaskStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public List<TaskRecord> fetchTasks(TaskStatus statusFilter, TaskPriority priorityFilter) {
        return tasks.values().stream()
                .filter(t -> statusFilter == null || t.hasStatus(statusFilter))
                .filter(t -> priorityFilter == null || t.hasPriority(priorityFilter))
                .toList();
    }

    public Optional<TaskRecord> findById(long id) {
        return Optional.ofNullable(tasks.get(id));
    }

    public TaskRecord create(TaskDraft draft) {
        Objects.requireNonNull(draft, "draft cannot be null");
        Instant now = clock.instant();
        return insert(draft, now, now);
    }

    /**
     * Insert with explicit timestamps (used when seeding historical data).
     */
    public TaskRecord insert(TaskDraft draft, Instant createdAt, Instant updatedAt) {
        long id = sequence.incrementAndGet();
        TaskRecord task = TaskRecord.builder()
                .id(id)
                .title(draft.title())
                .description(draft.description())
                .status(draft.status())
                .priority(draft.priority())
                .tags(draft.tags())
                .assignee(draft.assignee())
                .dueDate(draft.dueDate())
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
        tasks.put(id, task);
        log.debug("Created task {} '{}'", id, task.title());
        return task;
    }

    /**
     * Apply a patch to an existing task.
     *
     * @return Updated task, or empty if the id is unknown
     */
    public Optional<TaskRecord> update(long id, TaskPatch patch) {
        Objects.requireNonNull(patch, "patch cannot be null");
        TaskRecord updated = tasks.computeIfPresent(id, (key, existing) -> patch.applyTo(existing, clock.instant()));
        if (updated != null) {
            log.debug("Updated task {}", id);
        }
        return Optional.ofNullable(updated);
    }

    /**
     * @return true if a task was removed
     */
    public boolean delete(long id) {
        boolean removed = tasks.remove(id) != null;
        if (removed) {
            log.debug("Deleted task {}", id);
        }
        return removed;
    }

    /**
     * Remove every task.
     *
     * @return Number of tasks removed
     */
    public int clear() {
        int removed = tasks.size();
        tasks.clear();
        log.info("Cleared {} tasks from store", removed);
        return removed;
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }
}
