package com.taskenv.store;

import com.taskenv.core.TaskPriority;
import com.taskenv.core.TaskRecord;
import com.taskenv.core.TaskStatus;

import java.util.List;

/**
 * Read-only snapshot query against the task store.
 */
public interface TaskSource {

    /**
     * Fetch tasks, optionally filtered.
     *
     * @param statusFilter   Only tasks with this status, or null for any
     * @param priorityFilter Only tasks with this priority, or null for any
     * @return Immutable list ordered by task id
     */
    List<TaskRecord> fetchTasks(TaskStatus statusFilter, TaskPriority priorityFilter);

    /**
     * Fetch every task.
     */
    default List<TaskRecord> fetchTasks() {
        return fetchTasks(null, null);
    }
}
