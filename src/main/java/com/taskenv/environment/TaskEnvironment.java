package com.taskenv.environment;

import com.taskenv.core.TaskPriority;
import com.taskenv.core.TaskRecord;
import com.taskenv.core.TaskStatus;
import com.taskenv.exception.TaskNotFoundException;
import com.taskenv.observation.Observation;
import com.taskenv.rule.RuleSummary;
import com.taskenv.service.ValidationService;
import com.taskenv.store.InMemoryTaskStore;
import com.taskenv.store.TaskDraft;
import com.taskenv.store.TaskPatch;
import com.taskenv.verdict.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In-process environment: a task store plus the validation service.
 * Every successful mutation is tracked as one action; failed mutations are not.
 * Observations and verdicts always use a fresh snapshot of the store.
 */
public class TaskEnvironment {

    private static final Logger log = LoggerFactory.getLogger(TaskEnvironment.class);

    public static final String CREATE_TASK = "create_task";
    public static final String UPDATE_TASK = "update_task";
    public static final String DELETE_TASK = "delete_task";

    private final InMemoryTaskStore store;
    private final ValidationService validationService;
    private final TaskSeeder seeder;

    public TaskEnvironment(InMemoryTaskStore store, ValidationService validationService, TaskSeeder seeder) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.validationService = Objects.requireNonNull(validationService, "validationService cannot be null");
        this.seeder = Objects.requireNonNull(seeder, "seeder cannot be null");
    }

    /**
     * Seed the store if it is empty. Does not touch the episode.
     */
    public int initialize() {
        return seeder.populate(store);
    }

    public TaskRecord createTask(TaskDraft draft) {
        TaskRecord task = store.create(draft);
        validationService.trackAction(CREATE_TASK, ActionPayloads.created(task));
        return task;
    }

    /**
     * @throws TaskNotFoundException if no task has the id
     */
    public TaskRecord updateTask(long id, TaskPatch patch) {
        TaskRecord task = store.update(id, patch)
                .orElseThrow(() -> new TaskNotFoundException(id));
        validationService.trackAction(UPDATE_TASK, ActionPayloads.updated(id, patch));
        return task;
    }

    /**
     * @throws TaskNotFoundException if no task has the id
     */
    public void deleteTask(long id) {
        if (!store.delete(id)) {
            throw new TaskNotFoundException(id);
        }
        validationService.trackAction(DELETE_TASK, ActionPayloads.deleted(id));
    }

    public Optional<TaskRecord> getTask(long id) {
        return store.findById(id);
    }

    public List<TaskRecord> fetchTasks(TaskStatus statusFilter, TaskPriority priorityFilter) {
        return store.fetchTasks(statusFilter, priorityFilter);
    }

    public Observation observe() {
        return validationService.observe(store.fetchTasks());
    }

    public Verdict validate(String ruleName) {
        return validationService.validate(ruleName, store.fetchTasks());
    }

    public List<RuleSummary> listRules() {
        return validationService.listRules();
    }

    /**
     * Start a new episode: wipe the store, reseed it and reset the episode counters.
     *
     * @return The new episode number
     */
    public int reset() {
        store.clear();
        seeder.populate(store);
        int episode = validationService.reset();
        log.info("Environment reset to episode {} with {} tasks", episode, store.size());
        return episode;
    }
}
