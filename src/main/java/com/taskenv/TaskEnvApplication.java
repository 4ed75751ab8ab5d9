package com.taskenv;

import com.taskenv.core.TaskPriority;
import com.taskenv.core.TaskRecord;
import com.taskenv.core.TaskStatus;
import com.taskenv.environment.ActionPayloads;
import com.taskenv.environment.TaskEnvironment;
import com.taskenv.exception.TaskNotFoundException;
import com.taskenv.observation.Observation;
import com.taskenv.rule.RuleSummary;
import com.taskenv.spring.EnableTaskEnvironment;
import com.taskenv.store.TaskDraft;
import com.taskenv.store.TaskPatch;
import com.taskenv.verdict.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.ArrayList;
import java.util.List;

/**
 * Example Spring Boot application running one scripted episode.
 */
@SpringBootApplication
@EnableTaskEnvironment
public class TaskEnvApplication {

    private static final Logger log = LoggerFactory.getLogger(TaskEnvApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TaskEnvApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(TaskEnvironment environment) {
        return args -> {
            log.info("=== Task Environment Demo Started ===");

            for (RuleSummary rule : environment.listRules()) {
                log.info("Rule {} [{}] reward={}: {}",
                        rule.name(), rule.difficulty(), rule.reward(), rule.description());
            }

            log.info("Initial observation:\n{}", ActionPayloads.toJson(environment.observe()));

            // Create an urgent task and start working on it
            TaskRecord urgent = environment.createTask(new TaskDraft(
                    "Investigate production outage", "Error rate spiked after the last deploy",
                    TaskStatus.TODO, TaskPriority.URGENT, List.of("bug", "backend"), "Alice Chen", null));
            environment.updateTask(urgent.id(), TaskPatch.status(TaskStatus.IN_PROGRESS));

            // Finish whatever else is in progress and mark it reviewed
            for (TaskRecord task : environment.fetchTasks(TaskStatus.IN_PROGRESS, null)) {
                if (task.id() != urgent.id()) {
                    environment.updateTask(task.id(), TaskPatch.status(TaskStatus.COMPLETED));
                    List<String> tags = new ArrayList<>(task.tags());
                    tags.add("reviewed");
                    environment.updateTask(task.id(), TaskPatch.tags(tags));
                }
            }

            // Archived work no longer needs an owner; open work does
            for (TaskRecord task : environment.fetchTasks(TaskStatus.ARCHIVED, null)) {
                if (task.isAssigned()) {
                    environment.updateTask(task.id(), TaskPatch.unassign());
                }
            }
            for (TaskRecord task : environment.fetchTasks(TaskStatus.TODO, null)) {
                if (!task.isAssigned()) {
                    environment.updateTask(task.id(), TaskPatch.assignee("Bob Smith"));
                }
            }

            try {
                environment.deleteTask(Long.MAX_VALUE);
            } catch (TaskNotFoundException e) {
                log.info("Delete of task {} rejected: {}", e.getTaskId(), e.getMessage());
            }

            for (String ruleName : List.of("create_urgent_task", "complete_three_tasks",
                    "prioritize_urgent_items", "balance_workload", "no_such_rule")) {
                Verdict verdict = environment.validate(ruleName);
                log.info("{} -> completed={} reward={} | {} {}", verdict.ruleName(),
                        verdict.completed(), verdict.reward(), verdict.feedback(), verdict.detailsAsMap());
            }

            environment.getTask(urgent.id()).ifPresent(task ->
                    log.info("Urgent task is {} (assignee={})", task.status(), task.assignee()));

            Observation observation = environment.observe();
            log.info("Board: {} completed, {} in progress, {} urgent",
                    observation.statusCount(TaskStatus.COMPLETED.value()),
                    observation.statusCount(TaskStatus.IN_PROGRESS.value()),
                    observation.priorityCount(TaskPriority.URGENT.value()));
            log.info("Observation after episode:\n{}", ActionPayloads.toJson(observation));

            int episode = environment.reset();
            log.info("=== Environment reset, now at episode {} ===", episode);
        };
    }
}
