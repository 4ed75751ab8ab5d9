package com.taskenv.service;

import com.taskenv.core.TaskRecord;
import com.taskenv.episode.ActionRecord;
import com.taskenv.observation.Observation;
import com.taskenv.rule.RuleSummary;
import com.taskenv.verdict.Verdict;

import java.util.List;
import java.util.Map;

/**
 * Entry point for the transport layer: observations, rule verdicts and
 * episode bookkeeping. Never mutates task data.
 */
public interface ValidationService {

    /**
     * Build an observation from the given tasks and the current episode counters.
     *
     * @param tasks Task snapshot fetched by the caller
     * @return Observation with group-by counts, completion rate and episode counters
     */
    Observation observe(List<TaskRecord> tasks);

    /**
     * Validate a rule against the given tasks.
     * Each completed verdict adds the rule's reward to the episode, on every call.
     * An unknown rule yields a failing verdict with zero reward rather than an exception.
     *
     * @param ruleName Rule name as listed by {@link #listRules()}
     * @param tasks    Task snapshot fetched by the caller
     * @return Verdict for the rule
     */
    Verdict validate(String ruleName, List<TaskRecord> tasks);

    /**
     * All rules, in catalog order.
     */
    List<RuleSummary> listRules();

    /**
     * Start a new episode. The rule catalog is untouched.
     *
     * @return The new episode number
     */
    int reset();

    /**
     * Record one agent mutation in the current episode.
     *
     * @param type    Action type tag (e.g. "create_task")
     * @param payload Small description of the mutation
     */
    ActionRecord trackAction(String type, Map<String, Object> payload);

    /**
     * Copy of the current episode's action log.
     */
    List<ActionRecord> actionHistory();
}
