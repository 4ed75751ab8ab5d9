package com.taskenv.service;

import com.taskenv.core.TaskRecord;
import com.taskenv.core.TaskSnapshot;
import com.taskenv.episode.ActionRecord;
import com.taskenv.episode.EpisodeState;
import com.taskenv.observation.Observation;
import com.taskenv.observation.StateAggregator;
import com.taskenv.rule.RuleCatalog;
import com.taskenv.rule.RuleDefinition;
import com.taskenv.rule.RuleSummary;
import com.taskenv.verdict.Evaluation;
import com.taskenv.verdict.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Default implementation of ValidationService.
 * Owns one EpisodeState; the catalog is shared read-only.
 */
public class DefaultValidationService implements ValidationService {

    private static final Logger log = LoggerFactory.getLogger(DefaultValidationService.class);

    private final RuleCatalog catalog;
    private final EpisodeState episode;
    private final StateAggregator aggregator;
    private final Clock clock;

    public DefaultValidationService(RuleCatalog catalog, Clock clock) {
        this.catalog = Objects.requireNonNull(catalog, "catalog cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.episode = new EpisodeState(clock);
        this.aggregator = new StateAggregator();

        log.info("ValidationService initialized with {} rules", catalog.size());
    }

    @Override
    public Observation observe(List<TaskRecord> tasks) {
        Objects.requireNonNull(tasks, "tasks cannot be null");
        return aggregator.observe(tasks, episode.snapshot());
    }

    @Override
    public Verdict validate(String ruleName, List<TaskRecord> tasks) {
        Objects.requireNonNull(tasks, "tasks cannot be null");

        Optional<RuleDefinition> definition = catalog.lookup(ruleName);
        if (definition.isEmpty()) {
            log.warn("Validation requested for unknown rule: {}", ruleName);
            return Verdict.unknownRule(String.valueOf(ruleName));
        }

        RuleDefinition rule = definition.get();
        TaskSnapshot snapshot = TaskSnapshot.of(tasks, clock.instant());
        Evaluation evaluation = rule.evaluate(snapshot);

        // Rewarded on every completed call; no per-episode de-duplication.
        if (evaluation.completed()) {
            double total = episode.addReward(rule.reward());
            log.debug("Rule '{}' completed, +{} (cumulative={})", rule.name(), rule.reward(), total);
        } else {
            log.debug("Rule '{}' not completed: {}", rule.name(), evaluation.feedback());
        }

        return Verdict.of(rule.name(), rule.reward(), evaluation);
    }

    @Override
    public List<RuleSummary> listRules() {
        return catalog.list();
    }

    @Override
    public int reset() {
        return episode.reset();
    }

    @Override
    public ActionRecord trackAction(String type, Map<String, Object> payload) {
        return episode.trackAction(type, payload);
    }

    @Override
    public List<ActionRecord> actionHistory() {
        return episode.actionHistory();
    }
}
