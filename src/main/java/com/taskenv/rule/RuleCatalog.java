package com.taskenv.rule;

import com.taskenv.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable registry of rule definitions, keyed by rule name.
 * Built once and shared without synchronization.
 */
public final class RuleCatalog {

    private static final Logger log = LoggerFactory.getLogger(RuleCatalog.class);

    private final Map<String, RuleDefinition> definitions;

    private RuleCatalog(Map<String, RuleDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(definitions);
    }

    /**
     * Catalog holding every {@link Rule}, in declaration order.
     */
    public static RuleCatalog standard() {
        List<RuleDefinition> definitions = Arrays.stream(Rule.values())
                .map(Rule::toDefinition)
                .toList();
        RuleCatalog catalog = of(definitions);
        log.info("RuleCatalog initialized with {} rules", catalog.size());
        return catalog;
    }

    /**
     * Build a catalog from explicit definitions.
     *
     * @throws ConfigurationException on duplicate names or non-positive rewards
     */
    public static RuleCatalog of(Collection<RuleDefinition> definitions) {
        Map<String, RuleDefinition> byName = new LinkedHashMap<>();
        for (RuleDefinition definition : definitions) {
            if (definition.name().isBlank()) {
                throw new ConfigurationException("Rule name cannot be blank");
            }
            if (definition.reward() <= 0) {
                throw new ConfigurationException("Rule '" + definition.name()
                        + "' must have a positive reward, got " + definition.reward());
            }
            if (byName.putIfAbsent(definition.name(), definition) != null) {
                throw new ConfigurationException("Duplicate rule name: " + definition.name());
            }
        }
        return new RuleCatalog(byName);
    }

    public Optional<RuleDefinition> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(definitions.get(name));
    }

    public boolean contains(String name) {
        return name != null && definitions.containsKey(name);
    }

    /**
     * Rule summaries in catalog order. No evaluation happens here.
     */
    public List<RuleSummary> list() {
        return definitions.values().stream()
                .map(RuleDefinition::toSummary)
                .toList();
    }

    public int size() {
        return definitions.size();
    }

    @Override
    public String toString() {
        return "RuleCatalog" + definitions.keySet();
    }
}
