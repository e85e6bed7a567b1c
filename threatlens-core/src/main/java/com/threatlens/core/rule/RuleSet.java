package com.threatlens.core.rule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Immutable, ordered catalog of {@link Rule}s.
 *
 * <p>The default catalog is discovered once via {@link ServiceLoader}; registration order in
 * {@code META-INF/services/com.threatlens.core.rule.Rule} is the evaluation order. Rule ids
 * must be unique.
 *
 * <p>A {@code RuleSet} holds no mutable state and can be shared by concurrent scans.
 */
public final class RuleSet {

    private static final Logger log = LoggerFactory.getLogger(RuleSet.class);

    private final List<Rule> rules;
    private final Set<String> ids;

    private RuleSet(List<Rule> rules) {
        Set<String> seen = new LinkedHashSet<>();
        for (Rule rule : rules) {
            Objects.requireNonNull(rule, "rule must not be null");
            if (!seen.add(rule.getId())) {
                throw new IllegalArgumentException("Duplicate rule id: " + rule.getId());
            }
        }
        this.rules = List.copyOf(rules);
        this.ids = Set.copyOf(seen);
    }

    /**
     * Creates a rule set from explicit rules, preserving their order.
     *
     * @param rules rules to evaluate
     * @return rule set
     * @throws IllegalArgumentException if two rules share an id
     */
    public static RuleSet of(List<? extends Rule> rules) {
        return new RuleSet(new ArrayList<>(rules));
    }

    /**
     * Discovers all rules registered via SPI.
     *
     * @return rule set in registration order
     */
    public static RuleSet loadDefault() {
        log.debug("Discovering rules via ServiceLoader");
        List<Rule> discovered = new ArrayList<>();
        ServiceLoader.load(Rule.class).forEach(discovered::add);

        RuleSet ruleSet = new RuleSet(discovered);
        log.debug("Discovered {} rules: {}", ruleSet.rules.size(), ruleSet.rules);
        return ruleSet;
    }

    /**
     * Returns the rules in evaluation order.
     *
     * @return unmodifiable rule list
     */
    public List<Rule> rules() {
        return rules;
    }

    /**
     * Returns true if a rule with this id is part of the set.
     *
     * @param ruleId rule id
     * @return true if registered
     */
    public boolean contains(String ruleId) {
        return ids.contains(ruleId);
    }

    /**
     * Returns the number of rules.
     *
     * @return rule count
     */
    public int size() {
        return rules.size();
    }
}
