package io.casengine.core.rules;

import io.casengine.core.spi.RewriteRule;
import io.casengine.core.spi.RuleCategory;
import io.casengine.core.spi.RuleStage;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of rewrite rules, keyed by rule id. Rules are returned in registration order, which is
 * the order the simplifier tries them within a category. Thread-safe: registration and lookup
 * synchronise on the registry; lookups return snapshots.
 */
public final class RuleRegistry {

    private final Map<String, RewriteRule> rules = new LinkedHashMap<>();

    /** A registry holding every built-in rule. */
    public static RuleRegistry standard() {
        RuleRegistry registry = new RuleRegistry();
        ArithmeticRules.all().forEach(registry::register);
        AlgebraicRules.all().forEach(registry::register);
        TrigonometricRules.all().forEach(registry::register);
        ExponentialRules.all().forEach(registry::register);
        LogarithmicRules.all().forEach(registry::register);
        return registry;
    }

    /**
     * Registers a rule. If a rule with the same id is already registered, it is replaced in place
     * (last-write-wins semantics, original position kept).
     *
     * @param rule the rule to register
     * @throws NullPointerException if rule is null
     * @throws IllegalArgumentException if rule.id() is null or empty
     */
    public synchronized void register(RewriteRule rule) {
        if (rule == null) {
            throw new NullPointerException("rule must not be null");
        }
        String id = rule.id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("rule id must not be null or empty");
        }
        rules.put(id, rule);
    }

    /** Rules of one category and stage, in registration order. */
    public synchronized List<RewriteRule> rules(RuleCategory category, RuleStage stage) {
        List<RewriteRule> out = new ArrayList<>();
        for (RewriteRule rule : rules.values()) {
            if (rule.category() == category && rule.stage() == stage) {
                out.add(rule);
            }
        }
        return out;
    }

    /** All rules, in registration order. */
    public synchronized List<RewriteRule> rules() {
        return List.copyOf(rules.values());
    }

    /**
     * Looks up a rule by id.
     *
     * @param ruleId the rule identifier (e.g. "combine-like-terms")
     * @return the rule, or empty if not registered
     */
    public synchronized Optional<RewriteRule> getRule(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    /**
     * Looks up a rule by id, throwing if not found.
     *
     * @throws IllegalArgumentException if no rule is registered with the given id
     */
    public RewriteRule requireRule(String ruleId) {
        return getRule(ruleId)
                .orElseThrow(() -> new IllegalArgumentException("No rewrite rule registered for id: '" + ruleId + "'"));
    }

    /** Returns the number of registered rules. */
    public synchronized int size() {
        return rules.size();
    }

    /** Returns {@code true} if a rule with the given id is registered. */
    public synchronized boolean hasRule(String ruleId) {
        return rules.containsKey(ruleId);
    }
}
