package com.tangle.resolution.rule;

import com.tangle.tree.node.NodeKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Rules keyed by node kind. Kinds without an entry get no computed answer.
 */
public final class RuleTable {

    private static final RuleTable EMPTY = new RuleTable(new EnumMap<>(NodeKind.class));

    private final Map<NodeKind, Rule> rules;

    private RuleTable(EnumMap<NodeKind, Rule> rules) {
        this.rules = Collections.unmodifiableMap(rules);
    }

    public static RuleTable empty() {
        return EMPTY;
    }

    public static RuleTable of(Map<NodeKind, Rule> rules) {
        EnumMap<NodeKind, Rule> copy = new EnumMap<>(NodeKind.class);
        rules.forEach((k, r) -> copy.put(Objects.requireNonNull(k, "kind"), Objects.requireNonNull(r, "rule")));
        return new RuleTable(copy);
    }

    /** Rule for the kind, or null when the table has none. */
    public Rule get(NodeKind kind) {
        return rules.get(kind);
    }

    public boolean contains(NodeKind kind) {
        return rules.containsKey(kind);
    }

    public int size() {
        return rules.size();
    }

    public Map<NodeKind, Rule> asMap() {
        return rules;
    }

    /** New table with the given rule for the kind. */
    public RuleTable with(NodeKind kind, Rule rule) {
        EnumMap<NodeKind, Rule> copy = new EnumMap<>(NodeKind.class);
        copy.putAll(rules);
        copy.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(rule, "rule"));
        return new RuleTable(copy);
    }

    /** New table with {@code overrides} replacing this table's rules kind by kind. */
    public RuleTable overriddenBy(RuleTable overrides) {
        EnumMap<NodeKind, Rule> copy = new EnumMap<>(NodeKind.class);
        copy.putAll(rules);
        copy.putAll(overrides.rules);
        return new RuleTable(copy);
    }
}
