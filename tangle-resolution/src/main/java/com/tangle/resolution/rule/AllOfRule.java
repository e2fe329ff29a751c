package com.tangle.resolution.rule;

import java.util.List;

/**
 * Sub-rules that must answer disjoint kind sets; their answers are united. If two sub-rules
 * answer the same kind the whole rule answers nothing.
 */
public final class AllOfRule implements Rule {

    private final List<Rule> rules;

    public AllOfRule(List<Rule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("AllOf rule needs at least one sub-rule");
        }
        this.rules = List.copyOf(rules);
    }

    public static AllOfRule of(Rule... rules) {
        return new AllOfRule(List.of(rules));
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitAllOf(this);
    }

    public List<Rule> getRules() {
        return rules;
    }
}
