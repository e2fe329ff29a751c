package com.tangle.resolution.rule;

import java.util.List;

/**
 * Alternatives for mutually exclusive runtime paths, merged pessimistically: every effect of
 * any path could happen, and names whose scope class differs between paths become unknown.
 * A kind is answered only if every alternative answered it.
 */
public final class AnyOfRule implements Rule {

    private final List<Rule> rules;

    public AnyOfRule(List<Rule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("AnyOf rule needs at least one sub-rule");
        }
        this.rules = List.copyOf(rules);
    }

    public static AnyOfRule of(Rule... rules) {
        return new AnyOfRule(List.of(rules));
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitAnyOf(this);
    }

    public List<Rule> getRules() {
        return rules;
    }
}
