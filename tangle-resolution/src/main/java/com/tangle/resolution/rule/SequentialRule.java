package com.tangle.resolution.rule;

import java.util.List;

/**
 * Sub-rules evaluated in order against the same node; partial results are combined as if the
 * parts ran one after another. A kind is answered only if every sub-rule answered it.
 */
public final class SequentialRule implements Rule {

    private final List<Rule> rules;

    public SequentialRule(List<Rule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("Sequential rule needs at least one sub-rule");
        }
        this.rules = List.copyOf(rules);
    }

    public static SequentialRule of(Rule... rules) {
        return new SequentialRule(List.of(rules));
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitSequential(this);
    }

    public List<Rule> getRules() {
        return rules;
    }
}
