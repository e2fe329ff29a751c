package com.tangle.resolution.rule;

/**
 * Per-node-kind inference rule. Evaluated through a {@link RuleVisitor}, which must handle every variant.
 */
public interface Rule {

    <R> R accept(RuleVisitor<R> visitor);
}
