package com.tangle.resolution.rule;

/**
 * Exhaustive dispatch over the rule variants.
 *
 * @param <R> evaluation result
 */
public interface RuleVisitor<R> {

    R visitLeaf(LeafRule rule);

    R visitRewrite(RewriteRule rule);

    R visitSequential(SequentialRule rule);

    R visitAllOf(AllOfRule rule);

    R visitAnyOf(AnyOfRule rule);

    R visitConditional(ConditionalRule rule);
}
