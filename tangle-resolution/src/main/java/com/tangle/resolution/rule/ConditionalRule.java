package com.tangle.resolution.rule;

import com.tangle.tree.node.TreeNode;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Chooses between two rules by a predicate over the node, e.g. "has decorators".
 */
public final class ConditionalRule implements Rule {

    private final String description;
    private final Predicate<TreeNode> condition;
    private final Rule whenTrue;
    private final Rule whenFalse;

    public ConditionalRule(String description, Predicate<TreeNode> condition, Rule whenTrue, Rule whenFalse) {
        this.description = Objects.requireNonNull(description, "description");
        this.condition = Objects.requireNonNull(condition, "condition");
        this.whenTrue = Objects.requireNonNull(whenTrue, "whenTrue");
        this.whenFalse = Objects.requireNonNull(whenFalse, "whenFalse");
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }

    public String getDescription() {
        return description;
    }

    public Rule select(TreeNode node) {
        return condition.test(node) ? whenTrue : whenFalse;
    }

    public Rule getWhenTrue() {
        return whenTrue;
    }

    public Rule getWhenFalse() {
        return whenFalse;
    }
}
