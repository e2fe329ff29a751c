package com.tangle.branch;

import com.tangle.tree.node.TreeNode;

import java.util.Objects;

/**
 * Expression that evaluates to {@code expected} once the initial state has been set up.
 */
public record PredicateEntry(TreeNode expression, boolean expected) implements BranchEntry {

    public PredicateEntry {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public EntryType type() {
        return EntryType.PREDICATE;
    }

    @Override
    public TreeNode node() {
        return expression;
    }
}
