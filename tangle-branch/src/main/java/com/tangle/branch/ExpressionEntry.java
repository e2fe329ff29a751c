package com.tangle.branch;

import com.tangle.tree.node.TreeNode;

import java.util.Objects;

public record ExpressionEntry(TreeNode expression) implements BranchEntry {

    public ExpressionEntry {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public EntryType type() {
        return EntryType.EXPRESSION;
    }

    @Override
    public TreeNode node() {
        return expression;
    }
}
