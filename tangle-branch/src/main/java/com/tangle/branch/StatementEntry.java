package com.tangle.branch;

import com.tangle.tree.node.TreeNode;

import java.util.Objects;

public record StatementEntry(TreeNode statement) implements BranchEntry {

    public StatementEntry {
        Objects.requireNonNull(statement, "statement");
    }

    @Override
    public EntryType type() {
        return EntryType.STATEMENT;
    }

    @Override
    public TreeNode node() {
        return statement;
    }
}
