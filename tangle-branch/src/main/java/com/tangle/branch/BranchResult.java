package com.tangle.branch;

import com.tangle.tree.node.TreeNode;

import java.util.List;

/**
 * New statement sequence produced by a branch constructor. On failure the sequence is the
 * input, unchanged.
 */
public record BranchResult(List<TreeNode> statements, boolean success) {

    public BranchResult {
        statements = List.copyOf(statements);
    }

    static BranchResult failed(List<TreeNode> original) {
        return new BranchResult(original, false);
    }
}
