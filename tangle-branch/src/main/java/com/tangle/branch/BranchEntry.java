package com.tangle.branch;

import com.tangle.tree.node.TreeNode;

/** One fact in a branch collection. */
public interface BranchEntry {

    EntryType type();

    /** The expression or statement this fact is about. */
    TreeNode node();
}
