package com.tangle.resolution;

import com.tangle.marking.Markings;
import com.tangle.tree.node.TreeNode;

/**
 * Reviews the markings resolved for a node before they are staged. Declining aborts the whole
 * top-level resolution.
 */
@FunctionalInterface
public interface ReviewCallback {

    ReviewCallback ACCEPT_ALL = (node, markings) -> true;

    boolean review(TreeNode node, Markings markings);
}
