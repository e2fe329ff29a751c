package com.tangle.tree.node;

/**
 * A labelled child of a node. Structured nodes label children by field name; lists label
 * them by position ("0", "1", ...).
 */
public record NodeChild(String label, TreeNode node) {
}
