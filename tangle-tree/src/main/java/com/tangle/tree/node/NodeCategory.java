package com.tangle.tree.node;

/**
 * Shape of a tree node: atomic leaf, empty slot, ordered list, or structured node with named fields.
 */
public enum NodeCategory {
    ATOMIC,
    EMPTY,
    LIST,
    STRUCTURED
}
