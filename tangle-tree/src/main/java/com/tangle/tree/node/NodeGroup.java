package com.tangle.tree.node;

/**
 * Syntactic family of a {@link NodeKind}. Branch collections use this to enforce
 * expression-only and statement-only entries.
 */
public enum NodeGroup {
    /** Module-level containers (Module, Interactive, Expression). */
    ROOT,
    STATEMENT,
    EXPRESSION,
    /** Expression contexts (Load, Store, Del, ...). */
    CONTEXT,
    SLICE,
    OPERATOR,
    /** Helper nodes that are neither statements nor expressions (arguments, keyword, ExceptHandler, ...). */
    HELPER,
    /** Lists, empty slots and atomic values. */
    STRUCTURAL
}
