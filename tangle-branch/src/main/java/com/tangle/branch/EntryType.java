package com.tangle.branch;

import com.tangle.tree.node.TreeNode;

import java.util.Locale;

/**
 * Kind of fact a branch collection holds, with the node-kind constraint for its entries.
 */
public enum EntryType {
    /** Expression with a known truth value. */
    PREDICATE("predicate"),
    /** Simple statement known to raise, or known not to raise. */
    EXCEPTION("exception"),
    /** Free-form expression. */
    EXPRESSION("expression"),
    /** Free-form simple statement (no nested body). */
    STATEMENT("statement");

    private final String tag;

    EntryType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /** True when the node may be stored in a collection of this type. */
    public boolean accepts(TreeNode node) {
        if (node == null || !node.isStructured()) return false;
        return switch (this) {
            case PREDICATE, EXPRESSION -> node.kind().isExpression();
            case EXCEPTION, STATEMENT -> node.kind().isStatement() && !node.kind().isCompound();
        };
    }

    /**
     * @throws IllegalArgumentException for an unknown tag
     */
    public static EntryType fromValue(String value) {
        String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (EntryType t : values()) {
            if (t.tag.equals(v)) return t;
        }
        throw new IllegalArgumentException("Unknown entry type: " + value);
    }
}
