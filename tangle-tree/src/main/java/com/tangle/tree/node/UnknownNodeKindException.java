package com.tangle.tree.node;

/**
 * Thrown when a node is built from a kind tag or a raw value the tree model does not recognise.
 * This is a configuration error of the front end that supplied the tree.
 */
public final class UnknownNodeKindException extends IllegalArgumentException {

    private final String kind;

    public UnknownNodeKindException(String kind) {
        super("Not a recognised node kind: " + kind);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
