package com.tangle.branch;

/** The four branch shapes a {@link Brancher} can build. */
public enum BranchKind {
    IF,
    IF_ELSE,
    EXCEPT,
    WHILE
}
