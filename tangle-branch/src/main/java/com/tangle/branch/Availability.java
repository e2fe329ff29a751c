package com.tangle.branch;

/** Result of a dry-run check of whether a branch can be built. */
public enum Availability {
    /** Facts are present and a region can be chosen. */
    AVAILABLE,
    /** Facts are present but no region of the statements qualifies. */
    NO_REGION,
    /** The brancher lacks the facts the branch needs. */
    MISSING_FACTS;

    /** {@code true}, {@code false} or {@code null} respectively. */
    public Boolean toBoolean() {
        return switch (this) {
            case AVAILABLE -> Boolean.TRUE;
            case NO_REGION -> Boolean.FALSE;
            case MISSING_FACTS -> null;
        };
    }
}
