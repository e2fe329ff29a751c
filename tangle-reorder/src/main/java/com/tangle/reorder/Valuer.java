package com.tangle.reorder;

import java.util.List;

/**
 * Scores a candidate ordering of statements; higher is better. Statements are given in their
 * candidate order, so list position is the time axis.
 */
@FunctionalInterface
public interface Valuer {

    double score(List<StatementMarks> ordered);

    /** Valuer scoring the negation of {@code valuer}. */
    static Valuer invert(Valuer valuer) {
        return ordered -> -valuer.score(ordered);
    }
}
