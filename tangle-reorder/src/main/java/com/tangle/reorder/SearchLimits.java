package com.tangle.reorder;

/**
 * Budget for permutation search: at most {@code maxPermutations} candidates are produced or
 * scored.
 */
public record SearchLimits(long maxPermutations) {

    public static final long DEFAULT_MAX_PERMUTATIONS = 100_000L;

    public SearchLimits {
        if (maxPermutations < 1) {
            throw new IllegalArgumentException("maxPermutations must be positive: " + maxPermutations);
        }
    }

    public static SearchLimits defaults() {
        return new SearchLimits(DEFAULT_MAX_PERMUTATIONS);
    }

    public static SearchLimits unlimited() {
        return new SearchLimits(Long.MAX_VALUE);
    }
}
