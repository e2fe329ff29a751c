package com.tangle.branch;

import java.util.Random;

/** Contiguous index range {@code [start, end)} of a statement sequence. */
public record Region(int start, int end) {

    public boolean isValidFor(int size) {
        return 0 <= start && start < end && end <= size;
    }

    /**
     * Random non-empty region containing {@code pivot}.
     *
     * @throws IllegalArgumentException if the pivot is outside {@code [0, size)}
     */
    public static Region around(int size, int pivot, Random random) {
        if (pivot < 0 || pivot >= size) {
            throw new IllegalArgumentException("Pivot " + pivot + " outside 0.." + (size - 1));
        }
        int start = random.nextInt(pivot + 1);
        int end = pivot + 1 + random.nextInt(size - pivot);
        return new Region(start, end);
    }
}
