package com.tangle.reorder.valuer;

import com.tangle.annotations.TangleValuer;
import com.tangle.reorder.StatementMarks;
import com.tangle.reorder.Valuer;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/** Uniform random score in [0, 100), whatever the ordering. */
@TangleValuer(name = "random", description = "Pick any safe ordering", randomized = true)
public final class RandomValuer implements Valuer {

    private final Random random;

    public RandomValuer(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public double score(List<StatementMarks> ordered) {
        return random.nextDouble() * 100.0;
    }
}
