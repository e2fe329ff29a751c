package com.tangle.reorder.valuer;

import com.tangle.annotations.TangleValuer;
import com.tangle.reorder.StatementMarks;
import com.tangle.reorder.Valuer;

import java.util.List;

/** Like {@link WriteUseValuer}, summing {@code ln(distance)} over positive distances. */
@TangleValuer(name = "rwlogrange", description = "Keep each write close to its last read, damping long ranges")
public final class WriteUseLogValuer implements Valuer {

    @Override
    public double score(List<StatementMarks> ordered) {
        double total = 0;
        for (int d : WriteUseDistances.of(ordered)) {
            if (d > 0) total += Math.log(d);
        }
        return -total;
    }
}
