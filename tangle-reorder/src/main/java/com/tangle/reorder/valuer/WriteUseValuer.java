package com.tangle.reorder.valuer;

import com.tangle.annotations.TangleValuer;
import com.tangle.reorder.StatementMarks;
import com.tangle.reorder.Valuer;

import java.util.List;

/** Negated sum of write-to-last-read distances. */
@TangleValuer(name = "rwrange", description = "Keep each write close to its last read")
public final class WriteUseValuer implements Valuer {

    @Override
    public double score(List<StatementMarks> ordered) {
        long total = 0;
        for (int d : WriteUseDistances.of(ordered)) total += d;
        return -total;
    }
}
