package com.tangle.reorder.valuer;

import com.tangle.annotations.TangleValuer;
import com.tangle.reorder.StatementMarks;
import com.tangle.reorder.Valuer;

import java.util.List;

/** Same score for every ordering, so the first candidate wins. */
@TangleValuer(name = "first", description = "Keep the first candidate ordering")
public final class FirstValuer implements Valuer {

    @Override
    public double score(List<StatementMarks> ordered) {
        return 1;
    }
}
