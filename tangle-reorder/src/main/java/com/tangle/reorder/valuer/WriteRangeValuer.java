package com.tangle.reorder.valuer;

import com.tangle.annotations.TangleValuer;
import com.tangle.reorder.StatementMarks;
import com.tangle.reorder.Valuer;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Negated sum, over variables, of the distance between the first and last statement writing
 * the variable.
 */
@TangleValuer(name = "wrange", description = "Keep writes of the same variable close together")
public final class WriteRangeValuer implements Valuer {

    @Override
    public double score(List<StatementMarks> ordered) {
        Map<String, int[]> ranges = new HashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            for (String name : ordered.get(i).writes().keySet()) {
                int position = i;
                ranges.computeIfAbsent(name, k -> new int[]{position, position})[1] = position;
            }
        }
        long total = 0;
        for (int[] r : ranges.values()) total += r[1] - r[0];
        return -total;
    }
}
