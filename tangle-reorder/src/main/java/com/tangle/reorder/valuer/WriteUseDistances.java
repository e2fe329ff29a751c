package com.tangle.reorder.valuer;

import com.tangle.reorder.StatementMarks;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Live ranges of writes: from each write to the furthest read before the next write of the
 * same variable. Reads with no earlier write start at a virtual write at position -1. A write
 * that is never read stays live until the next write, or contributes nothing if none follows.
 */
final class WriteUseDistances {

    private WriteUseDistances() {
    }

    static List<Integer> of(List<StatementMarks> ordered) {
        List<Integer> distances = new ArrayList<>();
        Map<String, int[]> open = new HashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            StatementMarks s = ordered.get(i);
            for (String name : s.reads().keySet()) {
                int[] range = open.computeIfAbsent(name, k -> new int[]{-1, -1});
                range[1] = i;
            }
            for (String name : s.writes().keySet()) {
                int[] range = open.get(name);
                if (range != null) {
                    distances.add(range[1] >= 0 ? range[1] - range[0] : i - range[0]);
                }
                open.put(name, new int[]{i, -1});
            }
        }
        for (int[] range : open.values()) {
            if (range[1] >= 0) distances.add(range[1] - range[0]);
        }
        return distances;
    }
}
