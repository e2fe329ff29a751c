package com.tangle.reorder.valuer;

import com.tangle.annotations.TangleValuer;
import com.tangle.reorder.StatementMarks;
import com.tangle.reorder.Valuer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Counts crossing read dependencies. Each read links the reading statement to the latest
 * earlier statement writing that variable (reads with no such writer are ignored). Scanning
 * backwards, links are kept newest-first; when a link's writer is reached, its depth in the
 * list (the number of links opened after it and still open) is added to the knot count.
 */
@TangleValuer(name = "knots", description = "Handle one variable's lifetime before moving to the next")
public final class KnotValuer implements Valuer {

    @Override
    public double score(List<StatementMarks> ordered) {
        List<SortedSet<Integer>> providers = providers(ordered);
        long knots = 0;
        List<Integer> links = new ArrayList<>();
        for (int i = ordered.size() - 1; i >= 0; i--) {
            int at;
            while ((at = links.indexOf(i)) >= 0) {
                knots += at;
                links.remove(at);
            }
            for (int p : providers.get(i)) links.add(0, p);
        }
        return -knots;
    }

    private static List<SortedSet<Integer>> providers(List<StatementMarks> ordered) {
        List<SortedSet<Integer>> out = new ArrayList<>(ordered.size());
        Map<String, Integer> lastWrite = new HashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            StatementMarks s = ordered.get(i);
            SortedSet<Integer> provided = new TreeSet<>();
            for (String name : s.reads().keySet()) {
                Integer w = lastWrite.get(name);
                if (w != null) provided.add(w);
            }
            for (String name : s.writes().keySet()) lastWrite.put(name, i);
            out.add(provided);
        }
        return out;
    }
}
