package com.tangle.reorder;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Random;

/**
 * Statements of one partition and the order constraints between them. A statement must stay
 * after every earlier statement of the partition it conflicts with; the valid orderings are the
 * topological orderings of that relation.
 */
final class PartitionOrder {

    private final List<Integer> indices;
    private final boolean[][] before;
    private final int[][] successors;
    private final int[] predecessorCount;
    private final boolean unconstrained;

    PartitionOrder(List<StatementMarks> statements) {
        int n = statements.size();
        this.indices = statements.stream().map(StatementMarks::index).toList();
        this.before = new boolean[n][n];
        this.predecessorCount = new int[n];
        List<List<Integer>> succ = new ArrayList<>();
        boolean free = true;
        for (int i = 0; i < n; i++) {
            List<Integer> s = new ArrayList<>();
            for (int j = i + 1; j < n; j++) {
                if (statements.get(i).conflictsWith(statements.get(j))) {
                    before[i][j] = true;
                    s.add(j);
                    predecessorCount[j]++;
                    free = false;
                }
            }
            succ.add(s);
        }
        this.successors = new int[n][];
        for (int i = 0; i < n; i++) successors[i] = succ.get(i).stream().mapToInt(Integer::intValue).toArray();
        this.unconstrained = free;
    }

    /** Original indices of the statements, in original order. */
    List<Integer> indices() {
        return indices;
    }

    int size() {
        return indices.size();
    }

    /**
     * Lazy orderings of the partition as original indices. With a random source the candidates
     * at each step are tried in shuffled order; otherwise orderings come in lexicographic order
     * of positions, starting with the original order.
     */
    Iterator<List<Integer>> orderings(Random random) {
        return new Orderings(random);
    }

    /** True when the given original indices are exactly this partition, in a valid order. */
    boolean accepts(List<Integer> ordered) {
        if (ordered.size() != indices.size()) return false;
        int n = indices.size();
        int[] position = new int[n];
        boolean[] seen = new boolean[n];
        for (int p = 0; p < n; p++) {
            int local = indices.indexOf(ordered.get(p));
            if (local < 0 || seen[local]) return false;
            seen[local] = true;
            position[local] = p;
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (before[i][j] && position[i] > position[j]) return false;
            }
        }
        return true;
    }

    /** Exact number of valid orderings. */
    BigInteger count() {
        int n = indices.size();
        if (unconstrained) return factorial(n);
        return countFrom(new BitSet(n), new HashMap<>());
    }

    private BigInteger countFrom(BitSet placed, Map<BitSet, BigInteger> memo) {
        int n = indices.size();
        if (placed.cardinality() == n) return BigInteger.ONE;
        BigInteger cached = memo.get(placed);
        if (cached != null) return cached;
        BigInteger total = BigInteger.ZERO;
        for (int e = 0; e < n; e++) {
            if (placed.get(e) || !ready(e, placed)) continue;
            BitSet next = (BitSet) placed.clone();
            next.set(e);
            total = total.add(countFrom(next, memo));
        }
        memo.put((BitSet) placed.clone(), total);
        return total;
    }

    private boolean ready(int e, BitSet placed) {
        for (int p = 0; p < e; p++) {
            if (before[p][e] && !placed.get(p)) return false;
        }
        return true;
    }

    static BigInteger factorial(int n) {
        BigInteger f = BigInteger.ONE;
        for (int i = 2; i <= n; i++) f = f.multiply(BigInteger.valueOf(i));
        return f;
    }

    /** Backtracking enumeration of topological orderings. */
    private final class Orderings implements Iterator<List<Integer>> {

        private final Random random;
        private final int n = indices.size();
        private final int[] remaining = predecessorCount.clone();
        private final boolean[] placed = new boolean[n];
        private final int[] chosen = new int[n];
        private final int[][] candidates = new int[n + 1][];
        private final int[] cursor = new int[n + 1];
        private int depth;
        private List<Integer> next;
        private boolean exhausted;

        Orderings(Random random) {
            this.random = random;
            enter(0);
        }

        @Override
        public boolean hasNext() {
            if (next == null && !exhausted) next = advance();
            return next != null;
        }

        @Override
        public List<Integer> next() {
            if (!hasNext()) throw new NoSuchElementException();
            List<Integer> out = next;
            next = null;
            return out;
        }

        private List<Integer> advance() {
            while (true) {
                if (depth == n) {
                    List<Integer> out = new ArrayList<>(n);
                    for (int local : chosen) out.add(indices.get(local));
                    if (n == 0) {
                        exhausted = true;
                        return out;
                    }
                    depth--;
                    unplace(chosen[depth]);
                    return out;
                }
                int e = nextCandidate();
                if (e >= 0) {
                    chosen[depth] = e;
                    place(e);
                    depth++;
                    enter(depth);
                    continue;
                }
                if (depth == 0) {
                    exhausted = true;
                    return null;
                }
                depth--;
                unplace(chosen[depth]);
            }
        }

        private void enter(int d) {
            cursor[d] = 0;
            if (d == n) return;
            int[] order = new int[n];
            for (int i = 0; i < n; i++) order[i] = i;
            if (random != null) {
                for (int i = n - 1; i > 0; i--) {
                    int j = random.nextInt(i + 1);
                    int t = order[i];
                    order[i] = order[j];
                    order[j] = t;
                }
            }
            candidates[d] = order;
        }

        private int nextCandidate() {
            int[] order = candidates[depth];
            while (cursor[depth] < n) {
                int e = order[cursor[depth]++];
                if (!placed[e] && remaining[e] == 0) return e;
            }
            return -1;
        }

        private void place(int e) {
            placed[e] = true;
            for (int s : successors[e]) remaining[s]--;
        }

        private void unplace(int e) {
            placed[e] = false;
            for (int s : successors[e]) remaining[s]++;
        }
    }
}
