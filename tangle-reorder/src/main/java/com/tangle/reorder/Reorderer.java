package com.tangle.reorder;

import com.tangle.marking.MarkingKind;
import com.tangle.marking.MarkingStore;
import com.tangle.marking.MarkingValues;
import com.tangle.marking.Markings;
import com.tangle.tree.node.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Reorders a sequence of statements without moving any statement across a control-flow break.
 * <p>
 * The sequence is split into partitions: every statement that may break is alone in its
 * partition, and the maximal runs of other statements form the rest. Candidate orderings are
 * the cross product, in partition order, of each partition's orderings. Within a partition a
 * statement never moves ahead of an earlier statement it conflicts with (see
 * {@link StatementMarks#conflictsWith}).
 * <p>
 * Scoring requires every statement to carry breaks, visible, reads, writes and scope markings.
 */
public class Reorderer {

    private static final Logger log = LoggerFactory.getLogger(Reorderer.class);

    static final MarkingKind[] REQUIRED = {
            MarkingKind.BREAKS, MarkingKind.VISIBLE, MarkingKind.READS, MarkingKind.WRITES, MarkingKind.SCOPE
    };

    private final MarkingStore store;
    private final List<TreeNode> statements;
    private final SearchLimits limits;
    private final boolean safetyChecks;

    public Reorderer(MarkingStore store, List<TreeNode> statements) {
        this(store, statements, SearchLimits.defaults(), false);
    }

    /**
     * @throws IllegalArgumentException if any node is not a statement
     */
    public Reorderer(MarkingStore store, List<TreeNode> statements, SearchLimits limits, boolean safetyChecks) {
        this.store = Objects.requireNonNull(store, "store");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.safetyChecks = safetyChecks;
        Objects.requireNonNull(statements, "statements");
        for (TreeNode s : statements) {
            Objects.requireNonNull(s, "statement");
            if (!s.isStructured() || !s.kind().isStatement()) {
                throw new IllegalArgumentException("Not a statement: " + s);
            }
        }
        this.statements = List.copyOf(statements);
    }

    public List<TreeNode> getStatements() {
        return statements;
    }

    public SearchLimits getLimits() {
        return limits;
    }

    public boolean isSafetyChecks() {
        return safetyChecks;
    }

    /** True when every statement carries all markings reordering depends on. */
    public boolean checkMarkings() {
        for (TreeNode s : statements) {
            for (MarkingKind kind : REQUIRED) {
                if (!store.isMarked(s, kind)) return false;
            }
        }
        return true;
    }

    /**
     * Marks unmarked statements conservatively: visible and breaking with an exception, so
     * they never move. Reads, writes and scope default to empty.
     *
     * @return number of markings added
     */
    public int fillMissingMarkings() {
        Markings defaults = new Markings();
        for (MarkingKind kind : REQUIRED) defaults.put(kind, MarkingValues.assumedValue(kind));
        return fillMissingMarkings(defaults);
    }

    /** Stores the given defaults for every required kind a statement lacks. */
    public int fillMissingMarkings(Markings defaults) {
        Objects.requireNonNull(defaults, "defaults");
        int added = 0;
        for (TreeNode s : statements) {
            for (MarkingKind kind : REQUIRED) {
                if (!store.isMarked(s, kind) && defaults.contains(kind) && store.put(s, kind, defaults.get(kind))) {
                    added++;
                }
            }
        }
        return added;
    }

    /** Partitions as lists of original indices, in order. Concatenated they give 0..n-1. */
    public List<List<Integer>> partition() {
        return partitionOrders().stream().map(PartitionOrder::indices).toList();
    }

    /** Exact number of candidate orderings, ignoring the search budget. */
    public BigInteger permutationCount() {
        BigInteger total = BigInteger.ONE;
        for (PartitionOrder p : partitionOrders()) total = total.multiply(p.count());
        return total;
    }

    /**
     * Lazily produced candidate orderings as lists of original indices, at most
     * {@link SearchLimits#maxPermutations()} of them. The first is the original order
     * (for the deterministic reorderer).
     */
    public Iterable<List<Integer>> permutations() {
        List<PartitionOrder> parts = partitionOrders();
        return () -> new CrossProduct(parts);
    }

    /**
     * Applies an ordering. The original list is not changed.
     *
     * @throws IllegalArgumentException if {@code order} is not a permutation of the indices
     */
    public List<TreeNode> permute(List<Integer> order) {
        Objects.requireNonNull(order, "order");
        boolean[] seen = new boolean[statements.size()];
        if (order.size() != statements.size()) {
            throw new IllegalArgumentException("Expected " + statements.size() + " indices, got " + order.size());
        }
        List<TreeNode> out = new ArrayList<>(order.size());
        for (Integer i : order) {
            if (i == null || i < 0 || i >= statements.size() || seen[i]) {
                throw new IllegalArgumentException("Not a permutation: " + order);
            }
            seen[i] = true;
            out.add(statements.get(i));
        }
        return out;
    }

    /**
     * Scores every candidate within the budget and returns the first one with the highest
     * score. Empty when the statements are not fully marked.
     */
    public Optional<List<Integer>> bestPermutation(Valuer valuer) {
        Objects.requireNonNull(valuer, "valuer");
        if (!checkMarkings()) {
            log.warn("Refusing to reorder {} statement(s): markings incomplete", statements.size());
            return Optional.empty();
        }
        List<StatementMarks> marks = marks();
        List<Integer> best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        long examined = 0;
        for (List<Integer> candidate : permutations()) {
            List<StatementMarks> ordered = new ArrayList<>(candidate.size());
            for (int i : candidate) ordered.add(marks.get(i));
            double score = valuer.score(ordered);
            if (best == null || score > bestScore) {
                best = candidate;
                bestScore = score;
            }
            examined++;
        }
        log.debug("Examined {} ordering(s); best score {}", examined, bestScore);
        return Optional.ofNullable(best);
    }

    /** Current marking snapshots, in original order. */
    public List<StatementMarks> marks() {
        List<StatementMarks> out = new ArrayList<>(statements.size());
        for (int i = 0; i < statements.size(); i++) out.add(StatementMarks.of(store, i, statements.get(i)));
        return out;
    }

    /** Orderings of one partition; the random reorderer shuffles them. */
    Iterator<List<Integer>> partitionOrderings(PartitionOrder partition) {
        return partition.orderings(null);
    }

    private List<PartitionOrder> partitionOrders() {
        List<PartitionOrder> out = new ArrayList<>();
        List<StatementMarks> run = new ArrayList<>();
        for (StatementMarks m : marks()) {
            if (m.canBreak()) {
                if (!run.isEmpty()) out.add(new PartitionOrder(run));
                out.add(new PartitionOrder(List.of(m)));
                run = new ArrayList<>();
            } else {
                run.add(m);
            }
        }
        if (!run.isEmpty()) out.add(new PartitionOrder(run));
        log.debug("Split {} statement(s) into {} partition(s)", statements.size(), out.size());
        return out;
    }

    private void verify(List<PartitionOrder> parts, List<Integer> candidate) {
        if (candidate.size() != statements.size()) {
            throw new IllegalStateException("Ordering has " + candidate.size() + " of " + statements.size() + " statements");
        }
        int offset = 0;
        for (PartitionOrder p : parts) {
            List<Integer> slice = candidate.subList(offset, offset + p.size());
            if (!p.accepts(slice)) {
                throw new IllegalStateException("Unsafe ordering " + candidate + " for partition " + p.indices());
            }
            offset += p.size();
        }
    }

    /** Odometer over the partitions' orderings; the last partition varies fastest. */
    private final class CrossProduct implements Iterator<List<Integer>> {

        private final List<PartitionOrder> parts;
        private final List<Iterator<List<Integer>>> iterators = new ArrayList<>();
        private final List<List<Integer>> current = new ArrayList<>();
        private long produced;
        private boolean started;
        private List<Integer> next;
        private boolean done;

        CrossProduct(List<PartitionOrder> parts) {
            this.parts = parts;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !done) {
                next = produced < limits.maxPermutations() ? advance() : null;
                if (next == null) done = true;
            }
            return next != null;
        }

        @Override
        public List<Integer> next() {
            if (!hasNext()) throw new NoSuchElementException();
            List<Integer> out = next;
            next = null;
            produced++;
            if (safetyChecks) verify(parts, out);
            return out;
        }

        private List<Integer> advance() {
            if (!started) {
                started = true;
                for (PartitionOrder p : parts) {
                    Iterator<List<Integer>> it = partitionOrderings(p);
                    iterators.add(it);
                    current.add(it.next());
                }
                return flatten();
            }
            int k = parts.size() - 1;
            while (k >= 0 && !iterators.get(k).hasNext()) k--;
            if (k < 0) return null;
            current.set(k, iterators.get(k).next());
            for (int j = k + 1; j < parts.size(); j++) {
                Iterator<List<Integer>> it = partitionOrderings(parts.get(j));
                iterators.set(j, it);
                current.set(j, it.next());
            }
            return flatten();
        }

        private List<Integer> flatten() {
            List<Integer> out = new ArrayList<>(statements.size());
            for (List<Integer> part : current) out.addAll(part);
            return List.copyOf(out);
        }
    }
}
