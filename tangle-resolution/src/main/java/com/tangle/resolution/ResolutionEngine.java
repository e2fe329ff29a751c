package com.tangle.resolution;

import com.tangle.marking.MarkingKind;
import com.tangle.marking.MarkingStore;
import com.tangle.marking.MarkingValues;
import com.tangle.marking.Markings;
import com.tangle.resolution.python.PythonRuleTable;
import com.tangle.resolution.rule.Rule;
import com.tangle.resolution.rule.RuleTable;
import com.tangle.tree.node.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Resolves markings for nodes by trying strategies in configured order, with the fallback
 * strategy always last.
 * <p>
 * A top-level call is all-or-nothing: markings resolved for the node and for every node
 * resolved recursively on its behalf are staged and reach the {@link MarkingStore} only when
 * the call completes. A declined review or a cancelled interactive request anywhere aborts the
 * call and discards everything staged. The existing-markings strategy sees staged values.
 * <p>
 * Not thread-safe.
 */
public final class ResolutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ResolutionEngine.class);

    private final MarkingStore store;
    private final List<StrategyType> order;
    private final RuleTable rules;
    private final boolean writeBack;
    private final InteractiveMarkingSource interactive;
    private final ReviewCallback review;
    private final Map<MarkingKind, Supplier<Object>> fallbacks;

    private ResolutionEngine(Builder b) {
        this.store = Objects.requireNonNull(b.store, "store");
        List<StrategyType> full = new ArrayList<>(StrategyType.validateOrder(b.order));
        full.add(StrategyType.FALLBACK);
        this.order = List.copyOf(full);
        this.rules = b.rules != null ? b.rules : PythonRuleTable.create();
        this.writeBack = b.writeBack;
        this.interactive = b.interactive;
        this.review = b.review;
        this.fallbacks = new EnumMap<>(b.fallbacks);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Configured strategies followed by the implicit fallback. */
    public List<StrategyType> getOrder() {
        return order;
    }

    public RuleTable getRules() {
        return rules;
    }

    public MarkingStore getStore() {
        return store;
    }

    public boolean isWriteBack() {
        return writeBack;
    }

    /**
     * Resolves markings by kind name ("visible", "breaks", ...).
     *
     * @throws IllegalArgumentException for an unknown kind name, before anything is resolved
     */
    public ResolutionOutcome resolve(TreeNode node, String... kindNames) {
        Set<MarkingKind> needed = EnumSet.noneOf(MarkingKind.class);
        for (String name : kindNames) needed.add(MarkingKind.fromValue(name));
        return resolve(node, needed);
    }

    /**
     * Resolves the requested kinds for the node. On success every requested kind is present in
     * the result; with write-back enabled the results are stored.
     */
    public ResolutionOutcome resolve(TreeNode node, Set<MarkingKind> needed) {
        Objects.requireNonNull(node, "node");
        Set<MarkingKind> kinds = requireKinds(needed);
        Transaction tx = new Transaction();
        StrategyResult result = resolveWithin(tx, node, kinds);
        return finish(tx, node, result);
    }

    /**
     * Resolves each node in turn and combines the results as a sequence, without treating the
     * group as a node of its own (no review or write-back for the group itself).
     */
    public ResolutionOutcome resolveGroup(List<TreeNode> nodes, Set<MarkingKind> needed) {
        Objects.requireNonNull(nodes, "nodes");
        Set<MarkingKind> kinds = requireKinds(needed);
        Transaction tx = new Transaction();
        StrategyResult result = RuleEvaluator.combineGroup(nodes, kinds, (child, k) -> resolveWithin(tx, child, k));
        return finish(tx, nodes, result);
    }

    private ResolutionOutcome finish(Transaction tx, Object subject, StrategyResult result) {
        if (result.isCancelled()) {
            log.info("Resolution of {} aborted: {}", subject, result.getCancelReason());
            return ResolutionOutcome.aborted(result.getCancelReason());
        }
        if (writeBack) {
            log.debug("Committing markings for {} node(s)", tx.size());
            tx.commit(store);
        }
        return ResolutionOutcome.committed(result.getMarkings());
    }

    private StrategyResult resolveWithin(Transaction tx, TreeNode node, Set<MarkingKind> needed) {
        Markings result = new Markings();
        for (StrategyType strategy : order) {
            Set<MarkingKind> wanted = EnumSet.noneOf(MarkingKind.class);
            for (MarkingKind k : needed) {
                if (!result.contains(k)) wanted.add(k);
            }
            if (wanted.isEmpty()) break;

            StrategyResult part = switch (strategy) {
                case EXISTING -> existing(tx, node, wanted);
                case COMPUTED -> computed(tx, node, wanted);
                case INTERACTIVE -> interactive.request(node, EnumSet.copyOf(wanted));
                case FALLBACK -> fallback(wanted);
            };
            if (part.isCancelled()) return part;
            result.putMissing(part.getMarkings().restrictTo(wanted));
        }
        log.debug("Resolved {} for {}", result, node);

        if (!review.review(node, result.copy())) {
            return StrategyResult.cancelled("review declined markings for " + node);
        }
        if (writeBack) tx.stage(node, result);
        return StrategyResult.answered(result);
    }

    private StrategyResult existing(Transaction tx, TreeNode node, Set<MarkingKind> wanted) {
        Markings out = new Markings();
        for (MarkingKind kind : wanted) {
            Object staged = tx.lookup(node, kind);
            if (staged != null) {
                out.put(kind, staged);
            } else if (store.isMarked(node, kind)) {
                out.put(kind, store.get(node, kind));
            }
        }
        return StrategyResult.answered(out);
    }

    private StrategyResult computed(Transaction tx, TreeNode node, Set<MarkingKind> wanted) {
        RuleEvaluator.ChildResolver children = (child, k) -> resolveWithin(tx, child, k);
        Rule rule = rules.get(node.kind());
        if (rule != null) return new RuleEvaluator(node, wanted, children).evaluate(rule);
        if (node.isList()) return RuleEvaluator.combineGroup(node.items(), wanted, children);
        if (node.isEmpty() || node.isAtomic()) {
            Markings base = new Markings();
            for (MarkingKind kind : wanted) base.put(kind, MarkingValues.base(kind));
            return StrategyResult.answered(base);
        }
        return StrategyResult.nothing();
    }

    private StrategyResult fallback(Set<MarkingKind> wanted) {
        Markings out = new Markings();
        for (MarkingKind kind : wanted) {
            Supplier<Object> supplier = fallbacks.get(kind);
            out.put(kind, supplier != null ? supplier.get() : MarkingValues.assumedValue(kind));
        }
        return StrategyResult.answered(out);
    }

    private static Set<MarkingKind> requireKinds(Collection<MarkingKind> needed) {
        Objects.requireNonNull(needed, "needed");
        Set<MarkingKind> kinds = EnumSet.noneOf(MarkingKind.class);
        for (MarkingKind k : needed) kinds.add(Objects.requireNonNull(k, "kind"));
        return kinds;
    }

    public static final class Builder {
        private MarkingStore store;
        private List<StrategyType> order = List.of(StrategyType.EXISTING, StrategyType.COMPUTED);
        private RuleTable rules;
        private boolean writeBack = true;
        private InteractiveMarkingSource interactive = InteractiveMarkingSource.NONE;
        private ReviewCallback review = ReviewCallback.ACCEPT_ALL;
        private final Map<MarkingKind, Supplier<Object>> fallbacks = new EnumMap<>(MarkingKind.class);

        private Builder() {
        }

        public Builder store(MarkingStore store) {
            this.store = store;
            return this;
        }

        /** Strategy order without the fallback, e.g. EXISTING, COMPUTED. */
        public Builder order(List<StrategyType> order) {
            this.order = Objects.requireNonNull(order, "order");
            return this;
        }

        public Builder order(StrategyType... order) {
            return order(List.of(order));
        }

        /** Strategy order by name, e.g. "existing,computed" or "mark,calc,user". */
        public Builder order(String csv) {
            return order(StrategyType.parseOrder(csv));
        }

        /** Rule table for the computed strategy; defaults to {@link PythonRuleTable#create()}. */
        public Builder rules(RuleTable rules) {
            this.rules = rules;
            return this;
        }

        public Builder writeBack(boolean writeBack) {
            this.writeBack = writeBack;
            return this;
        }

        public Builder interactive(InteractiveMarkingSource interactive) {
            this.interactive = Objects.requireNonNull(interactive, "interactive");
            return this;
        }

        public Builder review(ReviewCallback review) {
            this.review = Objects.requireNonNull(review, "review");
            return this;
        }

        /** Overrides the fallback value for one kind. */
        public Builder fallback(MarkingKind kind, Supplier<Object> supplier) {
            fallbacks.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(supplier, "supplier"));
            return this;
        }

        /**
         * @throws IllegalArgumentException if the order names a strategy twice
         */
        public ResolutionEngine build() {
            return new ResolutionEngine(this);
        }
    }
}
