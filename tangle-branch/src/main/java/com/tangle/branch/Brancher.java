package com.tangle.branch;

import com.tangle.marking.BreakType;
import com.tangle.marking.BreaksMarker;
import com.tangle.marking.MarkingStore;
import com.tangle.tree.node.NodeArena;
import com.tangle.tree.node.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Random;

/**
 * Facts for one kind of branching and the constructors that use them.
 * <p>
 * Each constructor takes a statement sequence and a region {@code [start, end)} and returns the
 * new sequence, with the region wrapped in a control-flow statement whose outcome the facts
 * fix. The result is empty when a required collection is empty, and unsuccessful (input
 * unchanged) when the region is invalid or unsuitable. Facts are deep-copied into the output;
 * region statements are moved.
 */
public final class Brancher {

    private static final Logger log = LoggerFactory.getLogger(Brancher.class);

    private final String name;
    private final MarkingStore store;
    private final Random random;

    private final BranchCollection<PredicateEntry> predicates = new BranchCollection<>("predicates", EntryType.PREDICATE);
    private final BranchCollection<ExceptionEntry> exceptions = new BranchCollection<>("exceptions", EntryType.EXCEPTION);
    private final BranchCollection<ExpressionEntry> initial = new BranchCollection<>("initial", EntryType.EXPRESSION);
    private final BranchCollection<StatementEntry> preserving = new BranchCollection<>("preserving", EntryType.STATEMENT);
    private final BranchCollection<StatementEntry> destroying = new BranchCollection<>("destroying", EntryType.STATEMENT);
    private final BranchCollection<StatementEntry> randomising = new BranchCollection<>("randomising", EntryType.STATEMENT);

    /**
     * @param store markings of the statements to branch; its arena receives the new nodes
     * @param random source for choosing facts and regions
     */
    public Brancher(String name, MarkingStore store, Random random) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("Brancher name must be non-blank");
        this.name = name;
        this.store = Objects.requireNonNull(store, "store");
        this.random = Objects.requireNonNull(random, "random");
    }

    public String getName() {
        return name;
    }

    public MarkingStore getStore() {
        return store;
    }

    /** Expressions with a known truth value after the initial state is set up. */
    public BranchCollection<PredicateEntry> predicates() {
        return predicates;
    }

    public BranchCollection<ExceptionEntry> exceptions() {
        return exceptions;
    }

    /** Expressions that set up the state the predicates depend on. */
    public BranchCollection<ExpressionEntry> initial() {
        return initial;
    }

    /** Statements that keep the predicates' value. */
    public BranchCollection<StatementEntry> preserving() {
        return preserving;
    }

    /** Statements that flip the predicates' value. */
    public BranchCollection<StatementEntry> destroying() {
        return destroying;
    }

    /** Statements after which the predicates' value is unknown. */
    public BranchCollection<StatementEntry> randomising() {
        return randomising;
    }

    /** The six collections in a fixed order. */
    public List<BranchCollection<? extends BranchEntry>> collections() {
        return List.of(predicates, exceptions, initial, preserving, destroying, randomising);
    }

    /** Collection by name ("predicates", "exceptions", ...), or null. */
    public BranchCollection<? extends BranchEntry> collection(String collectionName) {
        for (BranchCollection<? extends BranchEntry> c : collections()) {
            if (c.getName().equals(collectionName)) return c;
        }
        return null;
    }

    /**
     * {@code initial; [preserving;] if test: region} where the test holds given the initial state.
     */
    public Optional<BranchResult> ifBranch(List<TreeNode> statements, int start, int end) {
        return branch(BranchKind.IF, statements, new Region(start, end));
    }

    /** {@code initial; randomising; if predicate: region else: copy of region}. */
    public Optional<BranchResult> ifElseBranch(List<TreeNode> statements, int start, int end) {
        return branch(BranchKind.IF_ELSE, statements, new Region(start, end));
    }

    /**
     * {@code initial; try: exception-statement except T: region} for a raising entry, or
     * {@code initial; try: statement except T: pass else: region} for a non-raising one.
     */
    public Optional<BranchResult> exceptBranch(List<TreeNode> statements, int start, int end) {
        return branch(BranchKind.EXCEPT, statements, new Region(start, end));
    }

    /**
     * {@code initial; while test: region; destroying} where the test holds once. Refused when a
     * region statement may {@code break} or {@code continue}.
     */
    public Optional<BranchResult> whileBranch(List<TreeNode> statements, int start, int end) {
        return branch(BranchKind.WHILE, statements, new Region(start, end));
    }

    /** Builds the branch over a region chosen at random around the pivot (random when absent). */
    public Optional<BranchResult> branchAround(BranchKind kind, List<TreeNode> statements, OptionalInt pivot) {
        Objects.requireNonNull(statements, "statements");
        if (!hasFacts(kind)) return Optional.empty();
        if (statements.isEmpty()) return Optional.of(BranchResult.failed(statements));
        int p = pivot.isPresent() ? pivot.getAsInt() : random.nextInt(statements.size());
        return branch(kind, statements, Region.around(statements.size(), p, random));
    }

    public Optional<BranchResult> branch(BranchKind kind, List<TreeNode> statements, Region region) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(statements, "statements");
        Objects.requireNonNull(region, "region");
        if (!hasFacts(kind)) {
            log.debug("Brancher {} lacks facts for {}", name, kind);
            return Optional.empty();
        }
        if (!region.isValidFor(statements.size())) {
            return Optional.of(BranchResult.failed(statements));
        }
        List<TreeNode> body = new ArrayList<>(statements.subList(region.start(), region.end()));
        if (kind == BranchKind.WHILE && !body.stream().allMatch(this::loopSafe)) {
            log.debug("Region {} may break out of a loop; while-branch refused", region);
            return Optional.of(BranchResult.failed(statements));
        }

        List<TreeNode> emitted = switch (kind) {
            case IF -> ifShape(body);
            case IF_ELSE -> ifElseShape(body);
            case EXCEPT -> exceptShape(body);
            case WHILE -> whileShape(body);
        };
        List<TreeNode> out = new ArrayList<>(statements.subList(0, region.start()));
        out.addAll(emitted);
        out.addAll(statements.subList(region.end(), statements.size()));
        log.debug("Brancher {} built {} over {}", name, kind, region);
        return Optional.of(new BranchResult(out, true));
    }

    /** Dry run: whether {@link #branchAround} could succeed, without building anything. */
    public Availability availability(BranchKind kind, List<TreeNode> statements) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(statements, "statements");
        if (!hasFacts(kind)) return Availability.MISSING_FACTS;
        if (statements.isEmpty()) return Availability.NO_REGION;
        if (kind == BranchKind.WHILE && statements.stream().noneMatch(this::loopSafe)) return Availability.NO_REGION;
        return Availability.AVAILABLE;
    }

    private boolean hasFacts(BranchKind kind) {
        return switch (kind) {
            case IF -> !initial.isEmpty() && !predicates.isEmpty();
            case IF_ELSE -> !initial.isEmpty() && !predicates.isEmpty() && !randomising.isEmpty();
            case EXCEPT -> !initial.isEmpty() && !exceptions.isEmpty();
            case WHILE -> !initial.isEmpty() && !predicates.isEmpty() && !destroying.isEmpty();
        };
    }

    private boolean loopSafe(TreeNode statement) {
        BreaksMarker breaks = store.breaks(statement);
        return !breaks.canBreak(BreakType.BREAK) && !breaks.canBreak(BreakType.CONTINUE);
    }

    private List<TreeNode> ifShape(List<TreeNode> body) {
        NodeArena arena = store.getArena();
        List<TreeNode> out = new ArrayList<>();
        out.add(BranchShapes.expr(arena, copy(pick(initial).expression())));
        if (!preserving.isEmpty()) out.add(copy(pick(preserving).statement()));
        out.add(BranchShapes.ifStatement(arena, trueTest(pick(predicates)), body, List.of()));
        return out;
    }

    private List<TreeNode> ifElseShape(List<TreeNode> body) {
        NodeArena arena = store.getArena();
        List<TreeNode> elseBody = new ArrayList<>();
        for (TreeNode s : body) elseBody.add(arena.deepCopy(s));
        return List.of(
                BranchShapes.expr(arena, copy(pick(initial).expression())),
                copy(pick(randomising).statement()),
                BranchShapes.ifStatement(arena, copy(pick(predicates).expression()), body, elseBody));
    }

    private List<TreeNode> exceptShape(List<TreeNode> body) {
        NodeArena arena = store.getArena();
        ExceptionEntry e = pick(exceptions);
        TreeNode tryNode = e.raises()
                ? BranchShapes.tryExcept(arena, List.of(copy(e.statement())),
                        BranchShapes.handler(arena, e.exceptionTypes(), body), List.of())
                : BranchShapes.tryExcept(arena, List.of(copy(e.statement())),
                        BranchShapes.handler(arena, e.exceptionTypes(), List.of(BranchShapes.pass(arena))), body);
        return List.of(BranchShapes.expr(arena, copy(pick(initial).expression())), tryNode);
    }

    private List<TreeNode> whileShape(List<TreeNode> body) {
        NodeArena arena = store.getArena();
        List<TreeNode> loopBody = new ArrayList<>(body);
        loopBody.add(copy(pick(destroying).statement()));
        return List.of(
                BranchShapes.expr(arena, copy(pick(initial).expression())),
                BranchShapes.whileStatement(arena, trueTest(pick(predicates)), loopBody));
    }

    /** Predicate expression, negated when it is expected to be false. */
    private TreeNode trueTest(PredicateEntry p) {
        TreeNode test = copy(p.expression());
        return p.expected() ? test : BranchShapes.not(store.getArena(), test);
    }

    private TreeNode copy(TreeNode fact) {
        return store.getArena().deepCopy(fact);
    }

    private <E extends BranchEntry> E pick(BranchCollection<E> collection) {
        List<E> values = collection.values();
        return values.get(random.nextInt(values.size()));
    }
}
