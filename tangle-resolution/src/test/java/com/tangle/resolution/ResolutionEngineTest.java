package com.tangle.resolution;

import com.tangle.marking.BreakType;
import com.tangle.marking.MarkingKind;
import com.tangle.marking.MarkingStore;
import com.tangle.marking.Markings;
import com.tangle.marking.ScopeClass;
import com.tangle.tree.node.NodeArena;
import com.tangle.tree.node.NodeKind;
import com.tangle.tree.node.TreeNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResolutionEngineTest {

    private static final Set<MarkingKind> FLOW = EnumSet.of(MarkingKind.VISIBLE, MarkingKind.BREAKS);

    private NodeArena arena;
    private MarkingStore store;
    private PyTrees py;

    @BeforeEach
    void setUp() {
        arena = new NodeArena();
        store = new MarkingStore(arena);
        py = new PyTrees(arena);
    }

    @Test
    void existingBeforeFallback_returnsStoredValueWithoutFallback() {
        TreeNode node = py.pass();
        store.visible(node).setVisible(false);
        AtomicInteger fallbackCalls = new AtomicInteger();
        ResolutionEngine engine = ResolutionEngine.builder()
                .store(store)
                .order(StrategyType.EXISTING)
                .fallback(MarkingKind.VISIBLE, () -> {
                    fallbackCalls.incrementAndGet();
                    return true;
                })
                .build();

        ResolutionOutcome outcome = engine.resolve(node, "visible");

        assertTrue(outcome.isCommitted());
        assertEquals(false, outcome.getMarkings().visible());
        assertEquals(0, fallbackCalls.get());
    }

    @Test
    void computed_returnOfNameReadsAndBreaks() {
        TreeNode x = py.load("x");
        TreeNode node = py.ret(x);
        ResolutionEngine engine = ResolutionEngine.builder().store(store).build();

        ResolutionOutcome outcome = engine.resolve(node,
                EnumSet.of(MarkingKind.VISIBLE, MarkingKind.BREAKS, MarkingKind.READS, MarkingKind.WRITES));

        Markings m = outcome.getMarkings();
        assertEquals(false, m.visible());
        assertEquals(EnumSet.of(BreakType.EXCEPT, BreakType.RETURN), m.breaks());
        assertEquals(Map.of("x", ScopeClass.UNKNOWN), m.reads());
        assertTrue(m.writes().isEmpty());
        assertTrue(store.isMarked(node, MarkingKind.BREAKS));
        assertEquals(EnumSet.of(BreakType.EXCEPT), store.get(x, MarkingKind.BREAKS));
    }

    @Test
    void fallback_assumesVisibleAndRaising() {
        TreeNode imp = arena.node(NodeKind.IMPORT, "names", arena.list(List.of()));
        ResolutionEngine engine = ResolutionEngine.builder().store(store).build();

        Markings m = engine.resolve(imp, EnumSet.of(MarkingKind.VISIBLE, MarkingKind.BREAKS, MarkingKind.READS))
                .getMarkings();

        assertEquals(true, m.visible());
        assertEquals(EnumSet.of(BreakType.EXCEPT), m.breaks());
        assertTrue(m.reads().isEmpty());
        assertEquals(EnumSet.of(BreakType.EXCEPT), store.get(imp, MarkingKind.BREAKS));
    }

    @Test
    void assignedCall_mayRaiseAndReadsCallee() {
        TreeNode stmt = py.assign("x", py.call(py.load("f"), py.load("a")));
        ResolutionEngine engine = ResolutionEngine.builder().store(store).build();

        Markings m = engine.resolve(stmt, EnumSet.of(MarkingKind.VISIBLE, MarkingKind.BREAKS, MarkingKind.READS,
                MarkingKind.WRITES)).getMarkings();

        assertTrue(m.breaks().contains(BreakType.EXCEPT));
        assertEquals(true, m.visible());
        assertEquals(Map.of("f", ScopeClass.UNKNOWN, "a", ScopeClass.UNKNOWN), m.reads());
        assertEquals(Map.of("x", ScopeClass.UNKNOWN), m.writes());
        assertTrue(((Set<?>) store.get(stmt, MarkingKind.BREAKS)).contains(BreakType.EXCEPT));
    }

    @Test
    void withBody_propagatesLoopExits() {
        TreeNode with = arena.node(NodeKind.WITH, "context_expr", py.call(py.load("open")),
                "body", arena.list(List.of(py.brk())));
        ResolutionEngine engine = ResolutionEngine.builder().store(store).build();

        Set<BreakType> breaks = engine.resolve(with, FLOW).getMarkings().breaks();

        assertEquals(EnumSet.of(BreakType.EXCEPT, BreakType.BREAK), breaks);
    }

    @Test
    void reviewDecline_abortsWithNoCommits() {
        TreeNode stmt = py.assign("y", py.add(py.load("x"), py.num(1)));
        List<TreeNode> reviewed = new ArrayList<>();
        ResolutionEngine engine = ResolutionEngine.builder()
                .store(store)
                .review((node, markings) -> {
                    reviewed.add(node);
                    return node.kind() != NodeKind.BIN_OP;
                })
                .build();

        ResolutionOutcome outcome = engine.resolve(stmt, FLOW);

        assertTrue(outcome.isAborted());
        assertThrows(IllegalStateException.class, outcome::getMarkings);
        assertFalse(reviewed.isEmpty());
        for (int id = 0; id < arena.size(); id++) {
            assertTrue(store.markingsOf(arena.get(id)).isEmpty(), "node " + id + " must stay unmarked");
        }
    }

    @Test
    void interactiveCancel_abortsWholeResolution() {
        TreeNode stmt = py.expr(py.call(py.load("print"), py.load("x")));
        ResolutionEngine engine = ResolutionEngine.builder()
                .store(store)
                .order("mark,calc,user")
                .interactive((node, needed) -> StrategyResult.cancelled("user stopped"))
                .build();

        ResolutionOutcome outcome = engine.resolve(stmt, FLOW);

        assertTrue(outcome.isAborted());
        assertEquals("user stopped", outcome.getAbortReason());
        assertFalse(store.isMarked(stmt, MarkingKind.VISIBLE));
    }

    @Test
    void interactive_partialAnswerCompletedByFallback() {
        TreeNode call = py.call(py.load("f"));
        ResolutionEngine engine = ResolutionEngine.builder()
                .store(store)
                .order(StrategyType.COMPUTED, StrategyType.INTERACTIVE)
                .interactive((node, needed) -> StrategyResult.answered(Markings.of(MarkingKind.VISIBLE, false)))
                .build();

        Markings m = engine.resolve(call, FLOW).getMarkings();

        assertEquals(false, m.visible());
        assertEquals(EnumSet.of(BreakType.EXCEPT), m.breaks());
    }

    @Test
    void existing_seesValuesStagedEarlierInSameCall() {
        TreeNode shared = py.call(py.load("f"));
        TreeNode list = arena.list(List.of(shared, shared));
        AtomicInteger asked = new AtomicInteger();
        ResolutionEngine engine = ResolutionEngine.builder()
                .store(store)
                .order(StrategyType.EXISTING, StrategyType.COMPUTED, StrategyType.INTERACTIVE)
                .interactive((node, needed) -> {
                    if (node == shared) asked.incrementAndGet();
                    return StrategyResult.nothing();
                })
                .build();

        engine.resolveGroup(List.of(list), FLOW);

        assertEquals(1, asked.get());
    }

    @Test
    void resolve_unknownKindRejectedEagerly() {
        TreeNode node = py.pass();
        ResolutionEngine engine = ResolutionEngine.builder().store(store).build();
        assertThrows(IllegalArgumentException.class, () -> engine.resolve(node, "visible", "colour"));
        assertFalse(store.isMarked(node, MarkingKind.VISIBLE));
    }

    @Test
    void builder_rejectsDuplicateOrUnknownStrategy() {
        assertThrows(IllegalArgumentException.class, () -> ResolutionEngine.builder().store(store).order("mark,existing").build());
        assertThrows(IllegalArgumentException.class, () -> ResolutionEngine.builder().store(store).order("existing,guess").build());
        assertThrows(IllegalArgumentException.class,
                () -> ResolutionEngine.builder().store(store).order(StrategyType.COMPUTED, StrategyType.COMPUTED).build());
        assertThrows(IllegalArgumentException.class,
                () -> ResolutionEngine.builder().store(store).order(StrategyType.FALLBACK).build());
    }

    @Test
    void order_alwaysEndsWithFallback() {
        ResolutionEngine engine = ResolutionEngine.builder().store(store).order("user,calc").build();
        assertEquals(List.of(StrategyType.INTERACTIVE, StrategyType.COMPUTED, StrategyType.FALLBACK), engine.getOrder());
    }

    @Test
    void loops_removeBreakAndContinue() {
        TreeNode whileLoop = py.whileLoop(py.load("running"), List.of(py.brk(), py.cont()), List.of());
        TreeNode forLoop = py.forLoop("i", py.load("items"), List.of(py.cont()));
        ResolutionEngine engine = ResolutionEngine.builder().store(store).build();

        assertEquals(EnumSet.of(BreakType.EXCEPT), engine.resolve(whileLoop, FLOW).getMarkings().breaks());
        Markings forMarks = engine.resolve(forLoop, EnumSet.of(MarkingKind.BREAKS, MarkingKind.WRITES)).getMarkings();
        assertEquals(EnumSet.of(BreakType.EXCEPT), forMarks.breaks());
        assertEquals(Map.of("i", ScopeClass.UNKNOWN), forMarks.writes());
    }

    @Test
    void loopElse_runsElseAfterLoop() {
        TreeNode loop = py.whileLoop(py.load("running"), List.of(py.brk()), List.of(py.ret(null)));
        ResolutionEngine engine = ResolutionEngine.builder().store(store).build();

        Set<BreakType> breaks = engine.resolve(loop, FLOW).getMarkings().breaks();

        assertEquals(EnumSet.of(BreakType.EXCEPT, BreakType.RETURN), breaks);
        assertTrue(store.isMarked(loop, MarkingKind.BREAKS));
    }

    @Test
    void decoratedFunction_resolvedThroughReassignment() {
        TreeNode decorator = py.load("cached");
        TreeNode plain = py.functionDef("f", List.of(), py.ret(py.load("x")));
        TreeNode decorated = py.functionDef("g", List.of(decorator), py.pass());
        ResolutionEngine engine = ResolutionEngine.builder().store(store).build();
        Set<MarkingKind> kinds = EnumSet.of(MarkingKind.VISIBLE, MarkingKind.BREAKS, MarkingKind.WRITES);

        Markings p = engine.resolve(plain, kinds).getMarkings();
        assertEquals(false, p.visible());
        assertTrue(p.breaks().isEmpty());
        assertEquals(Map.of("f", ScopeClass.UNKNOWN), p.writes());

        Markings d = engine.resolve(decorated, kinds).getMarkings();
        assertEquals(true, d.visible());
        assertEquals(Map.of("g", ScopeClass.UNKNOWN), d.writes());
        assertTrue(store.isMarked(decorated, MarkingKind.VISIBLE));
        assertTrue(d.breaks().contains(BreakType.EXCEPT));
        assertTrue(store.isMarked(decorator, MarkingKind.BREAKS), "the decorator is read by the reassignment call");
    }

    @Test
    void repeatedResolution_doesNotGrowArena() {
        TreeNode decorated = py.functionDef("g", List.of(py.load("cached")), py.pass());
        ResolutionEngine engine = ResolutionEngine.builder().store(store).writeBack(false).build();
        engine.resolve(decorated, FLOW);
        int size = arena.size();

        for (int i = 0; i < 1000; i++) {
            assertFalse(engine.resolve(decorated, FLOW).isAborted());
        }

        assertEquals(size, arena.size());
    }

    @Test
    void augmentedAssign_readsAndWritesTarget() {
        TreeNode aug = arena.node(NodeKind.AUG_ASSIGN, "target", py.store("total"), "op", arena.node(NodeKind.ADD),
                "value", py.load("step"));
        ResolutionEngine engine = ResolutionEngine.builder().store(store).build();

        Markings m = engine.resolve(aug, EnumSet.of(MarkingKind.READS, MarkingKind.WRITES, MarkingKind.BREAKS))
                .getMarkings();

        assertEquals(Map.of("total", ScopeClass.UNKNOWN, "step", ScopeClass.UNKNOWN), m.reads());
        assertEquals(Map.of("total", ScopeClass.UNKNOWN), m.writes());
        assertEquals(EnumSet.of(BreakType.EXCEPT), m.breaks());
    }

    @Test
    void tryExcept_bareHandlerSwallowsExceptFromBody() {
        TreeNode handler = arena.node(NodeKind.EXCEPT_HANDLER, "type", null, "name", null, "body", List.of(py.pass()));
        TreeNode tryNode = arena.node(NodeKind.TRY_EXCEPT,
                "body", List.of(py.expr(py.load("risky"))),
                "handlers", List.of(handler),
                "orelse", List.of());
        ResolutionEngine engine = ResolutionEngine.builder().store(store).build();

        assertTrue(engine.resolve(tryNode, FLOW).getMarkings().breaks().isEmpty());
    }

    @Test
    void globalStatement_declaresScope() {
        TreeNode global = arena.node(NodeKind.GLOBAL, "names", List.of("counter", "limit"));
        ResolutionEngine engine = ResolutionEngine.builder().store(store).build();

        Markings m = engine.resolve(global, EnumSet.of(MarkingKind.SCOPE)).getMarkings();

        assertEquals(Map.of("counter", ScopeClass.GLOBAL, "limit", ScopeClass.GLOBAL), m.scope());
    }

    @Test
    void writeBackDisabled_storesNothing() {
        TreeNode node = py.expr(py.load("x"));
        ResolutionEngine engine = ResolutionEngine.builder().store(store).writeBack(false).build();

        assertTrue(engine.resolve(node, FLOW).isCommitted());
        assertNull(store.get(node, MarkingKind.VISIBLE));
    }
}
