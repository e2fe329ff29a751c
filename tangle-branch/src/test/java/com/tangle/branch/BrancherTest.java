package com.tangle.branch;

import com.tangle.marking.BreakType;
import com.tangle.marking.MarkingKind;
import com.tangle.tree.node.NodeKind;
import com.tangle.tree.node.TreeNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BrancherTest {

    private BranchFixtures fx;
    private Brancher brancher;
    private List<TreeNode> stmts;

    @BeforeEach
    void setUp() {
        fx = new BranchFixtures();
        brancher = new Brancher("b", fx.store, new Random(11));
        stmts = fx.statements(3);
    }

    private void addIfFacts(boolean expected) {
        brancher.initial().add(new ExpressionEntry(fx.call("setup")));
        brancher.predicates().add(new PredicateEntry(fx.name("ready"), expected));
    }

    @Test
    void ifBranch_missingFactsGiveEmpty() {
        assertEquals(Optional.empty(), brancher.ifBranch(stmts, 0, 1));
        brancher.initial().add(new ExpressionEntry(fx.call("setup")));
        assertEquals(Optional.empty(), brancher.ifBranch(stmts, 0, 1));
    }

    @Test
    void ifBranch_wrapsRegionInConditional() {
        addIfFacts(true);

        BranchResult r = brancher.ifBranch(stmts, 1, 3).orElseThrow();

        assertTrue(r.success());
        List<TreeNode> out = r.statements();
        assertEquals(3, out.size());
        assertSame(stmts.get(0), out.get(0));
        assertEquals(NodeKind.EXPR, out.get(1).kind());
        assertEquals(NodeKind.CALL, out.get(1).child("value").kind());
        TreeNode ifNode = out.get(2);
        assertEquals(NodeKind.IF, ifNode.kind());
        assertEquals(NodeKind.NAME, ifNode.child("test").kind());
        assertEquals(List.of(stmts.get(1), stmts.get(2)), ifNode.child("body").items());
        assertTrue(ifNode.isBlank("orelse"));
    }

    @Test
    void ifBranch_negatesFalsePredicateAndAddsPreserving() {
        addIfFacts(false);
        TreeNode keep = fx.assign("ready", fx.name("ready"));
        brancher.preserving().add(new StatementEntry(keep));

        List<TreeNode> out = brancher.ifBranch(stmts, 0, 1).orElseThrow().statements();

        assertEquals(5, out.size());
        assertEquals(NodeKind.ASSIGN, out.get(1).kind());
        assertNotSame(keep, out.get(1), "facts are copied, not moved");
        TreeNode test = out.get(2).child("test");
        assertEquals(NodeKind.UNARY_OP, test.kind());
        assertEquals(NodeKind.NOT, test.child("op").kind());
    }

    @Test
    void branch_invalidRegionFails() {
        addIfFacts(true);

        for (int[] region : new int[][]{{1, 1}, {-1, 1}, {0, 4}, {2, 1}}) {
            BranchResult r = brancher.ifBranch(stmts, region[0], region[1]).orElseThrow();
            assertFalse(r.success());
            assertEquals(stmts, r.statements());
        }
    }

    @Test
    void ifElseBranch_needsRandomisingAndCopiesRegion() {
        addIfFacts(true);
        assertEquals(Optional.empty(), brancher.ifElseBranch(stmts, 0, 2));
        brancher.randomising().add(new StatementEntry(fx.assign("ready", fx.call("coin"))));

        List<TreeNode> out = brancher.ifElseBranch(stmts, 0, 2).orElseThrow().statements();

        assertEquals(4, out.size());
        TreeNode ifNode = out.get(2);
        assertEquals(List.of(stmts.get(0), stmts.get(1)), ifNode.child("body").items());
        List<TreeNode> orelse = ifNode.child("orelse").items();
        assertEquals(2, orelse.size());
        assertNotSame(stmts.get(0), orelse.get(0));
        assertEquals(NodeKind.ASSIGN, orelse.get(0).kind());
        assertSame(stmts.get(2), out.get(3));
    }

    @Test
    void exceptBranch_raisingEntryPutsRegionInHandler() {
        brancher.initial().add(new ExpressionEntry(fx.call("setup")));
        brancher.exceptions().add(ExceptionEntry.raising(fx.exprStatement(fx.call("fail")), Set.of("ValueError")));

        List<TreeNode> out = brancher.exceptBranch(stmts, 0, 3).orElseThrow().statements();

        assertEquals(2, out.size());
        TreeNode tryNode = out.get(1);
        assertEquals(NodeKind.TRY_EXCEPT, tryNode.kind());
        TreeNode handler = tryNode.child("handlers").get(0);
        assertEquals("ValueError", handler.child("type").child("id").stringValue());
        assertEquals(stmts, handler.child("body").items());
        assertTrue(tryNode.isBlank("orelse"));
    }

    @Test
    void exceptBranch_nonRaisingEntryPutsRegionInElse() {
        brancher.initial().add(new ExpressionEntry(fx.call("setup")));
        brancher.exceptions().add(new ExceptionEntry(fx.exprStatement(fx.call("safe")), false,
                new TreeSet<>(Set.of("KeyError", "os.error"))));

        TreeNode tryNode = brancher.exceptBranch(stmts, 1, 2).orElseThrow().statements().get(2);

        assertEquals(List.of(stmts.get(1)), tryNode.child("orelse").items());
        TreeNode handler = tryNode.child("handlers").get(0);
        assertEquals(NodeKind.PASS, handler.child("body").get(0).kind());
        TreeNode types = handler.child("type");
        assertEquals(NodeKind.TUPLE, types.kind());
        assertEquals(NodeKind.ATTRIBUTE, types.child("elts").get(1).kind());
        assertEquals("error", types.child("elts").get(1).child("attr").stringValue());
    }

    @Test
    void whileBranch_appendsDestroyingStatement() {
        addIfFacts(true);
        brancher.destroying().add(new StatementEntry(fx.assign("ready", fx.name("nothing"))));

        List<TreeNode> out = brancher.whileBranch(stmts, 0, 2).orElseThrow().statements();

        TreeNode loop = out.get(1);
        assertEquals(NodeKind.WHILE, loop.kind());
        List<TreeNode> body = loop.child("body").items();
        assertEquals(3, body.size());
        assertSame(stmts.get(0), body.get(0));
        assertEquals("ready", body.get(2).child("targets").get(0).child("id").stringValue());
    }

    @Test
    void whileBranch_refusedWhenRegionMayBreakOutOfLoop() {
        addIfFacts(true);
        brancher.destroying().add(new StatementEntry(fx.assign("ready", fx.name("nothing"))));
        fx.store.put(stmts.get(1), MarkingKind.BREAKS, EnumSet.of(BreakType.CONTINUE));
        TreeNode unmarked = fx.arena.node(NodeKind.PASS);

        BranchResult r = brancher.whileBranch(stmts, 0, 2).orElseThrow();
        assertFalse(r.success());
        assertEquals(stmts, r.statements());
        assertFalse(brancher.whileBranch(List.of(unmarked), 0, 1).orElseThrow().success());
        assertTrue(brancher.whileBranch(stmts, 2, 3).orElseThrow().success());
    }

    @Test
    void availability_reportsWithoutBuilding() {
        assertEquals(Availability.MISSING_FACTS, brancher.availability(BranchKind.IF, stmts));
        assertNull(Availability.MISSING_FACTS.toBoolean());

        addIfFacts(true);
        int nodes = fx.arena.size();
        assertEquals(Availability.AVAILABLE, brancher.availability(BranchKind.IF, stmts));
        assertEquals(Availability.NO_REGION, brancher.availability(BranchKind.IF, List.of()));
        assertEquals(Boolean.FALSE, Availability.NO_REGION.toBoolean());
        assertEquals(Availability.MISSING_FACTS, brancher.availability(BranchKind.WHILE, stmts));
        assertEquals(nodes, fx.arena.size(), "a dry run creates no nodes");

        brancher.destroying().add(new StatementEntry(fx.assign("ready", fx.name("nothing"))));
        TreeNode breaking = fx.arena.node(NodeKind.BREAK);
        fx.store.put(breaking, MarkingKind.BREAKS, EnumSet.of(BreakType.BREAK));
        assertEquals(Availability.NO_REGION, brancher.availability(BranchKind.WHILE, List.of(breaking)));
    }

    @Test
    void branchAround_regionContainsPivot() {
        addIfFacts(true);
        List<TreeNode> many = fx.statements(8);

        for (int round = 0; round < 20; round++) {
            BranchResult r = brancher.branchAround(BranchKind.IF, many, OptionalInt.of(5)).orElseThrow();
            assertTrue(r.success());
            TreeNode ifNode = r.statements().stream().filter(s -> s.kind() == NodeKind.IF).findFirst().orElseThrow();
            assertTrue(ifNode.child("body").items().contains(many.get(5)));
        }
        assertTrue(brancher.branchAround(BranchKind.IF, many, OptionalInt.empty()).orElseThrow().success());
        assertFalse(brancher.branchAround(BranchKind.IF, List.of(), OptionalInt.empty()).orElseThrow().success());
    }
}
