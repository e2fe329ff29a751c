package com.tangle.marking;

import com.tangle.tree.node.NodeArena;
import com.tangle.tree.node.NodeKind;
import com.tangle.tree.node.TreeNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarkerTest {

    private NodeArena arena;
    private MarkingStore store;
    private TreeNode node;

    @BeforeEach
    void setUp() {
        arena = new NodeArena();
        store = new MarkingStore(arena);
        node = arena.node(NodeKind.PASS);
    }

    @Test
    void unmarked_reportsDefaults() {
        assertFalse(store.visible(node).isMarked());
        assertTrue(store.visible(node).isVisible());
        assertTrue(store.breaks(node).canBreak());
        assertTrue(store.reads(node).get().isEmpty());
        assertEquals(ScopeClass.UNKNOWN, store.scope(node).getScope("x"));
        assertEquals(IndirectAccess.NONE, store.indirect(node).getVariable("x", ScopeClass.FREE));
    }

    @Test
    void addBreak_rejectsUnknownTypeAndReportsChange() {
        BreaksMarker breaks = store.breaks(node);
        assertFalse(breaks.addBreak("goto"));
        assertFalse(breaks.isMarked());
        assertTrue(breaks.addBreak("return"));
        assertFalse(breaks.addBreak("return"));
        assertTrue(breaks.canBreak(BreakType.RETURN));
        assertFalse(breaks.removeBreak("except"));
        assertFalse(breaks.removeBreak("nonsense"));
        assertTrue(breaks.removeBreak("return"));
        assertTrue(breaks.isMarked());
        assertFalse(breaks.canBreak());
    }

    @Test
    void detach_mutatingDuplicateLeavesOriginalUntouched() {
        store.breaks(node).addBreak(BreakType.EXCEPT);
        store.reads(node).addVariable("x", ScopeClass.LOCAL);

        BreaksMarker detached = store.breaks(node);
        detached.detach();
        detached.addBreak(BreakType.YIELD);
        detached.removeBreak(BreakType.EXCEPT);

        VariableMarker reads = store.reads(node);
        reads.detach();
        reads.addVariable("y", ScopeClass.GLOBAL);

        assertEquals(Set.of(BreakType.EXCEPT), store.breaks(node).get());
        assertEquals(Set.of(BreakType.YIELD), detached.get());
        assertEquals(Map.of("x", ScopeClass.LOCAL), store.reads(node).get());
        assertEquals(2, reads.get().size());
    }

    @Test
    void detach_unmarkedStaysUnmarked() {
        VisibleMarker visible = store.visible(node);
        visible.detach();
        assertFalse(visible.isMarked());
        assertTrue(visible.setVisible(false));
        assertFalse(store.visible(node).isMarked());
    }

    @Test
    void get_returnsUnmodifiableValue() {
        store.breaks(node).addBreak(BreakType.EXCEPT);
        assertThrows(UnsupportedOperationException.class, () -> store.breaks(node).get().add(BreakType.YIELD));
    }

    @Test
    void variableMarker_validatesNames() {
        VariableMarker writes = store.writes(node);
        assertThrows(InvalidNameException.class, () -> writes.addVariable("1x", ScopeClass.LOCAL));
        assertThrows(InvalidNameException.class, () -> writes.addVariable("a-b", ScopeClass.LOCAL));
        assertTrue(writes.addVariable("größe", ScopeClass.LOCAL));
        assertThrows(IllegalArgumentException.class, () -> writes.addVariable("x", ScopeClass.FREE));
        assertNull(writes.getVariable("x"));
    }

    @Test
    void scopeMarker_declaresAndRemoves() {
        ScopeMarker scope = store.scope(node);
        assertTrue(scope.addGlobal("counter"));
        assertTrue(scope.addNonlocal("total"));
        assertEquals(ScopeClass.GLOBAL, scope.getScope("counter"));
        assertTrue(scope.remove("counter"));
        assertEquals(ScopeClass.UNKNOWN, scope.getScope("counter"));
    }

    @Test
    void indirectMarker_nullFlagLeavesOtherUnchanged() {
        IndirectRwMarker indirect = store.indirect(node);
        indirect.addGlobal("g", true, null);
        indirect.addGlobal("g", null, true);
        assertEquals(new IndirectAccess(true, true), indirect.getVariable("g", ScopeClass.GLOBAL));
        assertThrows(IllegalArgumentException.class, () -> indirect.addVariable("g", ScopeClass.LOCAL, true, null));
    }

    @Test
    void syntheticNode_neverStoresMarkings() {
        TreeNode synthetic = arena.syntheticNode(NodeKind.PASS);
        assertFalse(store.visible(synthetic).setVisible(false));
        assertFalse(store.visible(synthetic).isMarked());
    }

    @Test
    void store_rejectsWrongValueTypeAndForeignNodes() {
        assertThrows(IllegalArgumentException.class, () -> store.put(node, MarkingKind.VISIBLE, "yes"));
        assertThrows(IllegalArgumentException.class, () -> store.put(node, MarkingKind.BREAKS, Set.of("return")));
        TreeNode foreign = new NodeArena().empty();
        assertThrows(IllegalArgumentException.class, () -> store.isMarked(foreign, MarkingKind.VISIBLE));
    }
}
