package com.tangle.tree.node;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeArenaTest {

    private final NodeArena arena = new NodeArena();

    private TreeNode name(String id) {
        return arena.node(NodeKind.NAME, "id", id, "ctx", arena.node(NodeKind.LOAD));
    }

    @Test
    void node_assignsIncreasingIds() {
        TreeNode a = arena.empty();
        TreeNode b = arena.atomic("x");
        assertEquals(a.getId() + 1, b.getId());
        assertSame(b, arena.get(b.getId()));
        assertEquals(2, arena.size());
    }

    @Test
    void structured_childrenInDeclarationOrder() {
        TreeNode n = name("x");
        List<NodeChild> children = n.children();
        assertEquals(2, children.size());
        assertEquals("id", children.get(0).label());
        assertEquals("x", children.get(0).node().value());
        assertEquals("ctx", children.get(1).label());
        assertEquals(NodeKind.LOAD, n.child("ctx").kind());
        assertNull(n.child("missing"));
        assertTrue(n.isStructured());
    }

    @Test
    void list_childrenLabelledByPosition() {
        TreeNode list = arena.list(List.of(name("a"), name("b")));
        assertTrue(list.isList());
        assertEquals("0", list.children().get(0).label());
        assertEquals("1", list.children().get(1).label());
        assertEquals("b", list.get(1).child("id").value());
    }

    @Test
    void identity_structurallyEqualNodesAreDistinct() {
        TreeNode a = name("x");
        TreeNode b = name("x");
        assertNotEquals(a, b);
        assertNotEquals(a.getId(), b.getId());
    }

    @Test
    void atomic_rejectsUnsupportedValue() {
        UnknownNodeKindException e = assertThrows(UnknownNodeKindException.class, () -> arena.atomic(new Object()));
        assertEquals("java.lang.Object", e.getKind());
        assertThrows(UnknownNodeKindException.class, () -> arena.atomic(Boolean.TRUE));
    }

    @Test
    void atomic_normalizesIntegralNumbers() {
        assertEquals(3L, arena.atomic(3).value());
        assertEquals(1.5d, arena.atomic(1.5f).value());
    }

    @Test
    void structured_rejectsUnknownTag() {
        assertThrows(UnknownNodeKindException.class, () -> arena.structured("Walrus", Map.of()));
    }

    @Test
    void structured_rejectsNonStructuredKind() {
        assertThrows(IllegalArgumentException.class, () -> arena.structured(NodeKind.NODE_LIST, Map.of()));
    }

    @Test
    void buildList_flattenSplicesListItems() {
        TreeNode a = name("a");
        TreeNode inner = arena.list(List.of(name("b"), name("c")));
        TreeNode flat = arena.buildList(true, a, inner);
        assertEquals(3, flat.size());
        assertSame(a, flat.get(0));
        assertSame(inner.get(1), flat.get(2));
        assertFalse(flat.isSynthetic());

        TreeNode nested = arena.buildList(false, a, inner);
        assertEquals(2, nested.size());
        assertSame(inner, nested.get(1));
    }

    @Test
    void buildList_rejectsForeignNodes() {
        TreeNode foreign = new NodeArena().empty();
        assertThrows(IllegalArgumentException.class, () -> arena.buildList(false, foreign));
    }

    @Test
    void deepCopy_givesFreshIdsWithSameShape() {
        TreeNode assign = arena.node(NodeKind.ASSIGN,
                "targets", List.of(arena.node(NodeKind.NAME, "id", "x", "ctx", arena.node(NodeKind.STORE))),
                "value", arena.node(NodeKind.NUM, "n", 1));
        TreeNode copy = arena.deepCopy(assign);
        assertNotSame(assign, copy);
        assertEquals(NodeKind.ASSIGN, copy.kind());
        assertNotEquals(assign.child("targets").get(0).getId(), copy.child("targets").get(0).getId());
        assertEquals("x", copy.child("targets").get(0).child("id").value());
        assertEquals(1L, copy.child("value").child("n").value());
    }

    @Test
    void syntheticNode_flagsOnlyTheNewNodes() {
        TreeNode original = name("f");
        TreeNode call = arena.syntheticNode(NodeKind.CALL, "func", original, "args", List.of());
        assertTrue(call.isSynthetic());
        assertTrue(call.child("args").isSynthetic());
        assertFalse(original.isSynthetic());
    }

    @Test
    void syntheticNodes_areTransient() {
        TreeNode original = name("f");
        int retained = arena.size();

        TreeNode call = arena.syntheticNode(NodeKind.CALL, "func", original, "args", List.of(), "kwargs", null);
        TreeNode other = arena.syntheticList(List.of(call));

        assertEquals(retained, arena.size());
        assertTrue(call.getId() < 0);
        assertNotEquals(call.getId(), other.getId());
        assertSame(call, TreeNode.findById(other, call.getId()));
        assertThrows(IllegalArgumentException.class, () -> arena.get(call.getId()));
    }

    @Test
    void placeholder_isTransientButNotSynthetic() {
        int retained = arena.size();
        TreeNode p = arena.placeholder();

        assertTrue(p.isEmpty());
        assertFalse(p.isSynthetic());
        assertTrue(p.getId() < 0);
        assertEquals(retained, arena.size());
    }

    @Test
    void findById_searchesSubtree() {
        TreeNode inner = name("y");
        TreeNode root = arena.list(List.of(name("x"), inner));
        assertSame(inner.child("ctx"), TreeNode.findById(root, inner.child("ctx").getId()));
        assertNull(TreeNode.findById(inner, root.getId()));
    }

    @Test
    void isBlank_treatsEmptyAndEmptyListAsBlank() {
        TreeNode fn = arena.node(NodeKind.FUNCTION_DEF, "name", "f", "decorator_list", List.of(), "returns", null);
        assertTrue(fn.isBlank("decorator_list"));
        assertTrue(fn.isBlank("returns"));
        assertTrue(fn.isBlank("absent"));
        assertFalse(fn.isBlank("name"));
    }
}
