package com.tangle.branch;

import com.tangle.tree.node.NodeArena;
import com.tangle.tree.node.NodeKind;
import com.tangle.tree.node.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Builders for the Python statements a branch emits. */
final class BranchShapes {

    private BranchShapes() {
    }

    static TreeNode expr(NodeArena arena, TreeNode value) {
        return arena.node(NodeKind.EXPR, "value", value);
    }

    static TreeNode not(NodeArena arena, TreeNode operand) {
        return arena.node(NodeKind.UNARY_OP, "op", arena.node(NodeKind.NOT), "operand", operand);
    }

    static TreeNode ifStatement(NodeArena arena, TreeNode test, List<TreeNode> body, List<TreeNode> orelse) {
        return arena.node(NodeKind.IF, "test", test, "body", body, "orelse", orelse);
    }

    static TreeNode whileStatement(NodeArena arena, TreeNode test, List<TreeNode> body) {
        return arena.node(NodeKind.WHILE, "test", test, "body", body, "orelse", List.of());
    }

    static TreeNode tryExcept(NodeArena arena, List<TreeNode> body, TreeNode handler, List<TreeNode> orelse) {
        return arena.node(NodeKind.TRY_EXCEPT, "body", body, "handlers", List.of(handler), "orelse", orelse);
    }

    /** Handler for the given type names; bare when the set is empty. */
    static TreeNode handler(NodeArena arena, Set<String> exceptionTypes, List<TreeNode> body) {
        TreeNode type = null;
        if (exceptionTypes.size() == 1) {
            type = dottedName(arena, exceptionTypes.iterator().next());
        } else if (!exceptionTypes.isEmpty()) {
            List<TreeNode> elts = new ArrayList<>();
            for (String name : exceptionTypes) elts.add(dottedName(arena, name));
            type = arena.node(NodeKind.TUPLE, "elts", elts, "ctx", arena.node(NodeKind.LOAD));
        }
        return arena.node(NodeKind.EXCEPT_HANDLER, "type", type, "name", null, "body", body);
    }

    static TreeNode pass(NodeArena arena) {
        return arena.node(NodeKind.PASS);
    }

    /** {@code a.b.C} as nested attribute loads. */
    static TreeNode dottedName(NodeArena arena, String dotted) {
        String[] parts = dotted.split("\\.");
        TreeNode node = arena.node(NodeKind.NAME, "id", parts[0], "ctx", arena.node(NodeKind.LOAD));
        for (int i = 1; i < parts.length; i++) {
            node = arena.node(NodeKind.ATTRIBUTE, "value", node, "attr", parts[i], "ctx", arena.node(NodeKind.LOAD));
        }
        return node;
    }
}
