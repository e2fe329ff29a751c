package com.tangle.resolution.python;

import com.tangle.tree.node.NodeArena;
import com.tangle.tree.node.NodeKind;
import com.tangle.tree.node.TreeNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Equivalent synthetic forms of Python constructs whose markings are easier to derive from a
 * simpler shape. Every node built here is synthetic; children of the original are shared.
 */
public final class Desugarings {

    private Desugarings() {
    }

    /**
     * {@code @d1 @d2 def f(...)} becomes {@code def f(...)} followed by {@code f = d1(d2(f))}.
     * Class definitions are handled the same way.
     */
    public static TreeNode undecorate(TreeNode definition) {
        NodeKind kind = definition.kind();
        if (kind != NodeKind.FUNCTION_DEF && kind != NodeKind.CLASS_DEF) {
            throw new IllegalArgumentException("Not a decorated definition: " + definition);
        }
        NodeArena arena = definition.getArena();
        TreeNode decorators = definition.child("decorator_list");
        TreeNode bare = copyWith(definition, "decorator_list", arena.syntheticList(List.of()));

        String name = definition.child("name").stringValue();
        TreeNode calls = arena.syntheticNode(NodeKind.NAME, "id", name, "ctx", arena.syntheticNode(NodeKind.LOAD));
        List<TreeNode> decs = decorators != null ? decorators.items() : List.of();
        for (int i = decs.size() - 1; i >= 0; i--) {
            calls = arena.syntheticNode(NodeKind.CALL,
                    "func", decs.get(i),
                    "args", arena.syntheticList(List.of(calls)),
                    "keywords", arena.syntheticList(List.of()),
                    "starargs", null,
                    "kwargs", null);
        }
        TreeNode target = arena.syntheticNode(NodeKind.NAME, "id", name, "ctx", arena.syntheticNode(NodeKind.STORE));
        TreeNode assign = arena.syntheticNode(NodeKind.ASSIGN,
                "targets", arena.syntheticList(List.of(target)),
                "value", calls);
        return arena.syntheticList(List.of(bare, assign));
    }

    /** {@code t op= v} becomes {@code t = t op v}, with the right-hand {@code t} in load context. */
    public static TreeNode expandAugmentedAssign(TreeNode augAssign) {
        if (augAssign.kind() != NodeKind.AUG_ASSIGN) {
            throw new IllegalArgumentException("Not an augmented assignment: " + augAssign);
        }
        NodeArena arena = augAssign.getArena();
        TreeNode target = augAssign.child("target");
        TreeNode binOp = arena.syntheticNode(NodeKind.BIN_OP,
                "left", loadForm(target),
                "op", augAssign.child("op"),
                "right", augAssign.child("value"));
        return arena.syntheticNode(NodeKind.ASSIGN,
                "targets", arena.syntheticList(List.of(target)),
                "value", binOp);
    }

    /**
     * {@code for/while ... else: E} becomes the loop without {@code else} followed by {@code E}.
     * A {@code break} skips {@code E}, so running both over-approximates every path.
     */
    public static TreeNode splitLoopElse(TreeNode loop) {
        if (loop.kind() != NodeKind.FOR && loop.kind() != NodeKind.WHILE) {
            throw new IllegalArgumentException("Not a loop: " + loop);
        }
        NodeArena arena = loop.getArena();
        TreeNode orelse = loop.child("orelse");
        TreeNode bare = copyWith(loop, "orelse", arena.syntheticList(List.of()));
        return arena.syntheticList(List.of(bare, orelse));
    }

    /** Same access in load context: a Name, Attribute, Subscript or Starred with {@code ctx} replaced. */
    static TreeNode loadForm(TreeNode target) {
        if (!target.hasField("ctx")) return target;
        return copyWith(target, "ctx", target.getArena().syntheticNode(NodeKind.LOAD));
    }

    private static TreeNode copyWith(TreeNode node, String field, TreeNode replacement) {
        List<Object> pairs = new ArrayList<>();
        Map<String, TreeNode> fields = new LinkedHashMap<>();
        for (String f : node.fieldNames()) fields.put(f, node.child(f));
        fields.put(field, replacement);
        fields.forEach((f, v) -> {
            pairs.add(f);
            pairs.add(v);
        });
        return node.getArena().syntheticNode(node.kind(), pairs.toArray());
    }
}
