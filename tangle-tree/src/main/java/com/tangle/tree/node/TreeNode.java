package com.tangle.tree.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Node in a syntax tree. Can be a structured node (kind tag plus named fields), an ordered
 * list of nodes, an atomic leaf (string, integer, float, bytes) or an empty slot.
 * <p>
 * Nodes are created only by a {@link NodeArena}, which assigns each one a stable integer id.
 * Identity is the id: two structurally identical nodes are distinct, and side tables
 * (markings) are keyed by id. Kind and arity never change after construction.
 * Nodes flagged {@link #isSynthetic() synthetic} are transient rewrites built during analysis.
 */
public final class TreeNode {

    private final NodeArena arena;
    private final int id;
    private final NodeKind kind;
    private final Map<String, TreeNode> fields;
    private final List<TreeNode> items;
    private final Object value;
    private final boolean synthetic;

    TreeNode(NodeArena arena, int id, NodeKind kind, Map<String, TreeNode> fields,
             List<TreeNode> items, Object value, boolean synthetic) {
        this.arena = arena;
        this.id = id;
        this.kind = kind;
        this.fields = fields != null ? Collections.unmodifiableMap(fields) : Map.of();
        this.items = items != null ? Collections.unmodifiableList(items) : List.of();
        this.value = value;
        this.synthetic = synthetic;
    }

    /** Arena-unique id: non-negative for retained nodes, negative for transient ones. */
    public int getId() {
        return id;
    }

    public NodeArena getArena() {
        return arena;
    }

    /** Kind of this node. Never null. */
    public NodeKind kind() {
        return kind;
    }

    public NodeCategory category() {
        return kind.getCategory();
    }

    public boolean isEmpty() {
        return kind == NodeKind.EMPTY;
    }

    public boolean isList() {
        return kind == NodeKind.NODE_LIST;
    }

    public boolean isAtomic() {
        return kind == NodeKind.ATOMIC;
    }

    public boolean isStructured() {
        return kind.getCategory() == NodeCategory.STRUCTURED;
    }

    /** True for nodes built by a rewrite; markings are never persisted for them. */
    public boolean isSynthetic() {
        return synthetic;
    }

    /** Atomic value (String, Long, Double, BigInteger or byte[]); null for other categories. */
    public Object value() {
        return value;
    }

    /** Atomic value as a string, or null when this is not a string leaf. */
    public String stringValue() {
        return value instanceof String s ? s : null;
    }

    /**
     * Ordered (label, child) pairs. Structured nodes use field names in declaration order,
     * lists use their positions. Atomic and empty nodes have no children.
     */
    public List<NodeChild> children() {
        if (isList()) {
            List<NodeChild> out = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                out.add(new NodeChild(String.valueOf(i), items.get(i)));
            }
            return out;
        }
        if (fields.isEmpty()) return List.of();
        List<NodeChild> out = new ArrayList<>(fields.size());
        fields.forEach((name, child) -> out.add(new NodeChild(name, child)));
        return out;
    }

    /** Field names of a structured node, in declaration order. */
    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public boolean hasField(String field) {
        return fields.containsKey(field);
    }

    /** Child stored under the given field, or null if the node has no such field. */
    public TreeNode child(String field) {
        return fields.get(field);
    }

    /** True if the field is absent, empty, or an empty list. */
    public boolean isBlank(String field) {
        TreeNode c = fields.get(field);
        return c == null || c.isEmpty() || (c.isList() && c.size() == 0);
    }

    /** Items of a list node. Unmodifiable; empty for other categories. */
    public List<TreeNode> items() {
        return items;
    }

    /** Number of items of a list node (0 for other categories). */
    public int size() {
        return items.size();
    }

    public TreeNode get(int index) {
        return items.get(index);
    }

    /**
     * Finds a node by id in the subtree rooted at {@code root} (DFS). Returns null if not found.
     */
    public static TreeNode findById(TreeNode root, int nodeId) {
        if (root == null) return null;
        if (root.id == nodeId) return root;
        for (NodeChild child : root.children()) {
            TreeNode found = findById(child.node(), nodeId);
            if (found != null) return found;
        }
        return null;
    }

    @Override
    public String toString() {
        if (isAtomic()) return "atomic#" + id + "(" + value + ")";
        return kind.getTag() + "#" + id;
    }
}
