package com.tangle.marking;

import com.tangle.tree.node.NodeArena;
import com.tangle.tree.node.TreeNode;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Side table of markings for the nodes of one {@link NodeArena}, keyed by node id.
 * Values are held as unmodifiable copies, so readers never alias a writer's value.
 * Writes for synthetic nodes are ignored.
 * <p>
 * Single writer per node; callers serialize access if markup is ever parallelized.
 */
public final class MarkingStore {

    private final NodeArena arena;
    private final Map<Integer, EnumMap<MarkingKind, Object>> byNode = new HashMap<>();

    public MarkingStore(NodeArena arena) {
        this.arena = Objects.requireNonNull(arena, "arena");
    }

    public NodeArena getArena() {
        return arena;
    }

    public boolean isMarked(TreeNode node, MarkingKind kind) {
        EnumMap<MarkingKind, Object> marks = byNode.get(owned(node).getId());
        return marks != null && marks.containsKey(kind);
    }

    /** Stored value, or null when the node is not marked with the kind. */
    public Object get(TreeNode node, MarkingKind kind) {
        EnumMap<MarkingKind, Object> marks = byNode.get(owned(node).getId());
        return marks != null ? marks.get(kind) : null;
    }

    /** Stored value, or the kind's default when unmarked. */
    public Object getOrDefault(TreeNode node, MarkingKind kind) {
        Object v = get(node, kind);
        return v != null ? v : MarkingValues.defaultValue(kind);
    }

    /**
     * Stores a copy of the value. Returns false (and stores nothing) for synthetic nodes.
     *
     * @throws IllegalArgumentException if the value has the wrong type for the kind
     */
    public boolean put(TreeNode node, MarkingKind kind, Object value) {
        Objects.requireNonNull(kind, "kind");
        Object frozen = MarkingValues.freeze(kind, value);
        if (owned(node).isSynthetic()) return false;
        byNode.computeIfAbsent(node.getId(), id -> new EnumMap<>(MarkingKind.class)).put(kind, frozen);
        return true;
    }

    /** Stores every kind present in the given markings. */
    public void putAll(TreeNode node, Markings markings) {
        for (MarkingKind kind : markings.kinds()) put(node, kind, markings.get(kind));
    }

    /** Removes one kind; returns whether it was present. */
    public boolean remove(TreeNode node, MarkingKind kind) {
        EnumMap<MarkingKind, Object> marks = byNode.get(owned(node).getId());
        if (marks == null || marks.remove(kind) == null) return false;
        if (marks.isEmpty()) byNode.remove(node.getId());
        return true;
    }

    /** All markings of a node (copy). */
    public Markings markingsOf(TreeNode node) {
        Markings out = new Markings();
        EnumMap<MarkingKind, Object> marks = byNode.get(owned(node).getId());
        if (marks != null) marks.forEach(out::put);
        return out;
    }

    public VisibleMarker visible(TreeNode node) {
        return new VisibleMarker(this, node);
    }

    public BreaksMarker breaks(TreeNode node) {
        return new BreaksMarker(this, node);
    }

    public VariableMarker reads(TreeNode node) {
        return new VariableMarker(MarkingKind.READS, this, node);
    }

    public VariableMarker writes(TreeNode node) {
        return new VariableMarker(MarkingKind.WRITES, this, node);
    }

    public ScopeMarker scope(TreeNode node) {
        return new ScopeMarker(this, node);
    }

    public IndirectRwMarker indirect(TreeNode node) {
        return new IndirectRwMarker(this, node);
    }

    /** Marker of the given kind bound to the node. */
    public Marker<?> marker(MarkingKind kind, TreeNode node) {
        return switch (kind) {
            case VISIBLE -> visible(node);
            case BREAKS -> breaks(node);
            case READS -> reads(node);
            case WRITES -> writes(node);
            case SCOPE -> scope(node);
            case INDIRECT_RW -> indirect(node);
        };
    }

    private TreeNode owned(TreeNode node) {
        Objects.requireNonNull(node, "node");
        if (node.getArena() != arena) {
            throw new IllegalArgumentException("Node " + node + " does not belong to this store's arena");
        }
        return node;
    }
}
