package com.tangle.resolution;

import com.tangle.marking.MarkingKind;
import com.tangle.marking.MarkingStore;
import com.tangle.marking.Markings;
import com.tangle.tree.node.TreeNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Markings staged during one top-level resolution. Nothing reaches the store before
 * {@link #commit}; dropping the transaction discards every staged write.
 */
final class Transaction {

    private final Map<Integer, Markings> staged = new LinkedHashMap<>();
    private final Map<Integer, TreeNode> nodes = new LinkedHashMap<>();

    void stage(TreeNode node, Markings markings) {
        if (node.isSynthetic() || markings.isEmpty()) return;
        Markings existing = staged.computeIfAbsent(node.getId(), id -> new Markings());
        for (MarkingKind kind : markings.kinds()) existing.put(kind, markings.get(kind));
        nodes.putIfAbsent(node.getId(), node);
    }

    /** Staged value, or null. */
    Object lookup(TreeNode node, MarkingKind kind) {
        Markings m = staged.get(node.getId());
        return m != null ? m.get(kind) : null;
    }

    int size() {
        return staged.size();
    }

    void commit(MarkingStore store) {
        staged.forEach((id, markings) -> store.putAll(nodes.get(id), markings));
        staged.clear();
        nodes.clear();
    }
}
