package com.tangle.marking;

import com.tangle.tree.node.TreeNode;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Typed view of one marking kind on one node.
 * <p>
 * {@link #detach()} snapshots the current value and rebinds the marker to a fresh placeholder
 * node with a private store: later mutations through the marker never reach the original node.
 * Callers apply edits to a detached marker and commit the result with {@link MarkingStore#put}.
 *
 * @param <T> value type of the kind
 */
public abstract class Marker<T> {

    private final MarkingKind kind;
    private MarkingStore store;
    private TreeNode node;

    protected Marker(MarkingKind kind, MarkingStore store, TreeNode node) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.store = Objects.requireNonNull(store, "store");
        this.node = Objects.requireNonNull(node, "node");
    }

    public MarkingKind getKind() {
        return kind;
    }

    public TreeNode getNode() {
        return node;
    }

    public boolean isMarked() {
        return store.isMarked(node, kind);
    }

    /** Stored value, or the default when unmarked. The returned value is unmodifiable. */
    @SuppressWarnings("unchecked")
    public T get() {
        return (T) store.getOrDefault(node, kind);
    }

    /** Stores the value; returns false if the node cannot hold markings (synthetic). */
    public boolean set(T value) {
        return store.put(node, kind, value);
    }

    /** Mutable copy of the current value. */
    @SuppressWarnings("unchecked")
    public T duplicate() {
        return (T) MarkingValues.copy(kind, get());
    }

    public T defaultValue() {
        @SuppressWarnings("unchecked")
        T v = (T) MarkingValues.defaultValue(kind);
        return v;
    }

    /** Snapshots the value and rebinds this marker to an unattached placeholder. */
    public void detach() {
        boolean marked = isMarked();
        T data = duplicate();
        MarkingStore privateStore = new MarkingStore(store.getArena());
        TreeNode placeholder = store.getArena().placeholder();
        this.store = privateStore;
        this.node = placeholder;
        if (marked) set(data);
    }

    /** Applies a change function to a mutable copy and stores it; returns whether the value changed. */
    protected boolean update(UnaryOperator<T> change) {
        T before = get();
        T after = change.apply(duplicate());
        boolean changed = !after.equals(before) || !isMarked();
        return set(after) && changed;
    }
}
