package com.tangle.marking;

import com.tangle.tree.node.TreeNode;

/** Visibility of a node. Unmarked nodes are treated as visible. */
public final class VisibleMarker extends Marker<Boolean> {

    VisibleMarker(MarkingStore store, TreeNode node) {
        super(MarkingKind.VISIBLE, store, node);
    }

    public boolean isVisible() {
        return get();
    }

    public boolean setVisible(boolean visible) {
        return update(v -> visible);
    }
}
