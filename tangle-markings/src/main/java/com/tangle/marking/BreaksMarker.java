package com.tangle.marking;

import com.tangle.tree.node.TreeNode;

import java.util.Optional;
import java.util.Set;

/** Flow breakers of a node. */
public final class BreaksMarker extends Marker<Set<BreakType>> {

    BreaksMarker(MarkingStore store, TreeNode node) {
        super(MarkingKind.BREAKS, store, node);
    }

    /** True if the node may leave linear flow. Unmarked nodes are assumed to break. */
    public boolean canBreak() {
        if (!isMarked()) return true;
        return !get().isEmpty();
    }

    public boolean canBreak(BreakType type) {
        if (!isMarked()) return true;
        return get().contains(type);
    }

    /** Adds a break type given by tag. Returns false for an unrecognised tag or when already present. */
    public boolean addBreak(String type) {
        Optional<BreakType> parsed = BreakType.parse(type);
        return parsed.isPresent() && addBreak(parsed.get());
    }

    public boolean addBreak(BreakType type) {
        return update(s -> {
            s.add(type);
            return s;
        });
    }

    /** Removes a break type given by tag. Returns false for an unrecognised tag or when absent. */
    public boolean removeBreak(String type) {
        Optional<BreakType> parsed = BreakType.parse(type);
        return parsed.isPresent() && removeBreak(parsed.get());
    }

    public boolean removeBreak(BreakType type) {
        return update(s -> {
            s.remove(type);
            return s;
        });
    }
}
