package com.tangle.reorder;

import com.tangle.marking.BreakType;
import com.tangle.marking.MarkingKind;
import com.tangle.marking.MarkingStore;
import com.tangle.marking.ScopeClass;
import com.tangle.tree.node.TreeNode;

import java.util.Map;
import java.util.Set;

/**
 * Snapshot of the markings of one statement, as seen by partitioning, dependency checks and
 * valuers. {@code index} is the statement's position in the original sequence.
 *
 * @param breaks stored breaks, or null when the statement carries no breaks marking
 */
public record StatementMarks(int index,
                             TreeNode statement,
                             boolean visible,
                             Set<BreakType> breaks,
                             Map<String, ScopeClass> reads,
                             Map<String, ScopeClass> writes,
                             Map<String, ScopeClass> scope) {

    @SuppressWarnings("unchecked")
    static StatementMarks of(MarkingStore store, int index, TreeNode statement) {
        return new StatementMarks(index, statement,
                (Boolean) store.getOrDefault(statement, MarkingKind.VISIBLE),
                (Set<BreakType>) store.get(statement, MarkingKind.BREAKS),
                (Map<String, ScopeClass>) store.getOrDefault(statement, MarkingKind.READS),
                (Map<String, ScopeClass>) store.getOrDefault(statement, MarkingKind.WRITES),
                (Map<String, ScopeClass>) store.getOrDefault(statement, MarkingKind.SCOPE));
    }

    /** True when the statement may break control flow; unmarked statements may. */
    public boolean canBreak() {
        return breaks == null || !breaks.isEmpty();
    }

    /**
     * True when swapping this statement with {@code later} could change behaviour: one writes a
     * name the other reads or writes, one declares the scope of a name the other uses, or both
     * are visible.
     *
     * <p>The visible rule is deliberately stricter than free permutation within a partition.
     * Two statements that each produce observable output never swap, so the output order is
     * kept. Free permutation of a partition therefore holds only for its invisible statements.
     */
    public boolean conflictsWith(StatementMarks later) {
        if (visible && later.visible) return true;
        if (overlaps(writes, later.reads) || overlaps(writes, later.writes) || overlaps(reads, later.writes)) {
            return true;
        }
        return touches(scope, later) || later.touches(later.scope, this);
    }

    private boolean touches(Map<String, ScopeClass> declared, StatementMarks other) {
        if (declared.isEmpty()) return false;
        return overlaps(declared, other.reads) || overlaps(declared, other.writes) || overlaps(declared, other.scope);
    }

    private static boolean overlaps(Map<String, ?> a, Map<String, ?> b) {
        if (a.isEmpty() || b.isEmpty()) return false;
        for (String name : a.keySet()) {
            if (b.containsKey(name)) return true;
        }
        return false;
    }
}
