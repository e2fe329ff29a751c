package com.tangle.resolution;

import com.tangle.tree.node.TreeNode;
import com.tangle.marking.MarkingKind;

import java.util.Set;

/**
 * External source of markings (e.g. a user at a console). May answer any subset of the
 * requested kinds or cancel the resolution.
 */
@FunctionalInterface
public interface InteractiveMarkingSource {

    /** Source that never answers. */
    InteractiveMarkingSource NONE = (node, needed) -> StrategyResult.nothing();

    StrategyResult request(TreeNode node, Set<MarkingKind> needed);
}
