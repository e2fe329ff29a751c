package com.tangle.reorder;

import com.tangle.marking.MarkingStore;
import com.tangle.tree.node.TreeNode;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Reorderer producing each partition's orderings in random order. Combined with a small search
 * budget this picks a random safe ordering quickly.
 */
public class RandomReorderer extends Reorderer {

    private final Random random;

    public RandomReorderer(MarkingStore store, List<TreeNode> statements, Random random) {
        this(store, statements, SearchLimits.defaults(), false, random);
    }

    public RandomReorderer(MarkingStore store, List<TreeNode> statements, SearchLimits limits,
                           boolean safetyChecks, Random random) {
        super(store, statements, limits, safetyChecks);
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    Iterator<List<Integer>> partitionOrderings(PartitionOrder partition) {
        return partition.orderings(random);
    }
}
