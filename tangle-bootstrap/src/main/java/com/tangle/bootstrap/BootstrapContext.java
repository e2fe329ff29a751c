package com.tangle.bootstrap;

import com.tangle.branch.Brancher;
import com.tangle.branch.BrancherRepository;
import com.tangle.config.TangleConfig;
import com.tangle.marking.MarkingStore;
import com.tangle.reorder.RandomReorderer;
import com.tangle.reorder.Reorderer;
import com.tangle.reorder.SearchLimits;
import com.tangle.reorder.valuer.ValuerRegistry;
import com.tangle.resolution.InteractiveMarkingSource;
import com.tangle.resolution.ResolutionEngine;
import com.tangle.resolution.ReviewCallback;
import com.tangle.resolution.StrategyType;
import com.tangle.resolution.rule.RuleTable;
import com.tangle.tree.node.TreeNode;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Result of bootstrap. Holds the configuration plus the shared pieces built from it, and
 * creates engines bound to a caller's marking store.
 */
public final class BootstrapContext {

    private final TangleConfig config;
    private final List<StrategyType> resolutionOrder;
    private final RuleTable rules;
    private final SearchLimits limits;
    private final ValuerRegistry valuers;
    private final BrancherRepository branchers;
    private final Random random;

    BootstrapContext(TangleConfig config, List<StrategyType> resolutionOrder, RuleTable rules, SearchLimits limits,
                     ValuerRegistry valuers, BrancherRepository branchers, Random random) {
        this.config = Objects.requireNonNull(config, "config");
        this.resolutionOrder = List.copyOf(resolutionOrder);
        this.rules = Objects.requireNonNull(rules, "rules");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.valuers = Objects.requireNonNull(valuers, "valuers");
        this.branchers = Objects.requireNonNull(branchers, "branchers");
        this.random = Objects.requireNonNull(random, "random");
    }

    public TangleConfig getConfig() {
        return config;
    }

    /** Validated strategy order from {@code TANGLE_RESOLUTION_ORDER}. */
    public List<StrategyType> getResolutionOrder() {
        return resolutionOrder;
    }

    /** Default rule table with file overrides applied. */
    public RuleTable getRules() {
        return rules;
    }

    public SearchLimits getLimits() {
        return limits;
    }

    public ValuerRegistry getValuers() {
        return valuers;
    }

    public BrancherRepository getBranchers() {
        return branchers;
    }

    /** Random source shared by random valuers, reorderers and branchers; seeded when configured. */
    public Random getRandom() {
        return random;
    }

    public ResolutionEngine resolutionEngine(MarkingStore store) {
        return resolutionEngine(store, InteractiveMarkingSource.NONE, ReviewCallback.ACCEPT_ALL);
    }

    /**
     * Engine with the configured order, rules and write-back, asking {@code interactive} when the
     * order includes the interactive strategy.
     */
    public ResolutionEngine resolutionEngine(MarkingStore store, InteractiveMarkingSource interactive,
                                             ReviewCallback review) {
        return ResolutionEngine.builder()
                .store(Objects.requireNonNull(store, "store"))
                .order(resolutionOrder)
                .rules(rules)
                .writeBack(config.isWriteBack())
                .interactive(interactive)
                .review(review)
                .build();
    }

    public Reorderer reorderer(MarkingStore store, List<TreeNode> statements) {
        return new Reorderer(store, statements, limits, config.isSafetyChecks());
    }

    public RandomReorderer randomReorderer(MarkingStore store, List<TreeNode> statements) {
        return new RandomReorderer(store, statements, limits, config.isSafetyChecks(), random);
    }

    /**
     * Creates a brancher and adds it to the repository.
     *
     * @throws IllegalArgumentException if a brancher with the name already exists
     */
    public Brancher newBrancher(String name, MarkingStore store) {
        Brancher brancher = new Brancher(name, store, random);
        branchers.add(brancher);
        return brancher;
    }
}
