package com.tangle.bootstrap;

import com.tangle.branch.BrancherRepository;
import com.tangle.config.TangleConfig;
import com.tangle.reorder.SearchLimits;
import com.tangle.reorder.valuer.ValuerRegistry;
import com.tangle.resolution.StrategyType;
import com.tangle.resolution.python.PythonRuleTable;
import com.tangle.resolution.rule.RuleTable;
import com.tangle.resolution.rule.RuleTableJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Builds a {@link BootstrapContext} from configuration: validates the resolution order, loads
 * the default Python rule table with any overrides from {@code TANGLE_RULES_FILE}, creates the
 * shared random source, the valuer registry and an empty brancher repository.
 */
public final class TangleBootstrap {

    private static final Logger log = LoggerFactory.getLogger(TangleBootstrap.class);

    private TangleBootstrap() {
    }

    /** Loads configuration from the environment and bootstraps from it. */
    public static BootstrapContext initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(TangleConfig.fromEnvironment());
    }

    /**
     * @throws IllegalArgumentException if the resolution order names an unknown strategy or one twice
     * @throws java.io.UncheckedIOException if the rules file cannot be read or parsed
     */
    public static BootstrapContext initialize(TangleConfig config) {
        Objects.requireNonNull(config, "config");
        List<StrategyType> order = StrategyType.parseOrder(config.getResolutionOrder());
        RuleTable rules = loadRules(config.getRulesFile());
        Random random = config.getRandomSeed() != null ? new Random(config.getRandomSeed()) : new Random();
        ValuerRegistry valuers = ValuerRegistry.withDefaults(random);
        SearchLimits limits = new SearchLimits(config.getPermutationLimit());
        log.info("Bootstrap: order={}, {} rule(s), valuers={}, limits={}, safetyChecks={}",
                order, rules.size(), valuers.names(), limits, config.isSafetyChecks());
        return new BootstrapContext(config, order, rules, limits, valuers, new BrancherRepository(), random);
    }

    private static RuleTable loadRules(String rulesFile) {
        RuleTable defaults = PythonRuleTable.create();
        if (rulesFile == null) return defaults;
        Path file = Path.of(rulesFile);
        RuleTable overrides = RuleTableJson.load(file);
        log.info("Bootstrap: rule overrides applied from {} for {}", file.toAbsolutePath(), overrides.asMap().keySet());
        return defaults.overriddenBy(overrides);
    }
}
