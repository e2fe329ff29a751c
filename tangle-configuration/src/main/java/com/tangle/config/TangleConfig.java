package com.tangle.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration loaded from environment variables.
 * <p>
 * Resolution: TANGLE_RESOLUTION_ORDER (comma-separated strategy names, default
 * {@code existing,computed}), TANGLE_WRITE_BACK, TANGLE_RULES_FILE. Reordering:
 * TANGLE_PERMUTATION_LIMIT, TANGLE_SAFETY_CHECKS. Randomness: TANGLE_RANDOM_SEED.
 */
public final class TangleConfig {

    private static final Logger log = LoggerFactory.getLogger(TangleConfig.class);

    static final String ENV_RESOLUTION_ORDER = "TANGLE_RESOLUTION_ORDER";
    static final String ENV_WRITE_BACK = "TANGLE_WRITE_BACK";
    static final String ENV_PERMUTATION_LIMIT = "TANGLE_PERMUTATION_LIMIT";
    static final String ENV_SAFETY_CHECKS = "TANGLE_SAFETY_CHECKS";
    static final String ENV_RULES_FILE = "TANGLE_RULES_FILE";
    static final String ENV_RANDOM_SEED = "TANGLE_RANDOM_SEED";

    private static final List<String> DEFAULT_RESOLUTION_ORDER = List.of("existing", "computed");
    private static final boolean DEFAULT_WRITE_BACK = true;
    private static final long DEFAULT_PERMUTATION_LIMIT = 100_000L;
    private static final boolean DEFAULT_SAFETY_CHECKS = false;

    private final List<String> resolutionOrder;
    private final boolean writeBack;
    private final long permutationLimit;
    private final boolean safetyChecks;
    private final String rulesFile;
    private final Long randomSeed;

    private TangleConfig(Builder b) {
        this.resolutionOrder = Collections.unmodifiableList(new ArrayList<>(b.resolutionOrder));
        this.writeBack = b.writeBack;
        this.permutationLimit = b.permutationLimit;
        this.safetyChecks = b.safetyChecks;
        this.rulesFile = b.rulesFile;
        this.randomSeed = b.randomSeed;
    }

    /**
     * Strategy names in the order they are tried, e.g. {@code [existing, computed]}. Names are
     * validated where the resolution engine is built.
     */
    public List<String> getResolutionOrder() {
        return resolutionOrder;
    }

    /** Whether resolved markings are stored on the nodes. Default true. */
    public boolean isWriteBack() {
        return writeBack;
    }

    /** Maximum number of permutations one search may visit. Default 100000. */
    public long getPermutationLimit() {
        return permutationLimit;
    }

    /** Whether every emitted permutation is re-checked against the partition constraints. Default false. */
    public boolean isSafetyChecks() {
        return safetyChecks;
    }

    /** Path of a JSON rule-override file, or null when none is configured. */
    public String getRulesFile() {
        return rulesFile;
    }

    /** Seed for the shared random source, or null for an unseeded one. */
    public Long getRandomSeed() {
        return randomSeed;
    }

    public static TangleConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /** Same as {@link #fromEnvironment()} but reads variables from the given map. */
    public static TangleConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return fromEnvironment(env::get);
    }

    private static TangleConfig fromEnvironment(Function<String, String> env) {
        List<String> order = parseCommaSeparated(env.apply(ENV_RESOLUTION_ORDER));
        if (order.isEmpty()) order = DEFAULT_RESOLUTION_ORDER;

        TangleConfig config = builder()
                .resolutionOrder(order)
                .writeBack(parseBoolean(env.apply(ENV_WRITE_BACK), DEFAULT_WRITE_BACK))
                .permutationLimit(parseLimit(env.apply(ENV_PERMUTATION_LIMIT)))
                .safetyChecks(parseBoolean(env.apply(ENV_SAFETY_CHECKS), DEFAULT_SAFETY_CHECKS))
                .rulesFile(trimToNull(env.apply(ENV_RULES_FILE)))
                .randomSeed(parseSeed(env.apply(ENV_RANDOM_SEED)))
                .build();
        log.info("Configuration loaded: order={}, writeBack={}, permutationLimit={}, safetyChecks={}, rulesFile={}, seeded={}",
                config.resolutionOrder, config.writeBack, config.permutationLimit, config.safetyChecks,
                config.rulesFile, config.randomSeed != null);
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static long parseLimit(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_PERMUTATION_LIMIT;
        }
        try {
            long limit = Long.parseLong(value.trim());
            if (limit >= 1) return limit;
        } catch (NumberFormatException e) {
            log.warn("{} is not a number: {}", ENV_PERMUTATION_LIMIT, value);
            return DEFAULT_PERMUTATION_LIMIT;
        }
        log.warn("{} must be at least 1, got {}; using {}", ENV_PERMUTATION_LIMIT, value, DEFAULT_PERMUTATION_LIMIT);
        return DEFAULT_PERMUTATION_LIMIT;
    }

    private static Long parseSeed(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("{} is not a number: {}; using an unseeded random source", ENV_RANDOM_SEED, value);
            return null;
        }
    }

    private static String trimToNull(String value) {
        return (value != null && !value.isBlank()) ? value.trim() : null;
    }

    public static final class Builder {
        private List<String> resolutionOrder = DEFAULT_RESOLUTION_ORDER;
        private boolean writeBack = DEFAULT_WRITE_BACK;
        private long permutationLimit = DEFAULT_PERMUTATION_LIMIT;
        private boolean safetyChecks = DEFAULT_SAFETY_CHECKS;
        private String rulesFile;
        private Long randomSeed;

        public Builder resolutionOrder(List<String> resolutionOrder) {
            this.resolutionOrder = Objects.requireNonNull(resolutionOrder, "resolutionOrder");
            return this;
        }

        public Builder writeBack(boolean writeBack) {
            this.writeBack = writeBack;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the limit is below 1
         */
        public Builder permutationLimit(long permutationLimit) {
            if (permutationLimit < 1) {
                throw new IllegalArgumentException("Permutation limit must be at least 1, got " + permutationLimit);
            }
            this.permutationLimit = permutationLimit;
            return this;
        }

        public Builder safetyChecks(boolean safetyChecks) {
            this.safetyChecks = safetyChecks;
            return this;
        }

        public Builder rulesFile(String rulesFile) {
            this.rulesFile = rulesFile;
            return this;
        }

        public Builder randomSeed(Long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public TangleConfig build() {
            return new TangleConfig(this);
        }
    }
}
