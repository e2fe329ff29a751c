package com.tangle.resolution;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Ways of answering a marking request, tried in configured order. {@link #FALLBACK} is always
 * tried last and is never configured explicitly.
 */
public enum StrategyType {
    /** Read markings already stored on the node (or staged earlier in the same resolution). */
    EXISTING("existing", "mark"),
    /** Derive markings from the rule table. */
    COMPUTED("computed", "calc"),
    /** Ask an external source, which may cancel. */
    INTERACTIVE("interactive", "user"),
    /** Kind-specific defaults. */
    FALLBACK("fallback", "default");

    private final String tag;
    private final String alias;

    StrategyType(String tag, String alias) {
        this.tag = tag;
        this.alias = alias;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Parses a configurable strategy name ({@code existing|mark}, {@code computed|calc},
     * {@code interactive|user}).
     *
     * @throws IllegalArgumentException for an unknown name or for the implicit fallback
     */
    public static StrategyType fromValue(String value) {
        String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (StrategyType t : values()) {
            if (t == FALLBACK) continue;
            if (t.tag.equals(v) || t.alias.equals(v) || t.name().toLowerCase(Locale.ROOT).equals(v)) return t;
        }
        throw new IllegalArgumentException("Method " + value + " is invalid");
    }

    /**
     * Parses and validates a resolution order such as {@code "existing,computed"}.
     *
     * @throws IllegalArgumentException for an unknown name or a name given twice
     */
    public static List<StrategyType> parseOrder(String csv) {
        List<String> names = new ArrayList<>();
        if (csv != null && !csv.isBlank()) {
            for (String part : csv.split(",")) {
                if (!part.isBlank()) names.add(part.trim());
            }
        }
        return parseOrder(names);
    }

    public static List<StrategyType> parseOrder(List<String> names) {
        List<StrategyType> order = new ArrayList<>();
        for (String name : names) order.add(fromValue(name));
        return validateOrder(order);
    }

    /**
     * Checks that each configurable strategy appears at most once and that fallback is absent.
     *
     * @throws IllegalArgumentException otherwise
     */
    public static List<StrategyType> validateOrder(List<StrategyType> order) {
        Set<StrategyType> seen = EnumSet.noneOf(StrategyType.class);
        for (StrategyType t : order) {
            if (t == null || t == FALLBACK) {
                throw new IllegalArgumentException("Method " + t + " cannot be configured; fallback is always last");
            }
            if (!seen.add(t)) {
                throw new IllegalArgumentException("Method " + t.tag + " is specified too many times");
            }
        }
        return List.copyOf(order);
    }

    @Override
    public String toString() {
        return tag;
    }
}
