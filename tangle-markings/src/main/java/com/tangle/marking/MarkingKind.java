package com.tangle.marking;

import java.util.Locale;

/**
 * Kinds of semantic fact attached to a node. The tag is the name used by callers and in rule files.
 */
public enum MarkingKind {
    /** Whether executing the node has an externally observable effect. Boolean. */
    VISIBLE("visible"),
    /** Ways the node may leave linear control flow. Set of {@link BreakType}. */
    BREAKS("breaks"),
    /** Names read, with their scope class. */
    READS("reads"),
    /** Names written, with their scope class. */
    WRITES("writes"),
    /** Accesses of non-local names from an enclosed scope. */
    INDIRECT_RW("indirectrw"),
    /** global / nonlocal declarations made by the node. */
    SCOPE("scope");

    private final String tag;

    MarkingKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Parses a kind from its tag ("indirectrw") or enum name ("INDIRECT_RW"), case-insensitive.
     *
     * @throws IllegalArgumentException if the value names no marking kind
     */
    public static MarkingKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Unknown marking kind: " + value);
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (MarkingKind k : values()) {
            if (k.tag.equals(v) || k.name().toLowerCase(Locale.ROOT).equals(v)) return k;
        }
        throw new IllegalArgumentException("Unknown marking kind: " + value);
    }

    @Override
    public String toString() {
        return tag;
    }
}
