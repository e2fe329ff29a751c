package com.tangle.marking;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Value semantics per {@link MarkingKind}: defaults, neutral elements, copies and the two
 * combination rules.
 * <p>
 * Value types: visible is {@code Boolean}; breaks is {@code Set<BreakType>}; reads, writes and
 * scope are {@code Map<String, ScopeClass>}; indirectrw is {@code Map<IndirectKey, IndirectAccess>}.
 */
public final class MarkingValues {

    private MarkingValues() {
    }

    /** Value reported for an unmarked node. */
    public static Object defaultValue(MarkingKind kind) {
        return switch (kind) {
            case VISIBLE -> Boolean.TRUE;
            default -> base(kind);
        };
    }

    /**
     * Value assumed for a node nothing could analyse: visible and able to raise, with no known
     * accesses. Unlike {@link #defaultValue}, a stored copy of it keeps the node pinned when
     * statements are reordered.
     */
    public static Object assumedValue(MarkingKind kind) {
        return switch (kind) {
            case VISIBLE -> Boolean.TRUE;
            case BREAKS -> EnumSet.of(BreakType.EXCEPT);
            default -> base(kind);
        };
    }

    /**
     * Value of an empty sequence of nodes (nothing executed): not visible, no breaks, no accesses.
     * Neutral element of {@link #combine}.
     */
    public static Object base(MarkingKind kind) {
        return switch (kind) {
            case VISIBLE -> Boolean.FALSE;
            case BREAKS -> EnumSet.noneOf(BreakType.class);
            case READS, WRITES, SCOPE -> new LinkedHashMap<String, ScopeClass>();
            case INDIRECT_RW -> new LinkedHashMap<IndirectKey, IndirectAccess>();
        };
    }

    /** Mutable deep-enough copy (keys and leaf values are immutable). */
    @SuppressWarnings("unchecked")
    public static Object copy(MarkingKind kind, Object value) {
        Object v = check(kind, value);
        return switch (kind) {
            case VISIBLE -> v;
            case BREAKS -> {
                Set<BreakType> s = (Set<BreakType>) v;
                yield s.isEmpty() ? EnumSet.noneOf(BreakType.class) : EnumSet.copyOf(s);
            }
            case READS, WRITES, SCOPE -> new LinkedHashMap<>((Map<String, ScopeClass>) v);
            case INDIRECT_RW -> new LinkedHashMap<>((Map<IndirectKey, IndirectAccess>) v);
        };
    }

    /** Unmodifiable copy, as held by the store. */
    @SuppressWarnings("unchecked")
    public static Object freeze(MarkingKind kind, Object value) {
        Object c = copy(kind, value);
        return switch (kind) {
            case VISIBLE -> c;
            case BREAKS -> Collections.unmodifiableSet((Set<BreakType>) c);
            case READS, WRITES, SCOPE, INDIRECT_RW -> Collections.unmodifiableMap((Map<Object, Object>) c);
        };
    }

    /**
     * Result of executing something with marking {@code first} and then something with
     * marking {@code second}: visible OR, breaks union, reads/writes/scope key-wise union with
     * the later scope class winning, indirectrw flag-wise OR per key. Inputs are not modified.
     */
    @SuppressWarnings("unchecked")
    public static Object combine(MarkingKind kind, Object first, Object second) {
        check(kind, first);
        check(kind, second);
        return switch (kind) {
            case VISIBLE -> (Boolean) first || (Boolean) second;
            case BREAKS -> {
                Set<BreakType> out = (Set<BreakType>) copy(kind, first);
                out.addAll((Set<BreakType>) second);
                yield out;
            }
            case READS, WRITES, SCOPE -> {
                Map<String, ScopeClass> out = (Map<String, ScopeClass>) copy(kind, first);
                out.putAll((Map<String, ScopeClass>) second);
                yield out;
            }
            case INDIRECT_RW -> {
                Map<IndirectKey, IndirectAccess> out = (Map<IndirectKey, IndirectAccess>) copy(kind, first);
                ((Map<IndirectKey, IndirectAccess>) second).forEach((k, a) -> out.merge(k, a, IndirectAccess::or));
                yield out;
            }
        };
    }

    /** Folds {@link #combine} over the values, starting from {@link #base}. */
    public static Object combineAll(MarkingKind kind, Collection<?> values) {
        Object acc = base(kind);
        for (Object v : values) acc = combine(kind, acc, v);
        return acc;
    }

    /**
     * Merge of mutually exclusive alternatives. Same as {@link #combine} except that a name
     * present in both reads/writes/scope maps with different scope classes becomes
     * {@link ScopeClass#UNKNOWN}.
     */
    @SuppressWarnings("unchecked")
    public static Object anyOfMerge(MarkingKind kind, Object first, Object second) {
        return switch (kind) {
            case READS, WRITES, SCOPE -> {
                check(kind, first);
                check(kind, second);
                Map<String, ScopeClass> out = (Map<String, ScopeClass>) copy(kind, first);
                ((Map<String, ScopeClass>) second).forEach((name, scope) ->
                        out.merge(name, scope, (a, b) -> a == b ? a : ScopeClass.UNKNOWN));
                yield out;
            }
            default -> combine(kind, first, second);
        };
    }

    /**
     * Verifies the runtime type of a value for a kind.
     *
     * @throws IllegalArgumentException on a mismatch
     */
    public static Object check(MarkingKind kind, Object value) {
        boolean ok = switch (kind) {
            case VISIBLE -> value instanceof Boolean;
            case BREAKS -> value instanceof Set<?> s && s.stream().allMatch(BreakType.class::isInstance);
            case READS, WRITES, SCOPE -> value instanceof Map<?, ?> m && m.entrySet().stream()
                    .allMatch(e -> e.getKey() instanceof String && e.getValue() instanceof ScopeClass);
            case INDIRECT_RW -> value instanceof Map<?, ?> m && m.entrySet().stream()
                    .allMatch(e -> e.getKey() instanceof IndirectKey && e.getValue() instanceof IndirectAccess);
        };
        if (!ok) {
            throw new IllegalArgumentException("Invalid value for marking " + kind + ": " + value);
        }
        return value;
    }
}
