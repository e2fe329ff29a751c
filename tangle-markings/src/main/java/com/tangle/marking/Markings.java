package com.tangle.marking;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * A set of marking values by kind, as produced by resolution. A kind that no strategy could
 * answer is simply absent.
 */
public final class Markings {

    private final EnumMap<MarkingKind, Object> values = new EnumMap<>(MarkingKind.class);

    public static Markings of(MarkingKind kind, Object value) {
        Markings m = new Markings();
        m.put(kind, value);
        return m;
    }

    public boolean contains(MarkingKind kind) {
        return values.containsKey(kind);
    }

    /** Value for the kind, or null when absent. */
    public Object get(MarkingKind kind) {
        return values.get(kind);
    }

    public Markings put(MarkingKind kind, Object value) {
        values.put(kind, MarkingValues.copy(kind, value));
        return this;
    }

    /** Adds the kinds of {@code other} not already present. */
    public Markings putMissing(Markings other) {
        other.values.forEach((k, v) -> {
            if (!values.containsKey(k)) put(k, v);
        });
        return this;
    }

    public Markings remove(MarkingKind kind) {
        values.remove(kind);
        return this;
    }

    public Set<MarkingKind> kinds() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    /** Copy restricted to the given kinds. */
    public Markings restrictTo(Set<MarkingKind> kinds) {
        Markings out = new Markings();
        values.forEach((k, v) -> {
            if (kinds.contains(k)) out.put(k, v);
        });
        return out;
    }

    public Markings copy() {
        Markings out = new Markings();
        values.forEach(out::put);
        return out;
    }

    public Boolean visible() {
        return (Boolean) values.get(MarkingKind.VISIBLE);
    }

    @SuppressWarnings("unchecked")
    public Set<BreakType> breaks() {
        return (Set<BreakType>) values.get(MarkingKind.BREAKS);
    }

    @SuppressWarnings("unchecked")
    public Map<String, ScopeClass> reads() {
        return (Map<String, ScopeClass>) values.get(MarkingKind.READS);
    }

    @SuppressWarnings("unchecked")
    public Map<String, ScopeClass> writes() {
        return (Map<String, ScopeClass>) values.get(MarkingKind.WRITES);
    }

    @SuppressWarnings("unchecked")
    public Map<String, ScopeClass> scope() {
        return (Map<String, ScopeClass>) values.get(MarkingKind.SCOPE);
    }

    @SuppressWarnings("unchecked")
    public Map<IndirectKey, IndirectAccess> indirect() {
        return (Map<IndirectKey, IndirectAccess>) values.get(MarkingKind.INDIRECT_RW);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Markings other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
