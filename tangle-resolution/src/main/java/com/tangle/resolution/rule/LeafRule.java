package com.tangle.resolution.rule;

import com.tangle.marking.BreakType;
import com.tangle.marking.MarkingKind;
import com.tangle.marking.ScopeClass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Direct rule: resolve the listed child fields in order, combine their markings, add the
 * node's own names and adjust breaks.
 * <p>
 * {@code known} restricts the kinds the rule may answer (null means all); {@code unknown}
 * lists kinds it never answers. A rule whose known and unknown sets overlap is invalid and
 * answers nothing.
 */
public final class LeafRule implements Rule {

    private final Set<MarkingKind> known;
    private final Set<MarkingKind> unknown;
    private final List<String> fields;
    private final Set<BreakType> addBreaks;
    private final Set<BreakType> removeBreaks;
    private final Map<MarkingKind, NameSource> names;

    private LeafRule(Builder b) {
        this.known = b.known != null ? Collections.unmodifiableSet(EnumSet.copyOf(b.known)) : null;
        this.unknown = Collections.unmodifiableSet(b.unknown);
        this.fields = List.copyOf(b.fields);
        this.addBreaks = Collections.unmodifiableSet(b.addBreaks);
        this.removeBreaks = Collections.unmodifiableSet(b.removeBreaks);
        this.names = Collections.unmodifiableMap(b.names);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Rule with no children and no adjustments: the node behaves like an empty statement. */
    public static LeafRule base() {
        return builder().build();
    }

    /** Rule that answers no kind. */
    public static LeafRule unknownAll() {
        return builder().unknown(MarkingKind.values()).build();
    }

    /** Rule combining the given child fields. */
    public static LeafRule of(String... fields) {
        return builder().fields(fields).build();
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitLeaf(this);
    }

    /** Allow-list, or null when unrestricted. */
    public Set<MarkingKind> getKnown() {
        return known;
    }

    public Set<MarkingKind> getUnknown() {
        return unknown;
    }

    public boolean isValid() {
        if (known == null) return true;
        return Collections.disjoint(known, unknown);
    }

    /** Kinds among {@code needed} this rule answers; empty for an invalid rule. */
    public Set<MarkingKind> answerable(Set<MarkingKind> needed) {
        if (!isValid() || needed.isEmpty()) return EnumSet.noneOf(MarkingKind.class);
        Set<MarkingKind> out = EnumSet.copyOf(needed);
        if (known != null) out.retainAll(known);
        out.removeAll(unknown);
        return out;
    }

    public List<String> getFields() {
        return fields;
    }

    public Set<BreakType> getAddBreaks() {
        return addBreaks;
    }

    public Set<BreakType> getRemoveBreaks() {
        return removeBreaks;
    }

    public Map<MarkingKind, NameSource> getNames() {
        return names;
    }

    public static final class Builder {
        private Set<MarkingKind> known;
        private final Set<MarkingKind> unknown = EnumSet.noneOf(MarkingKind.class);
        private final List<String> fields = new ArrayList<>();
        private final Set<BreakType> addBreaks = EnumSet.noneOf(BreakType.class);
        private final Set<BreakType> removeBreaks = EnumSet.noneOf(BreakType.class);
        private final Map<MarkingKind, NameSource> names = new EnumMap<>(MarkingKind.class);

        private Builder() {
        }

        public Builder known(MarkingKind... kinds) {
            if (known == null) known = EnumSet.noneOf(MarkingKind.class);
            Collections.addAll(known, kinds);
            return this;
        }

        public Builder known(Set<MarkingKind> kinds) {
            return known(kinds.toArray(new MarkingKind[0]));
        }

        public Builder unknown(MarkingKind... kinds) {
            Collections.addAll(unknown, kinds);
            return this;
        }

        public Builder fields(String... names) {
            for (String f : names) fields.add(Objects.requireNonNull(f, "field"));
            return this;
        }

        public Builder addBreaks(BreakType... types) {
            Collections.addAll(addBreaks, types);
            return this;
        }

        public Builder removeBreaks(BreakType... types) {
            Collections.addAll(removeBreaks, types);
            return this;
        }

        /**
         * Names the node itself contributes to reads, writes or scope.
         *
         * @throws IllegalArgumentException for any other kind
         */
        public Builder names(MarkingKind kind, NameSource source) {
            if (kind != MarkingKind.READS && kind != MarkingKind.WRITES && kind != MarkingKind.SCOPE) {
                throw new IllegalArgumentException("Name sources apply to reads, writes or scope, not " + kind);
            }
            names.merge(kind, Objects.requireNonNull(source, "source"), (a, b) -> node -> {
                Map<String, ScopeClass> m = new LinkedHashMap<>(a.names(node));
                m.putAll(b.names(node));
                return m;
            });
            return this;
        }

        public Builder reads(NameSource source) {
            return names(MarkingKind.READS, source);
        }

        public Builder writes(NameSource source) {
            return names(MarkingKind.WRITES, source);
        }

        public Builder declares(NameSource source) {
            return names(MarkingKind.SCOPE, source);
        }

        public LeafRule build() {
            return new LeafRule(this);
        }
    }
}
