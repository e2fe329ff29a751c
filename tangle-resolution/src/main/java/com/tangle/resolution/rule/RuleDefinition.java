package com.tangle.resolution.rule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tangle.marking.BreakType;
import com.tangle.marking.MarkingKind;
import com.tangle.marking.ScopeClass;

import java.util.List;
import java.util.Locale;

/**
 * JSON form of a rule in an override file.
 * <p>
 * {@code type} is {@code leaf}, {@code sequential}, {@code allOf} or {@code anyOf}. Leaf rules
 * use {@code known}, {@code unknown} (kind names), {@code fields}, {@code addBreaks},
 * {@code removeBreaks}, {@code reads}/{@code writes} (fields holding names the node itself reads
 * or writes) and {@code global}/{@code nonlocal} (fields holding declared names). Combinations
 * use {@code rules}.
 */
public final class RuleDefinition {

    private final String type;
    private final List<String> known;
    private final List<String> unknown;
    private final List<String> fields;
    private final List<String> addBreaks;
    private final List<String> removeBreaks;
    private final List<String> reads;
    private final List<String> writes;
    private final List<String> global;
    private final List<String> nonlocal;
    private final List<RuleDefinition> rules;

    @JsonCreator
    public RuleDefinition(
            @JsonProperty("type") String type,
            @JsonProperty("known") List<String> known,
            @JsonProperty("unknown") List<String> unknown,
            @JsonProperty("fields") List<String> fields,
            @JsonProperty("addBreaks") List<String> addBreaks,
            @JsonProperty("removeBreaks") List<String> removeBreaks,
            @JsonProperty("reads") List<String> reads,
            @JsonProperty("writes") List<String> writes,
            @JsonProperty("global") List<String> global,
            @JsonProperty("nonlocal") List<String> nonlocal,
            @JsonProperty("rules") List<RuleDefinition> rules) {
        this.type = type != null ? type : "leaf";
        this.known = known;
        this.unknown = unknown != null ? List.copyOf(unknown) : List.of();
        this.fields = fields != null ? List.copyOf(fields) : List.of();
        this.addBreaks = addBreaks != null ? List.copyOf(addBreaks) : List.of();
        this.removeBreaks = removeBreaks != null ? List.copyOf(removeBreaks) : List.of();
        this.reads = reads != null ? List.copyOf(reads) : List.of();
        this.writes = writes != null ? List.copyOf(writes) : List.of();
        this.global = global != null ? List.copyOf(global) : List.of();
        this.nonlocal = nonlocal != null ? List.copyOf(nonlocal) : List.of();
        this.rules = rules != null ? List.copyOf(rules) : List.of();
    }

    public String getType() {
        return type;
    }

    public List<RuleDefinition> getRules() {
        return rules;
    }

    /**
     * Builds the rule.
     *
     * @throws IllegalArgumentException for an unknown type, kind or break name
     */
    public Rule toRule() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "leaf" -> toLeaf();
            case "sequential" -> new SequentialRule(subRules());
            case "allof" -> new AllOfRule(subRules());
            case "anyof" -> new AnyOfRule(subRules());
            default -> throw new IllegalArgumentException("Unknown rule type: " + type);
        };
    }

    private List<Rule> subRules() {
        return rules.stream().map(RuleDefinition::toRule).toList();
    }

    private LeafRule toLeaf() {
        LeafRule.Builder b = LeafRule.builder().fields(fields.toArray(new String[0]));
        if (known != null) {
            b.known(known.stream().map(MarkingKind::fromValue).toArray(MarkingKind[]::new));
        }
        b.unknown(unknown.stream().map(MarkingKind::fromValue).toArray(MarkingKind[]::new));
        b.addBreaks(addBreaks.stream().map(RuleDefinition::breakType).toArray(BreakType[]::new));
        b.removeBreaks(removeBreaks.stream().map(RuleDefinition::breakType).toArray(BreakType[]::new));
        for (String f : reads) b.reads(NameSource.field(f, ScopeClass.UNKNOWN));
        for (String f : writes) b.writes(NameSource.field(f, ScopeClass.UNKNOWN));
        for (String f : global) b.declares(NameSource.field(f, ScopeClass.GLOBAL));
        for (String f : nonlocal) b.declares(NameSource.field(f, ScopeClass.NONLOCAL));
        return b.build();
    }

    private static BreakType breakType(String tag) {
        return BreakType.parse(tag).orElseThrow(() -> new IllegalArgumentException("Unknown break type: " + tag));
    }
}
