package com.tangle.resolution;

import com.tangle.marking.BreakType;
import com.tangle.marking.MarkingKind;
import com.tangle.marking.MarkingValues;
import com.tangle.marking.Markings;
import com.tangle.resolution.rule.AllOfRule;
import com.tangle.resolution.rule.AnyOfRule;
import com.tangle.resolution.rule.ConditionalRule;
import com.tangle.resolution.rule.LeafRule;
import com.tangle.resolution.rule.NameSource;
import com.tangle.resolution.rule.RewriteRule;
import com.tangle.resolution.rule.Rule;
import com.tangle.resolution.rule.RuleVisitor;
import com.tangle.resolution.rule.SequentialRule;
import com.tangle.tree.node.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates one rule for one node. Children are resolved through the engine, so they go
 * through the full strategy chain and may cancel.
 */
final class RuleEvaluator implements RuleVisitor<StrategyResult> {

    private static final Logger log = LoggerFactory.getLogger(RuleEvaluator.class);

    /** Resolution of a child node within the current transaction. */
    @FunctionalInterface
    interface ChildResolver {
        StrategyResult resolve(TreeNode child, Set<MarkingKind> needed);
    }

    private final TreeNode node;
    private final Set<MarkingKind> needed;
    private final ChildResolver children;

    RuleEvaluator(TreeNode node, Set<MarkingKind> needed, ChildResolver children) {
        this.node = node;
        this.needed = needed;
        this.children = children;
    }

    StrategyResult evaluate(Rule rule) {
        return rule.accept(this);
    }

    @Override
    public StrategyResult visitLeaf(LeafRule rule) {
        if (!rule.isValid()) {
            log.debug("Rule for {} has overlapping known/unknown kinds; no answer", node);
            return StrategyResult.nothing();
        }
        Set<MarkingKind> kinds = rule.answerable(needed);
        if (kinds.isEmpty()) return StrategyResult.nothing();

        Markings acc = new Markings();
        for (MarkingKind kind : kinds) acc.put(kind, MarkingValues.base(kind));

        for (String field : rule.getFields()) {
            TreeNode child = node.child(field);
            if (child == null) continue;
            StrategyResult r = children.resolve(child, kinds);
            if (r.isCancelled()) return r;
            combineInto(acc, r.getMarkings(), kinds);
        }
        for (Map.Entry<MarkingKind, NameSource> e : rule.getNames().entrySet()) {
            MarkingKind kind = e.getKey();
            if (kinds.contains(kind)) {
                acc.put(kind, MarkingValues.combine(kind, acc.get(kind), e.getValue().names(node)));
            }
        }
        if (kinds.contains(MarkingKind.BREAKS)) {
            Set<BreakType> breaks = acc.breaks();
            breaks.removeAll(rule.getRemoveBreaks());
            breaks.addAll(rule.getAddBreaks());
        }
        return StrategyResult.answered(acc);
    }

    @Override
    public StrategyResult visitRewrite(RewriteRule rule) {
        TreeNode rewritten = rule.rewrite(node);
        log.debug("Rewrote {} ({}) to {}", node, rule.getDescription(), rewritten);
        return children.resolve(rewritten, needed);
    }

    @Override
    public StrategyResult visitSequential(SequentialRule rule) {
        Markings acc = null;
        for (Rule sub : rule.getRules()) {
            StrategyResult r = sub.accept(this);
            if (r.isCancelled()) return r;
            Markings part = r.getMarkings();
            if (acc == null) {
                acc = part.copy();
                continue;
            }
            Markings next = new Markings();
            for (MarkingKind kind : acc.kinds()) {
                if (part.contains(kind)) next.put(kind, MarkingValues.combine(kind, acc.get(kind), part.get(kind)));
            }
            acc = next;
        }
        return StrategyResult.answered(acc);
    }

    @Override
    public StrategyResult visitAllOf(AllOfRule rule) {
        Markings acc = new Markings();
        for (Rule sub : rule.getRules()) {
            StrategyResult r = sub.accept(this);
            if (r.isCancelled()) return r;
            Markings part = r.getMarkings();
            for (MarkingKind kind : part.kinds()) {
                if (acc.contains(kind)) {
                    log.debug("All-of rule for {} answers {} twice; no answer", node, kind);
                    return StrategyResult.nothing();
                }
                acc.put(kind, part.get(kind));
            }
        }
        return StrategyResult.answered(acc);
    }

    @Override
    public StrategyResult visitAnyOf(AnyOfRule rule) {
        Markings acc = null;
        for (Rule sub : rule.getRules()) {
            StrategyResult r = sub.accept(this);
            if (r.isCancelled()) return r;
            Markings part = r.getMarkings();
            if (acc == null) {
                acc = part.copy();
                continue;
            }
            Markings next = new Markings();
            for (MarkingKind kind : acc.kinds()) {
                if (part.contains(kind)) next.put(kind, MarkingValues.anyOfMerge(kind, acc.get(kind), part.get(kind)));
            }
            acc = next;
        }
        return StrategyResult.answered(acc);
    }

    @Override
    public StrategyResult visitConditional(ConditionalRule rule) {
        return rule.select(node).accept(this);
    }

    /** Resolves the items of a sequence and combines them in order. */
    static StrategyResult combineGroup(List<TreeNode> items, Set<MarkingKind> needed, ChildResolver children) {
        Markings acc = new Markings();
        for (MarkingKind kind : needed) acc.put(kind, MarkingValues.base(kind));
        for (TreeNode item : items) {
            StrategyResult r = children.resolve(item, needed);
            if (r.isCancelled()) return r;
            combineInto(acc, r.getMarkings(), needed);
        }
        return StrategyResult.answered(acc);
    }

    private static void combineInto(Markings acc, Markings part, Set<MarkingKind> kinds) {
        for (MarkingKind kind : kinds) {
            if (part.contains(kind)) acc.put(kind, MarkingValues.combine(kind, acc.get(kind), part.get(kind)));
        }
    }
}
