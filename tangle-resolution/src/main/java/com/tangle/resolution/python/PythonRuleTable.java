package com.tangle.resolution.python;

import com.tangle.marking.ScopeClass;
import com.tangle.resolution.rule.AllOfRule;
import com.tangle.resolution.rule.ConditionalRule;
import com.tangle.resolution.rule.LeafRule;
import com.tangle.resolution.rule.NameSource;
import com.tangle.resolution.rule.RewriteRule;
import com.tangle.resolution.rule.Rule;
import com.tangle.resolution.rule.RuleTable;
import com.tangle.resolution.rule.SequentialRule;
import com.tangle.tree.node.NodeKind;
import com.tangle.tree.node.TreeNode;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Predicate;

import static com.tangle.marking.BreakType.BREAK;
import static com.tangle.marking.BreakType.CONTINUE;
import static com.tangle.marking.BreakType.EXCEPT;
import static com.tangle.marking.BreakType.RETURN;
import static com.tangle.marking.BreakType.YIELD;
import static com.tangle.marking.MarkingKind.BREAKS;
import static com.tangle.marking.MarkingKind.INDIRECT_RW;
import static com.tangle.marking.MarkingKind.READS;
import static com.tangle.marking.MarkingKind.SCOPE;
import static com.tangle.marking.MarkingKind.VISIBLE;
import static com.tangle.marking.MarkingKind.WRITES;

/**
 * Default rules for Python syntax trees.
 * <p>
 * Names bound or used by plain {@code Name} nodes are recorded with scope class
 * {@link ScopeClass#UNKNOWN}; only {@code global}/{@code nonlocal} statements declare scope.
 * Constructs that open a new scope (function and class bodies, lambdas, comprehensions) do not
 * answer indirect accesses. Calls, imports, {@code with} and generator expressions answer nothing.
 */
public final class PythonRuleTable {

    private static final Predicate<TreeNode> HAS_DECORATORS = n -> !n.isBlank("decorator_list");
    private static final Predicate<TreeNode> HAS_ORELSE = n -> !n.isBlank("orelse");
    private static final Predicate<TreeNode> STORE_CONTEXT = ctxIs(NodeKind.STORE);
    private static final Predicate<TreeNode> HAS_BARE_HANDLER = n -> {
        TreeNode handlers = n.child("handlers");
        if (handlers == null) return false;
        for (TreeNode h : handlers.items()) {
            if (h.isBlank("type")) return true;
        }
        return false;
    };

    private PythonRuleTable() {
    }

    public static RuleTable create() {
        Map<NodeKind, Rule> rules = new EnumMap<>(NodeKind.class);

        // roots
        rules.put(NodeKind.MODULE, LeafRule.of("body"));
        rules.put(NodeKind.INTERACTIVE, LeafRule.of("body"));
        rules.put(NodeKind.EXPRESSION, LeafRule.of("body"));

        // statements
        Rule undecorate = new RewriteRule("decorators as reassignment", Desugarings::undecorate);
        rules.put(NodeKind.FUNCTION_DEF, new ConditionalRule("has decorators", HAS_DECORATORS, undecorate,
                LeafRule.builder()
                        .fields("args", "returns")
                        .unknown(INDIRECT_RW)
                        .writes(NameSource.field("name", ScopeClass.UNKNOWN))
                        .build()));
        rules.put(NodeKind.CLASS_DEF, new ConditionalRule("has decorators", HAS_DECORATORS, undecorate,
                AllOfRule.of(
                        LeafRule.builder().known(VISIBLE, BREAKS)
                                .fields("bases", "keywords", "starargs", "kwargs", "body").build(),
                        LeafRule.builder().known(READS)
                                .fields("bases", "keywords", "starargs", "kwargs").build(),
                        LeafRule.builder().known(WRITES)
                                .writes(NameSource.field("name", ScopeClass.UNKNOWN)).build(),
                        LeafRule.builder().known(SCOPE).build())));
        rules.put(NodeKind.RETURN, LeafRule.builder().fields("value").addBreaks(RETURN).build());
        rules.put(NodeKind.DELETE, LeafRule.of("targets"));
        rules.put(NodeKind.ASSIGN, LeafRule.of("value", "targets"));
        rules.put(NodeKind.AUG_ASSIGN, new RewriteRule("augmented assignment as binary operation",
                Desugarings::expandAugmentedAssign));
        Rule splitElse = new RewriteRule("loop else as following statements", Desugarings::splitLoopElse);
        rules.put(NodeKind.FOR, new ConditionalRule("has else", HAS_ORELSE, splitElse,
                LeafRule.builder().fields("iter", "target", "body")
                        .removeBreaks(BREAK, CONTINUE).addBreaks(EXCEPT).build()));
        rules.put(NodeKind.WHILE, new ConditionalRule("has else", HAS_ORELSE, splitElse,
                LeafRule.builder().fields("test", "body").removeBreaks(BREAK, CONTINUE).build()));
        rules.put(NodeKind.IF, LeafRule.of("test", "body", "orelse"));
        rules.put(NodeKind.WITH, LeafRule.builder().fields("context_expr", "optional_vars", "body")
                .addBreaks(EXCEPT).unknown(VISIBLE, INDIRECT_RW).build());
        rules.put(NodeKind.RAISE, LeafRule.builder().fields("exc", "cause").addBreaks(EXCEPT).build());
        rules.put(NodeKind.TRY_EXCEPT, SequentialRule.of(
                new ConditionalRule("has bare except handler", HAS_BARE_HANDLER,
                        LeafRule.builder().fields("body").removeBreaks(EXCEPT).build(),
                        LeafRule.of("body")),
                LeafRule.of("handlers", "orelse")));
        rules.put(NodeKind.TRY_FINALLY, LeafRule.of("body", "finalbody"));
        rules.put(NodeKind.ASSERT, LeafRule.builder().fields("test", "msg").addBreaks(EXCEPT).build());
        rules.put(NodeKind.IMPORT, LeafRule.unknownAll());
        rules.put(NodeKind.IMPORT_FROM, LeafRule.unknownAll());
        rules.put(NodeKind.GLOBAL, LeafRule.builder().declares(NameSource.field("names", ScopeClass.GLOBAL)).build());
        rules.put(NodeKind.NONLOCAL, LeafRule.builder().declares(NameSource.field("names", ScopeClass.NONLOCAL)).build());
        rules.put(NodeKind.EXPR, LeafRule.of("value"));
        rules.put(NodeKind.PASS, LeafRule.base());
        rules.put(NodeKind.BREAK, LeafRule.builder().addBreaks(BREAK).build());
        rules.put(NodeKind.CONTINUE, LeafRule.builder().addBreaks(CONTINUE).build());

        // expressions
        rules.put(NodeKind.BOOL_OP, LeafRule.of("values"));
        rules.put(NodeKind.BIN_OP, LeafRule.builder().fields("left", "right").addBreaks(EXCEPT).build());
        rules.put(NodeKind.UNARY_OP, LeafRule.builder().fields("operand").addBreaks(EXCEPT).build());
        rules.put(NodeKind.LAMBDA, LeafRule.builder().fields("args").unknown(INDIRECT_RW).build());
        rules.put(NodeKind.IF_EXP, LeafRule.of("test", "body", "orelse"));
        rules.put(NodeKind.DICT, LeafRule.of("keys", "values"));
        rules.put(NodeKind.SET, LeafRule.of("elts"));
        rules.put(NodeKind.LIST_COMP, comprehension("elt", "generators"));
        rules.put(NodeKind.SET_COMP, comprehension("elt", "generators"));
        rules.put(NodeKind.DICT_COMP, comprehension("key", "value", "generators"));
        rules.put(NodeKind.GENERATOR_EXP, LeafRule.unknownAll());
        rules.put(NodeKind.YIELD, LeafRule.builder().fields("value").addBreaks(EXCEPT, YIELD).build());
        rules.put(NodeKind.COMPARE, LeafRule.builder().fields("left", "comparators").addBreaks(EXCEPT).build());
        rules.put(NodeKind.CALL, LeafRule.builder().fields("func", "args", "keywords", "starargs", "kwargs")
                .addBreaks(EXCEPT).unknown(VISIBLE, INDIRECT_RW).build());
        rules.put(NodeKind.NUM, LeafRule.base());
        rules.put(NodeKind.STR, LeafRule.base());
        rules.put(NodeKind.BYTES, LeafRule.base());
        rules.put(NodeKind.ELLIPSIS, LeafRule.base());
        rules.put(NodeKind.ATTRIBUTE, LeafRule.of("value", "ctx"));
        rules.put(NodeKind.SUBSCRIPT, LeafRule.of("value", "slice", "ctx"));
        rules.put(NodeKind.STARRED, LeafRule.of("value", "ctx"));
        rules.put(NodeKind.NAME, LeafRule.builder().fields("ctx")
                .reads(NameSource.field("id", ScopeClass.UNKNOWN).when(ctxIs(NodeKind.LOAD).or(ctxIs(NodeKind.AUG_LOAD))))
                .writes(NameSource.field("id", ScopeClass.UNKNOWN).when(
                        ctxIs(NodeKind.STORE).or(ctxIs(NodeKind.DEL)).or(ctxIs(NodeKind.AUG_STORE))))
                .build());
        Rule unpackingStore = LeafRule.builder().fields("elts", "ctx").addBreaks(EXCEPT).build();
        rules.put(NodeKind.LIST, new ConditionalRule("store context", STORE_CONTEXT, unpackingStore, LeafRule.of("elts", "ctx")));
        rules.put(NodeKind.TUPLE, new ConditionalRule("store context", STORE_CONTEXT, unpackingStore, LeafRule.of("elts", "ctx")));

        // contexts
        rules.put(NodeKind.LOAD, LeafRule.builder().addBreaks(EXCEPT).build());
        rules.put(NodeKind.STORE, LeafRule.base());
        rules.put(NodeKind.DEL, LeafRule.builder().addBreaks(EXCEPT).build());
        rules.put(NodeKind.AUG_LOAD, LeafRule.unknownAll());
        rules.put(NodeKind.AUG_STORE, LeafRule.unknownAll());
        rules.put(NodeKind.PARAM, LeafRule.unknownAll());

        // slices
        rules.put(NodeKind.SLICE, LeafRule.of("lower", "upper", "step"));
        rules.put(NodeKind.EXT_SLICE, LeafRule.of("dims"));
        rules.put(NodeKind.INDEX, LeafRule.of("value"));

        // helpers
        rules.put(NodeKind.COMPREHENSION, LeafRule.builder().fields("iter", "target", "ifs").addBreaks(EXCEPT).build());
        rules.put(NodeKind.EXCEPT_HANDLER, LeafRule.builder().fields("type", "body")
                .writes(NameSource.field("name", ScopeClass.UNKNOWN)).build());
        rules.put(NodeKind.ARGUMENTS, LeafRule.of("args", "varargannotation", "kwonlyargs", "kwargannotation",
                "defaults", "kw_defaults"));
        rules.put(NodeKind.ARG, LeafRule.of("annotation"));
        rules.put(NodeKind.KEYWORD, LeafRule.of("value"));
        rules.put(NodeKind.ALIAS, LeafRule.base());

        return RuleTable.of(rules);
    }

    /** Comprehension variables are local to the comprehension: nothing is written outside it. */
    private static Rule comprehension(String... fields) {
        return AllOfRule.of(
                LeafRule.builder().fields(fields).unknown(WRITES, INDIRECT_RW).build(),
                LeafRule.builder().known(WRITES).build());
    }

    private static Predicate<TreeNode> ctxIs(NodeKind context) {
        return n -> {
            TreeNode ctx = n.child("ctx");
            return ctx != null && ctx.kind() == context;
        };
    }
}
