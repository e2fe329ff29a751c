package com.tangle.resolution.rule;

import com.tangle.marking.Identifiers;
import com.tangle.marking.ScopeClass;
import com.tangle.tree.node.TreeNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Names a node itself reads, writes or declares, independent of its children.
 */
@FunctionalInterface
public interface NameSource {

    /** Names contributed by the node, with their scope class. Never null. */
    Map<String, ScopeClass> names(TreeNode node);

    /**
     * Identifier(s) held in a field: a string leaf or a list of string leaves. Absent, empty
     * or non-identifier values contribute nothing.
     */
    static NameSource field(String field, ScopeClass scope) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(scope, "scope");
        return node -> {
            Map<String, ScopeClass> out = new LinkedHashMap<>();
            TreeNode value = node.child(field);
            if (value == null) return out;
            if (value.isList()) {
                for (TreeNode item : value.items()) add(out, item, scope);
            } else {
                add(out, value, scope);
            }
            return out;
        };
    }

    /** This source when the predicate holds for the node, nothing otherwise. */
    default NameSource when(Predicate<TreeNode> condition) {
        return node -> condition.test(node) ? names(node) : new LinkedHashMap<>();
    }

    private static void add(Map<String, ScopeClass> out, TreeNode leaf, ScopeClass scope) {
        String name = leaf.stringValue();
        if (Identifiers.isIdentifier(name)) out.put(name, scope);
    }
}
