package com.tangle.resolution.rule;

import com.tangle.tree.node.TreeNode;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Replaces the node by an equivalent synthetic form and resolves that instead. The rewrite
 * builds new nodes in the node's own arena and may share the original's children.
 */
public final class RewriteRule implements Rule {

    private final String description;
    private final UnaryOperator<TreeNode> rewrite;

    public RewriteRule(String description, UnaryOperator<TreeNode> rewrite) {
        this.description = Objects.requireNonNull(description, "description");
        this.rewrite = Objects.requireNonNull(rewrite, "rewrite");
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitRewrite(this);
    }

    public String getDescription() {
        return description;
    }

    public TreeNode rewrite(TreeNode node) {
        return rewrite.apply(node);
    }
}
