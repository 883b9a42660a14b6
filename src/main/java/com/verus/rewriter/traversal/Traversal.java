package com.verus.rewriter.traversal;

import java.util.List;

import com.verus.rewriter.model.CstNode;

/**
 * Dispatch-or-fallback recursion shared by every rule set.
 *
 * Traversal is depth-first on the Java call stack, so its depth equals the
 * CST's nesting depth. Callers bound that depth before traversing (see
 * {@code RewriteService}).
 */
public final class Traversal {

    private Traversal() {
    }

    /**
     * Apply the rule registered for the node's kind, or the default rule.
     */
    public static <A extends Accumulator> void visit(A accumulator, CstNode node, RuleRegistry<A> registry) {
        registry.resolve(node.getKind()).apply(accumulator, node, registry);
    }

    /**
     * Visit each node in order. Child order is preserved exactly.
     */
    public static <A extends Accumulator> void visitAll(A accumulator, List<? extends CstNode> nodes,
            RuleRegistry<A> registry) {
        for (CstNode node : nodes) {
            visit(accumulator, node, registry);
        }
    }

    /**
     * The default rule: a leaf contributes its verbatim text plus one space, an
     * interior node contributes exactly what its children contribute.
     */
    public static <A extends Accumulator> void defaultVisit(A accumulator, CstNode node, RuleRegistry<A> registry) {
        if (node.isLeaf()) {
            accumulator.append(node.getText()).append(' ');
        } else {
            visitAll(accumulator, node.getChildren(), registry);
        }
    }
}
