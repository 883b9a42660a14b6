package com.verus.rewriter.traversal;

import com.verus.rewriter.model.CstNode;

/**
 * Behaviour registered for a node kind.
 *
 * A rule must fully consume the node it receives: every child is either emitted
 * verbatim by the rule itself or handed back to the registry through
 * {@link Traversal#visit} / {@link Traversal#visitAll}.
 *
 * @param <A> accumulator capability the rule requires
 */
@FunctionalInterface
public interface Rule<A extends Accumulator> {

    void apply(A accumulator, CstNode node, RuleRegistry<A> registry);
}
