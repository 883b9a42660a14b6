package com.verus.rewriter.extract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verus.rewriter.model.CstNode;
import com.verus.rewriter.model.CstNodes;
import com.verus.rewriter.model.NodeKind;
import com.verus.rewriter.reconstruct.ReconstructionRules;
import com.verus.rewriter.traversal.RuleRegistry;
import com.verus.rewriter.traversal.Traversal;

/**
 * Function-table and call-site extraction, layered on top of the
 * reconstruction rules so the program text is rebuilt as a side effect.
 */
public final class ExtractionRules {
    private static final Logger log = LoggerFactory.getLogger(ExtractionRules.class);

    private static final int EXCERPT_LENGTH = 60;

    private ExtractionRules() {
    }

    public static <A extends ExtractionAccumulator> RuleRegistry<A> registry() {
        return registry(ExtractionListener.logging());
    }

    public static <A extends ExtractionAccumulator> RuleRegistry<A> registry(ExtractionListener listener) {
        return ReconstructionRules.<A>builder()
                .rule(NodeKind.FN, ExtractionRules::function)
                .rule(NodeKind.CALL_EXPR, ExtractionRules::callExpression)
                .rule(NodeKind.MACRO_BLOCK_USE, (acc, node, registry) -> macroBlock(acc, node, registry, listener))
                .build();
    }

    /**
     * Records the definition under its name, then keeps traversing so the body
     * is still reconstructed and its calls extracted.
     *
     * @throws MalformedInputException if the definition has no name child
     */
    public static <A extends ExtractionAccumulator> void function(A acc, CstNode node, RuleRegistry<A> registry) {
        CstNode name = node.findChild(NodeKind.NAME)
                .orElseThrow(() -> new MalformedInputException(
                        "Function definition at " + node.describeLocation() + " has no name: "
                                + CstNodes.excerpt(node, EXCERPT_LENGTH),
                        node.getLine(), node.getColumn()));

        log.debug("Visited function {} at {}", name.getText(), node.describeLocation());
        acc.recordFunction(name.getText(), node.getText());
        Traversal.visitAll(acc, node.getChildren(), registry);
    }

    /**
     * Records a call site when both a callee path and an argument list are
     * present; text is always rebuilt through the default rule.
     */
    public static <A extends ExtractionAccumulator> void callExpression(A acc, CstNode node,
            RuleRegistry<A> registry) {
        Optional<String> callee = findCallee(node);
        Optional<CstNode> argList = node.findChild(NodeKind.ARG_LIST);

        if (callee.isPresent() && argList.isPresent()) {
            acc.recordCallSite(callee.get(), splitArguments(argList.get()));
        } else {
            log.debug("Skipping call expression without callee path or argument list at {}: {}",
                    node.describeLocation(), CstNodes.excerpt(node, EXCERPT_LENGTH));
        }

        registry.getDefaultRule().apply(acc, node, registry);
    }

    static <A extends ExtractionAccumulator> void macroBlock(A acc, CstNode node, RuleRegistry<A> registry,
            ExtractionListener listener) {
        ReconstructionRules.macroBlock(acc, node, registry);

        Map<String, List<List<String>>> calls = new LinkedHashMap<>();
        acc.getFnCalls().forEach((callee, sites) -> calls.put(callee, List.copyOf(sites)));
        listener.onMacroBlockFinished(
                Collections.unmodifiableSet(new LinkedHashSet<>(acc.getFnMap().keySet())),
                Collections.unmodifiableMap(calls));
    }

    static Optional<String> findCallee(CstNode call) {
        for (CstNode child : call.getChildren()) {
            if (child.getKind() != NodeKind.EXPR_INNER) {
                continue;
            }
            Optional<CstNode> path = child.findChild(NodeKind.PATH_EXPR_NO_GENERICS);
            if (path.isPresent()) {
                return Optional.of(path.get().getText());
            }
        }
        return Optional.empty();
    }

    /**
     * One raw text per argument, left to right. Comment and separator children
     * are not arguments.
     */
    static List<String> splitArguments(CstNode argList) {
        List<String> arguments = new ArrayList<>();
        for (CstNode child : argList.getChildren()) {
            if (child.getKind() == NodeKind.COMMENT || child.getKind() == NodeKind.COMMA) {
                continue;
            }
            arguments.add(child.getText());
        }
        return arguments;
    }
}
