package com.verus.rewriter.reconstruct;

import com.verus.rewriter.model.CstNode;
import com.verus.rewriter.model.NodeKind;
import com.verus.rewriter.traversal.Accumulator;
import com.verus.rewriter.traversal.RuleRegistry;
import com.verus.rewriter.traversal.Traversal;

import lombok.experimental.UtilityClass;

/**
 * Canonicalizing rules that rebuild text for the downstream formatter.
 *
 * Every rule here only needs the program buffer, so the base registry can be
 * instantiated for any accumulator type and layered on by richer rule sets.
 */
@UtilityClass
public class ReconstructionRules {

    public static final String MACRO_OPEN = "verus!{\n";
    public static final String MACRO_CLOSE = "}\n";
    public static final String BLOCK_OPEN = "\n {";
    public static final String BLOCK_CLOSE = "\n } \n";
    public static final String LIST_SEPARATOR = ", ";

    public static <A extends Accumulator> RuleRegistry<A> registry() {
        return ReconstructionRules.<A>builder().build();
    }

    /**
     * Builder pre-populated with the reconstruction rules, ready for layering.
     */
    public static <A extends Accumulator> RuleRegistry.Builder<A> builder() {
        return RuleRegistry.<A>builder()
                .rule(NodeKind.MACRO_BLOCK_USE, ReconstructionRules::macroBlock)
                .rule(NodeKind.PARAM_LIST, ReconstructionRules::paramList)
                .rule(NodeKind.CLOSURE_PARAM_LIST, ReconstructionRules::closureParamList)
                .rule(NodeKind.FN_BLOCK_EXPR, ReconstructionRules::fnBlockExpr)
                .rule(NodeKind.COMMA_DELIMITED_EXPRS, ReconstructionRules::commaDelimitedExprs)
                .rule(NodeKind.ARG_LIST, ReconstructionRules::argList)
                .rule(NodeKind.COMMENT, ReconstructionRules::comment);
    }

    public static <A extends Accumulator> void macroBlock(A acc, CstNode node, RuleRegistry<A> registry) {
        acc.append(MACRO_OPEN);
        Traversal.visitAll(acc, node.getChildren(), registry);
        acc.append(MACRO_CLOSE);
    }

    /**
     * Children are emitted as raw text, never visited, so a parameter keeps its
     * inner layout while the list separators are regenerated. No trailing comma.
     */
    public static <A extends Accumulator> void paramList(A acc, CstNode node, RuleRegistry<A> registry) {
        acc.append('(');
        appendRawJoined(acc, node);
        acc.append(')');
    }

    public static <A extends Accumulator> void closureParamList(A acc, CstNode node, RuleRegistry<A> registry) {
        acc.append('|');
        appendRawJoined(acc, node);
        acc.append('|');
    }

    public static <A extends Accumulator> void fnBlockExpr(A acc, CstNode node, RuleRegistry<A> registry) {
        acc.append(BLOCK_OPEN);
        Traversal.visitAll(acc, node.getChildren(), registry);
        acc.append(BLOCK_CLOSE);
    }

    /**
     * Every expression element is followed by a separator, the last one included.
     * Comment elements emit nothing and get no separator.
     */
    public static <A extends Accumulator> void commaDelimitedExprs(A acc, CstNode node, RuleRegistry<A> registry) {
        for (CstNode child : node.getChildren()) {
            Traversal.visit(acc, child, registry);
            if (child.getKind() != NodeKind.COMMENT) {
                acc.append(LIST_SEPARATOR);
            }
        }
    }

    /**
     * Unlike {@link #paramList}, arguments are visited so nested calls are
     * canonicalized too.
     */
    public static <A extends Accumulator> void argList(A acc, CstNode node, RuleRegistry<A> registry) {
        acc.append('(');
        Traversal.visitAll(acc, node.getChildren(), registry);
        acc.append(')');
    }

    public static <A extends Accumulator> void comment(A acc, CstNode node, RuleRegistry<A> registry) {
        // comments inside rebuilt lists cannot be repositioned
    }

    private static void appendRawJoined(Accumulator acc, CstNode list) {
        boolean first = true;
        for (CstNode child : list.getChildren()) {
            if (child.getKind() == NodeKind.COMMENT) {
                continue;
            }
            if (!first) {
                acc.append(LIST_SEPARATOR);
            }
            acc.append(child.getText());
            first = false;
        }
    }
}
