package com.verus.rewriter.parser;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.verus.rewriter.model.CstNode;
import com.verus.rewriter.model.CstNodes;
import com.verus.rewriter.model.NodeKind;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for VerusParser.
 */
class VerusParserTest {

    @Test
    void testParseMacroBlockWithFunction() {
        CstNode root = parse("verus! { fn foo(a, b) { bar(1, 2); } }");

        assertThat(root.getKind()).isEqualTo(NodeKind.FILE);
        assertThat(root.getChildren()).extracting(CstNode::getKind).containsExactly(NodeKind.MACRO_BLOCK_USE);

        CstNode macro = root.getChildren().get(0);
        assertThat(macro.getChildren()).extracting(CstNode::getKind).containsExactly(NodeKind.FN);

        CstNode fn = macro.getChildren().get(0);
        assertThat(fn.getText()).isEqualTo("fn foo(a, b) { bar(1, 2); }");
        assertThat(fn.getChildren()).extracting(CstNode::getKind)
                .containsExactly(NodeKind.TOKEN, NodeKind.NAME, NodeKind.PARAM_LIST, NodeKind.FN_BLOCK_EXPR);
        assertThat(fn.findChild(NodeKind.NAME)).map(CstNode::getText).contains("foo");

        CstNode params = fn.findChild(NodeKind.PARAM_LIST).orElseThrow();
        assertThat(params.getText()).isEqualTo("(a, b)");
        assertThat(params.getChildren()).extracting(CstNode::getText).containsExactly("a", "b");
    }

    @Test
    void testCallExpressionShape() {
        CstNode call = single(parse("verus! { fn foo() { bar(1, x + 2); } }"), NodeKind.CALL_EXPR);

        assertThat(call.getText()).isEqualTo("bar(1, x + 2)");
        assertThat(call.getChildren()).extracting(CstNode::getKind)
                .containsExactly(NodeKind.EXPR_INNER, NodeKind.ARG_LIST);

        CstNode callee = call.getChildren().get(0).findChild(NodeKind.PATH_EXPR_NO_GENERICS).orElseThrow();
        assertThat(callee.getText()).isEqualTo("bar");

        CstNode args = call.getChildren().get(1);
        assertThat(args.getChildren()).extracting(CstNode::getKind)
                .containsExactly(NodeKind.EXPR, NodeKind.COMMA, NodeKind.EXPR);
        assertThat(args.getChildren()).extracting(CstNode::getText).containsExactly("1", ",", "x + 2");
    }

    @Test
    void testMethodCallPathIncludesReceiver() {
        CstNode call = single(parse("fn f() { v.push(1); }"), NodeKind.CALL_EXPR);

        CstNode callee = call.getChildren().get(0).findChild(NodeKind.PATH_EXPR_NO_GENERICS).orElseThrow();
        assertThat(callee.getText()).isEqualTo("v.push");
    }

    @Test
    void testGenericCallIsNotACallExpression() {
        CstNode root = parse("fn f() { g::<u32>(1); }");

        assertThat(collect(root, NodeKind.CALL_EXPR)).isEmpty();
    }

    @Test
    void testCommentsAtListBoundariesBecomeCommentNodes() {
        CstNode fn = single(parse("""
                fn foo(a /* first */, b) {
                    bar(1, /* two */ 2);
                }
                """), NodeKind.FN);

        CstNode params = fn.findChild(NodeKind.PARAM_LIST).orElseThrow();
        assertThat(params.getChildren()).extracting(CstNode::getKind)
                .containsExactly(NodeKind.PARAM, NodeKind.COMMENT, NodeKind.PARAM);
        assertThat(params.getChildren().get(1).getText()).isEqualTo("/* first */");

        CstNode args = single(fn, NodeKind.ARG_LIST);
        assertThat(args.getChildren()).extracting(CstNode::getKind)
                .containsExactly(NodeKind.EXPR, NodeKind.COMMA, NodeKind.COMMENT, NodeKind.EXPR);
        assertThat(args.getChildren().get(3).getText()).isEqualTo("2");
    }

    @Test
    void testCommentBeforeCallStaysOutOfCallee() {
        CstNode root = parse("""
                fn main() {
                    // first
                    bar(1);
                }
                """);
        CstNode call = single(root, NodeKind.CALL_EXPR);
        CstNode stmt = single(root, NodeKind.STMT);

        assertThat(call.getText()).isEqualTo("bar(1)");
        assertThat(single(call, NodeKind.PATH_EXPR_NO_GENERICS).getText()).isEqualTo("bar");
        assertThat(stmt.getChildren().get(0).getText()).isEqualTo("// first\n    ");
        assertThat(stmt.getText()).startsWith("// first");
    }

    @Test
    void testLeadingCommentsStayInFunctionText() {
        CstNode fn = single(parse("""
                verus! {
                /// Adds one.
                fn inc(x: u32) -> u32 { x + 1 }
                }
                """), NodeKind.FN);

        assertThat(fn.getText()).isEqualTo("/// Adds one.\nfn inc(x: u32) -> u32 { x + 1 }");
        assertThat(fn.getLine()).isEqualTo(3);
    }

    @Test
    void testClausesProduceCommaDelimitedExprs() {
        CstNode fn = single(parse("""
                fn foo(x: u32) -> (r: u32)
                    requires
                        x > 0,
                        x < 100,
                    ensures
                        r == x,
                {
                    x
                }
                """), NodeKind.FN);

        assertThat(fn.getChildren()).extracting(CstNode::getKind).contains(
                NodeKind.REQUIRES_CLAUSE, NodeKind.ENSURES_CLAUSE, NodeKind.FN_BLOCK_EXPR);

        CstNode requires = fn.findChild(NodeKind.REQUIRES_CLAUSE).orElseThrow();
        CstNode list = requires.findChild(NodeKind.COMMA_DELIMITED_EXPRS).orElseThrow();
        assertThat(list.getChildren()).extracting(CstNode::getText).containsExactly("x > 0", "x < 100");

        CstNode ensures = fn.findChild(NodeKind.ENSURES_CLAUSE).orElseThrow();
        assertThat(ensures.findChild(NodeKind.COMMA_DELIMITED_EXPRS).orElseThrow().getChildren())
                .extracting(CstNode::getText).containsExactly("r == x");
    }

    @Test
    void testClosureParamList() {
        CstNode closure = single(parse("fn f() { let add = |x, y: int| x + y; }"), NodeKind.CLOSURE_EXPR);

        CstNode params = closure.findChild(NodeKind.CLOSURE_PARAM_LIST).orElseThrow();
        assertThat(params.getChildren()).extracting(CstNode::getText).containsExactly("x", "y: int");
        assertThat(closure.getText()).isEqualTo("|x, y: int| x + y");
    }

    @Test
    void testLogicalOrIsNotAClosure() {
        CstNode root = parse("fn f(a: bool, b: bool) -> bool { a || b }");

        assertThat(collect(root, NodeKind.CLOSURE_EXPR)).isEmpty();
    }

    @Test
    void testFunctionModifiersAndAttributes() {
        CstNode fn = single(parse("""
                #[verifier::opaque]
                pub(crate) open spec fn bar() -> int { 1 }
                """), NodeKind.FN);

        assertThat(fn.findChild(NodeKind.NAME)).map(CstNode::getText).contains("bar");
        assertThat(fn.getText()).startsWith("#[verifier::opaque]").endsWith("{ 1 }");
    }

    @Test
    void testAttributeArgumentsAreNotCalls() {
        CstNode root = parse("#[allow(unused)] fn f() {} #![cfg(test)]");

        assertThat(collect(root, NodeKind.CALL_EXPR)).isEmpty();
        assertThat(collect(root, NodeKind.FN)).hasSize(1);
    }

    @Test
    void testFunctionsInsideImplBlocks() {
        CstNode root = parse("""
                verus! {
                impl Counter {
                    fn get(&self) -> u32 { self.value }
                    fn bump(&mut self) { self.set(self.get() + 1); }
                }
                }
                """);

        assertThat(collect(root, NodeKind.FN)).extracting(fn -> fn.findChild(NodeKind.NAME).orElseThrow().getText())
                .containsExactly("get", "bump");
        assertThat(collect(root, NodeKind.CALL_EXPR)).hasSize(2);
    }

    @Test
    void testTraitFunctionWithoutBody() {
        CstNode fn = single(parse("trait T { fn size(&self) -> usize; }"), NodeKind.FN);

        assertThat(fn.getText()).isEqualTo("fn size(&self) -> usize;");
        assertThat(fn.findChild(NodeKind.FN_BLOCK_EXPR)).isEmpty();
    }

    @Test
    void testMissingFunctionNameThrows() {
        assertThatThrownBy(() -> parse("fn (x: u32) {}"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Expected function name");
    }

    @Test
    void testUnterminatedMacroBlockThrows() {
        assertThatThrownBy(() -> parse("verus! { fn f() { }"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Unterminated verus! block");
    }

    @Test
    void testUnexpectedClosingDelimiterThrows() {
        assertThatThrownBy(() -> parse("fn f() { let x = 1); }"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Unexpected ')'");
    }

    @Test
    void testNestingLimit() {
        String source = "fn f() { ((((((((((1)))))))))); }";

        assertThatThrownBy(() -> new VerusParser(source, "deep.rs", 8).parse())
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Nesting depth exceeds limit of 8");
        assertThat(new VerusParser(source, "deep.rs").parse()).isNotNull();
    }

    @Test
    void testParserDepthNeverExceedsTreeDepth() {
        String source = "fn f() { ((((((((((1)))))))))); }";

        assertThatThrownBy(() -> new VerusParser(source, "deep.rs", 8).parse())
                .isInstanceOf(ParseException.class);
        assertThat(CstNodes.depth(parse(source))).isGreaterThan(8);
    }

    private static CstNode parse(String source) {
        return new VerusParser(source, "test.rs").parse();
    }

    private static CstNode single(CstNode root, NodeKind kind) {
        List<CstNode> found = collect(root, kind);
        assertThat(found).hasSize(1);
        return found.get(0);
    }

    private static List<CstNode> collect(CstNode root, NodeKind kind) {
        List<CstNode> found = new ArrayList<>();
        if (root.getKind() == kind) {
            found.add(root);
        }
        for (CstNode child : root.getChildren()) {
            found.addAll(collect(child, kind));
        }
        return found;
    }
}
