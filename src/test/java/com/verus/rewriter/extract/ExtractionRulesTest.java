package com.verus.rewriter.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.verus.rewriter.model.CstNode;
import com.verus.rewriter.model.NodeKind;
import com.verus.rewriter.model.SyntaxNode;
import com.verus.rewriter.parser.VerusParser;
import com.verus.rewriter.reconstruct.ProgramAccumulator;
import com.verus.rewriter.reconstruct.ReconstructionRules;
import com.verus.rewriter.traversal.RuleRegistry;
import com.verus.rewriter.traversal.Traversal;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for function-table and call-site extraction.
 */
class ExtractionRulesTest {

    private final RuleRegistry<CallGraphAccumulator> rules = ExtractionRules.registry();

    @Test
    void testFnMapHoldsFullDefinitionText() {
        CallGraphAccumulator acc = extract("""
                verus! {
                fn foo(a: u32, b: u32) -> u32
                    requires a < 10,
                {
                    a + b
                }
                }
                """);

        assertThat(acc.getFnMap()).containsOnlyKeys("foo");
        assertThat(acc.getFnMap().get("foo"))
                .isEqualTo("fn foo(a: u32, b: u32) -> u32\n    requires a < 10,\n{\n    a + b\n}");
    }

    @Test
    void testCallSitesRecordedInSourceOrder() {
        CallGraphAccumulator acc = extract("""
                verus! {
                fn foo() {
                    bar(1, 2);
                    bar(x, y, z);
                }
                }
                """);

        assertThat(acc.getFnCalls()).containsOnlyKeys("bar");
        assertThat(acc.getFnCalls().get("bar")).containsExactly(List.of("1", "2"), List.of("x", "y", "z"));
        assertThat(acc.getCallSiteCount()).isEqualTo(2);
    }

    @Test
    void testNestedCallsAreBothRecorded() {
        CallGraphAccumulator acc = extract("fn main() { f(g(x), 1); }");

        assertThat(acc.getFnCalls()).containsOnlyKeys("f", "g");
        assertThat(acc.getFnCalls().get("f")).containsExactly(List.of("g(x)", "1"));
        assertThat(acc.getFnCalls().get("g")).containsExactly(List.of("x"));
        assertThat(List.copyOf(acc.getFnCalls().keySet())).containsExactly("f", "g");
    }

    @Test
    void testCommentsAreNotArguments() {
        CallGraphAccumulator acc = extract("fn main() { bar(1, /* second */ 2 /* end */); }");

        assertThat(acc.getFnCalls().get("bar")).containsExactly(List.of("1", "2"));
    }

    @Test
    void testEmptyArgumentListIsRecorded() {
        CallGraphAccumulator acc = extract("fn main() { tick(); }");

        assertThat(acc.getFnCalls().get("tick")).containsExactly(List.of());
    }

    @Test
    void testDuplicateFunctionNameLastDefinitionWins() {
        CallGraphAccumulator acc = extract("""
                fn dup() { 1 }
                fn other() { 2 }
                fn dup() { 3 }
                """);

        assertThat(acc.getFnMap()).containsOnlyKeys("dup", "other");
        assertThat(acc.getFnMap().get("dup")).isEqualTo("fn dup() { 3 }");
    }

    @Test
    void testFunctionWithoutNameIsFatal() {
        CstNode fn = SyntaxNode.builder()
                .kind(NodeKind.FN)
                .text("fn (x) {}")
                .child(SyntaxNode.leaf(NodeKind.TOKEN, "fn"))
                .child(SyntaxNode.leaf(NodeKind.PARAM_LIST, "(x)"))
                .line(4)
                .column(1)
                .build();

        assertThatThrownBy(() -> Traversal.visit(new CallGraphAccumulator(), fn, rules))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("line 4, column 1")
                .hasMessageContaining("has no name")
                .hasMessageContaining("fn (x) {}");
    }

    @Test
    void testCallWithoutCalleePathIsSkipped() {
        CstNode argList = SyntaxNode.of(NodeKind.ARG_LIST, "(1)",
                SyntaxNode.of(NodeKind.EXPR, "1", SyntaxNode.leaf(NodeKind.TOKEN, "1")));
        CstNode call = SyntaxNode.of(NodeKind.CALL_EXPR, "(f)(1)",
                SyntaxNode.leaf(NodeKind.PAREN_EXPR, "(f)"),
                argList);
        CallGraphAccumulator acc = new CallGraphAccumulator();

        Traversal.visit(acc, call, rules);

        assertThat(acc.getFnCalls()).isEmpty();
        assertThat(acc.getProgram()).isEqualTo("(f) (1 )");
    }

    @Test
    void testCallWithoutArgumentListIsSkipped() {
        CstNode call = SyntaxNode.of(NodeKind.CALL_EXPR, "f",
                SyntaxNode.of(NodeKind.EXPR_INNER, "f", SyntaxNode.leaf(NodeKind.PATH_EXPR_NO_GENERICS, "f")));
        CallGraphAccumulator acc = new CallGraphAccumulator();

        Traversal.visit(acc, call, rules);

        assertThat(acc.getFnCalls()).isEmpty();
        assertThat(acc.getProgram()).isEqualTo("f ");
    }

    @Test
    void testProgramMatchesReconstruction() {
        String source = """
                verus! {
                fn foo(a, b) requires a > 0, { bar(1, 2); let f = |x| x; }
                }
                """;
        CstNode root = new VerusParser(source, "same.rs").parse();

        CallGraphAccumulator extracted = new CallGraphAccumulator();
        Traversal.visit(extracted, root, rules);
        ProgramAccumulator reconstructed = new ProgramAccumulator();
        Traversal.visit(reconstructed, root, ReconstructionRules.registry());

        assertThat(extracted.getProgram()).isEqualTo(reconstructed.getProgram());
    }

    @Test
    void testListenerReceivesSnapshotAfterEachMacroBlock() {
        List<Set<String>> functionSnapshots = new ArrayList<>();
        List<Map<String, List<List<String>>>> callSnapshots = new ArrayList<>();
        RuleRegistry<CallGraphAccumulator> withListener = ExtractionRules.registry((functions, calls) -> {
            functionSnapshots.add(functions);
            callSnapshots.add(calls);
        });
        CstNode root = new VerusParser("""
                verus! { fn a() { x(1); } }
                verus! { fn b() { y(2); } }
                """, "two.rs").parse();

        Traversal.visit(new CallGraphAccumulator(), root, withListener);

        assertThat(functionSnapshots).containsExactly(Set.of("a"), Set.of("a", "b"));
        assertThat(callSnapshots.get(0)).containsOnlyKeys("x");
        assertThat(callSnapshots.get(1)).containsOnlyKeys("x", "y");
        assertThatThrownBy(() -> functionSnapshots.get(0).add("c"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testExtractionIsDeterministic() {
        String source = """
                verus! {
                fn c() { z(3); }
                fn a() { y(2); c(); }
                fn b() { x(1); a(); }
                }
                """;

        CallGraphAccumulator first = extract(source);
        CallGraphAccumulator second = extract(source);

        assertThat(first.getProgram()).isEqualTo(second.getProgram());
        assertThat(List.copyOf(first.getFnMap().keySet())).containsExactly("c", "a", "b");
        assertThat(List.copyOf(first.getFnCalls().keySet()))
                .isEqualTo(List.copyOf(second.getFnCalls().keySet()))
                .containsExactly("z", "y", "c", "x", "a");
        assertThat(first.getFnCalls()).isEqualTo(second.getFnCalls());
    }

    private CallGraphAccumulator extract(String source) {
        CstNode root = new VerusParser(source, "test.rs").parse();
        CallGraphAccumulator acc = new CallGraphAccumulator();
        Traversal.visit(acc, root, rules);
        return acc;
    }
}
