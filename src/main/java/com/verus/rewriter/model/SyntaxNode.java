package com.verus.rewriter.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

/**
 * Immutable {@link CstNode} produced by the parser (or built by hand by an
 * external front end).
 */
@Value
@Builder
public class SyntaxNode implements CstNode {
    NodeKind kind;
    String text;
    @Singular
    @ToString.Exclude
    List<CstNode> children;
    int line;
    int column;

    public static SyntaxNode leaf(NodeKind kind, String text) {
        return SyntaxNode.builder().kind(kind).text(text).build();
    }

    public static SyntaxNode of(NodeKind kind, String text, CstNode... children) {
        return SyntaxNode.builder().kind(kind).text(text).children(List.of(children)).build();
    }
}
