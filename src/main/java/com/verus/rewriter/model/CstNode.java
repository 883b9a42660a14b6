package com.verus.rewriter.model;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a concrete syntax tree node.
 *
 * A node's text is the verbatim source slice it spans: the concatenation of its
 * children's texts plus any structural text the grammar does not keep as a child
 * (discarded separators, delimiters, whitespace). Leaves carry their literal text.
 */
public interface CstNode {

    NodeKind getKind();

    String getText();

    List<CstNode> getChildren();

    /** 1-based line where the node starts, 0 when unknown. */
    int getLine();

    /** 1-based column where the node starts, 0 when unknown. */
    int getColumn();

    default boolean isLeaf() {
        return getChildren().isEmpty();
    }

    /**
     * First direct child of the given kind.
     */
    default Optional<CstNode> findChild(NodeKind kind) {
        for (CstNode child : getChildren()) {
            if (child.getKind() == kind) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    default String describeLocation() {
        if (getLine() <= 0) {
            return "unknown location";
        }
        return "line " + getLine() + ", column " + getColumn();
    }
}
