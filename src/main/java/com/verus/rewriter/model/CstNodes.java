package com.verus.rewriter.model;

import java.util.ArrayDeque;
import java.util.Deque;

import lombok.experimental.UtilityClass;

/**
 * Stack-safe structural queries over CST nodes.
 */
@UtilityClass
public class CstNodes {

    /**
     * Nesting depth of the tree rooted at {@code root}; a lone leaf has depth 1.
     * Uses an explicit work stack so arbitrarily deep trees can be measured.
     */
    public static int depth(CstNode root) {
        if (root == null) {
            return 0;
        }
        int max = 0;
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, 1));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            max = Math.max(max, frame.depth);
            for (CstNode child : frame.node.getChildren()) {
                stack.push(new Frame(child, frame.depth + 1));
            }
        }
        return max;
    }

    /**
     * Total number of nodes in the tree rooted at {@code root}.
     */
    public static int count(CstNode root) {
        if (root == null) {
            return 0;
        }
        int count = 0;
        Deque<CstNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            CstNode node = stack.pop();
            count++;
            node.getChildren().forEach(stack::push);
        }
        return count;
    }

    /**
     * Short single-line excerpt of a node's text for error messages.
     */
    public static String excerpt(CstNode node, int maxLength) {
        String text = node.getText() == null ? "" : node.getText().strip().replaceAll("\\s+", " ");
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }

    private static final class Frame {
        private final CstNode node;
        private final int depth;

        private Frame(CstNode node, int depth) {
            this.node = node;
            this.depth = depth;
        }
    }
}
