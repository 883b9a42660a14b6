package com.verus.rewriter.traversal;

/**
 * Mutable output state threaded through one traversal.
 * Every rule can rely on the program buffer; richer accumulators add capabilities.
 */
public interface Accumulator {

    Accumulator append(CharSequence text);

    Accumulator append(char c);

    /** Current contents of the program buffer. */
    String getProgram();
}
