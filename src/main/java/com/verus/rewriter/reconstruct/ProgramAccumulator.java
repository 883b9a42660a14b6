package com.verus.rewriter.reconstruct;

import com.verus.rewriter.traversal.Accumulator;

/**
 * Plain program buffer used by reconstruction-only traversals.
 */
public class ProgramAccumulator implements Accumulator {

    private final StringBuilder program = new StringBuilder();

    @Override
    public ProgramAccumulator append(CharSequence text) {
        program.append(text);
        return this;
    }

    @Override
    public ProgramAccumulator append(char c) {
        program.append(c);
        return this;
    }

    @Override
    public String getProgram() {
        return program.toString();
    }

    @Override
    public String toString() {
        return program.toString();
    }
}
