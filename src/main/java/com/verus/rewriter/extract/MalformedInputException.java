package com.verus.rewriter.extract;

/**
 * The CST violates an invariant the rewriter relies on (for example a function
 * definition without a name). Aborts the whole traversal.
 */
public class MalformedInputException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    public MalformedInputException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public MalformedInputException(String message) {
        this(message, 0, 0);
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
