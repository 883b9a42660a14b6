package com.verus.rewriter.rewrite;

/**
 * What a rewrite run produces for each input.
 */
public enum RewriteMode {
    /** Canonicalized program text only. */
    RECONSTRUCT,
    /** Canonicalized program text plus the function table and call sites. */
    EXTRACT
}
