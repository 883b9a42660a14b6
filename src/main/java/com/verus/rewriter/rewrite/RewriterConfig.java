package com.verus.rewriter.rewrite;

import java.nio.file.Path;

import com.verus.rewriter.parser.VerusParser;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for a rewrite run.
 */
@Data
@Builder
public class RewriterConfig {

    @Builder.Default
    private RewriteMode mode = RewriteMode.RECONSTRUCT;

    /**
     * Directory receiving the {@code .rewritten} files. When null each output
     * is written next to its input.
     */
    private Path outputDir;

    /**
     * Extraction report destination; only used in {@link RewriteMode#EXTRACT}.
     */
    private Path reportFile;

    /**
     * Overwrite existing output files.
     */
    private boolean force;

    /**
     * Run the full pipeline but write nothing.
     */
    private boolean dryRun;

    /**
     * Deepest CST accepted for traversal, counted in tree levels with the root at 1.
     * The parser applies the same number to its own recursion, which is always
     * shallower than the tree it builds, so a parsed file can still be rejected
     * by the tree check.
     */
    @Builder.Default
    private int maxNestingDepth = VerusParser.DEFAULT_MAX_DEPTH;
}
