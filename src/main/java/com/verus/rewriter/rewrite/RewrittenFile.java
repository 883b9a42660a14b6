package com.verus.rewriter.rewrite;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Value;

/**
 * One successfully rewritten input.
 */
@Value
@Builder
public class RewrittenFile {
    Path source;
    /** Null on a dry run. */
    Path output;
    String program;
    /** Null unless the run extracted. */
    ExtractionResult extraction;
}
