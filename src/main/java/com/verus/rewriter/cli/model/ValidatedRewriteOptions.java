package com.verus.rewriter.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps RewriteCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedRewriteOptions {
    List<Path> inputFiles;
    Path normalizedOutputDir;
    Path reportFile;
}
