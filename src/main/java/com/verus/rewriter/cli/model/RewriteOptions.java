package com.verus.rewriter.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.verus.rewriter.rewrite.RewriteMode;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "verus-rewrite" command. No validation, no
 * execution logic, no printing.
 */
@Getter
public class RewriteOptions {

	// checked by the validator so a missing file list is reported with the other problems
	@Parameters(arity = "0..*", paramLabel = "FILE", description = "Verus source files to rewrite")
	private List<Path> inputFiles = new ArrayList<>();

	@Option(names = { "--mode",
			"-m" }, defaultValue = "RECONSTRUCT", description = "Rewrite mode: RECONSTRUCT or EXTRACT (default: RECONSTRUCT)")
	private RewriteMode mode;

	@Option(names = { "--output-dir",
			"-o" }, description = "Directory for the .rewritten files (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--report",
			"-r" }, description = "Write an extraction report to this file (EXTRACT mode only)")
	private Path reportFile;

	@Option(names = { "--max-depth" }, defaultValue = "512", description = "Maximum CST nesting depth, counted in tree levels (default: 512)")
	private int maxDepth;

	@Option(names = { "--force", "-f" }, description = "Overwrite existing output files")
	private boolean force;

	@Option(names = { "--dry-run" }, description = "Rewrite and extract without writing any file")
	private boolean dryRun;

}
