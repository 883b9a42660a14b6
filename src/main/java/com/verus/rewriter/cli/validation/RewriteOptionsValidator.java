package com.verus.rewriter.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.verus.rewriter.cli.exception.OptionsValidationException;
import com.verus.rewriter.cli.model.RewriteOptions;
import com.verus.rewriter.cli.model.ValidatedRewriteOptions;
import com.verus.rewriter.rewrite.RewriteMode;
import com.verus.rewriter.rewrite.RewriteService;

public class RewriteOptionsValidator {

	public ValidatedRewriteOptions validate(RewriteOptions o) {
		List<String> errors = new ArrayList<>();

		List<Path> inputs = o.getInputFiles() == null ? List.of() : o.getInputFiles();
		if (inputs.isEmpty()) {
			errors.add("At least one input file is required.");
		}

		// Normalize and de-duplicate, keeping command-line order
		Set<Path> normalizedInputs = new LinkedHashSet<>();
		for (Path input : inputs) {
			if (!existsFile(input)) {
				errors.add("Input file does not exist or is not a regular file: " + input);
			}
			normalizedInputs.add(input.toAbsolutePath().normalize());
		}

		if (o.getMaxDepth() < 1) {
			errors.add("Max depth must be >= 1. Got: " + o.getMaxDepth());
		}

		if (o.getReportFile() != null && o.getMode() != RewriteMode.EXTRACT) {
			errors.add("--report is only supported with --mode EXTRACT.");
		}

		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();

		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output directory is not a directory: " + normalizedOutputDir);
		}

		Set<Path> outputNames = new LinkedHashSet<>();
		for (Path input : normalizedInputs) {
			Path output = normalizedOutputDir.resolve(input.getFileName().toString() + RewriteService.OUTPUT_SUFFIX);
			if (!outputNames.add(output)) {
				errors.add("Several inputs would be written to the same output file: " + output);
			} else if (Files.exists(output) && !o.isForce() && !o.isDryRun()) {
				errors.add("Output file already exists: " + output + ". Use --force to overwrite.");
			}
		}

		Path reportFile = o.getReportFile() == null ? null : o.getReportFile().toAbsolutePath().normalize();
		if (reportFile != null && Files.isDirectory(reportFile)) {
			errors.add("Report file is a directory: " + reportFile);
		} else if (reportFile != null && Files.exists(reportFile) && !o.isForce() && !o.isDryRun()) {
			errors.add("Report file already exists: " + reportFile + ". Use --force to overwrite.");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedRewriteOptions(List.copyOf(normalizedInputs), normalizedOutputDir, reportFile);
	}

	private static boolean existsFile(Path p) {
		return p != null && Files.exists(p) && Files.isRegularFile(p);
	}
}
