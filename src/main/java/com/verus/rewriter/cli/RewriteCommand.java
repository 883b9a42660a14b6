package com.verus.rewriter.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verus.rewriter.cli.exception.OptionsValidationException;
import com.verus.rewriter.cli.model.RewriteOptions;
import com.verus.rewriter.cli.model.ValidatedRewriteOptions;
import com.verus.rewriter.cli.output.RewriteResultsPrinter;
import com.verus.rewriter.cli.validation.RewriteOptionsValidator;
import com.verus.rewriter.rewrite.RewriteResult;
import com.verus.rewriter.rewrite.RewriteService;
import com.verus.rewriter.rewrite.RewriterConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that rewrites Verus source files.
 */
@Command(
        name = "verus-rewrite",
        mixinStandardHelpOptions = true,
        version = "verus-cst-rewriter 1.0.0",
        description = "Rewrites Verus source files into canonical text and optionally extracts function definitions and call sites."
)
public class RewriteCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RewriteCommand.class);

    @Mixin
    private RewriteOptions options;

    private final RewriteOptionsValidator validator = new RewriteOptionsValidator();
    private final RewriteResultsPrinter printer = new RewriteResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedRewriteOptions validated = validator.validate(options);

            RewriterConfig config = RewriterConfig.builder()
                    .mode(options.getMode())
                    .outputDir(validated.getNormalizedOutputDir())
                    .reportFile(validated.getReportFile())
                    .force(options.isForce())
                    .dryRun(options.isDryRun())
                    .maxNestingDepth(options.getMaxDepth())
                    .build();

            printer.printBanner(options, validated);

            RewriteResult result = new RewriteService(config).rewrite(validated.getInputFiles());

            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }

            printer.printSuccess(options, result);
            return 0;

        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return 1;
        } catch (Exception e) {
            log.error("Rewrite failed with exception", e);
            return 1;
        }
    }
}
