package com.verus.rewriter.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verus.rewriter.cli.exception.OptionsValidationException;
import com.verus.rewriter.cli.model.RewriteOptions;
import com.verus.rewriter.cli.model.ValidatedRewriteOptions;
import com.verus.rewriter.rewrite.RewriteMode;
import com.verus.rewriter.rewrite.RewriteResult;
import com.verus.rewriter.rewrite.RewrittenFile;

/**
 * Responsible only for printing CLI output for the "verus-rewrite" command.
 * No validation, no execution.
 */
public class RewriteResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(RewriteResultsPrinter.class);

    public void printBanner(RewriteOptions o, ValidatedRewriteOptions v) {
        log.info("=================================================");
        log.info("Verus CST Rewriter");
        log.info("=================================================");
        log.info("Mode: {}", o.getMode());
        log.info("Input Files: {}", v.getInputFiles().size());
        log.info("Output Directory: {}", o.isDryRun() ? "None (dry run)" : v.getNormalizedOutputDir());
        log.info("Report File: {}", v.getReportFile() != null ? v.getReportFile() : "None");
        log.info("Max Nesting Depth: {}", o.getMaxDepth());
        log.info("Overwrite Existing: {}", o.isForce());
        log.info("=================================================");
    }

    public void printSuccess(RewriteOptions o, RewriteResult result) {
        log.info("");
        log.info("=================================================");
        log.info("REWRITE SUCCESSFUL");
        log.info("=================================================");
        log.info("Files Processed: {}", result.getFilesProcessed());
        for (RewrittenFile file : result.getFiles()) {
            log.info("  {} -> {}", file.getSource(), file.getOutput() != null ? file.getOutput() : "(not written)");
        }

        if (o.getMode() == RewriteMode.EXTRACT) {
            log.info("");
            log.info("Extraction Summary:");
            log.info("  Functions: {}", result.getFunctionsExtracted());
            log.info("  Call Sites: {}", result.getCallSitesExtracted());
            if (result.getReportFile() != null) {
                log.info("  Report: {}", result.getReportFile());
            }
        }

        for (String warning : result.getWarnings()) {
            log.warn("{}", warning);
        }
        log.info("=================================================");
    }

    public void printFailure(RewriteResult result) {
        log.error("Rewrite failed for {} of {} file(s)", result.getFilesFailed(),
                result.getFilesFailed() + result.getFilesProcessed());
        for (String error : result.getErrors()) {
            log.error("  {}", error);
        }
    }

    public void printValidationErrors(OptionsValidationException e) {
        log.error("Invalid options:");
        for (String error : e.getErrors()) {
            log.error("  - {}", error);
        }
    }
}
