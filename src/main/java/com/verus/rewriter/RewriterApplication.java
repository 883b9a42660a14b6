package com.verus.rewriter;

import com.verus.rewriter.cli.RewriteCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Verus CST rewriter.
 * Rewrites Verus source files into canonical text for the downstream formatter,
 * optionally extracting function definitions and call sites along the way.
 */
public class RewriterApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new RewriteCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
