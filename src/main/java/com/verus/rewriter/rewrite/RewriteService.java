package com.verus.rewriter.rewrite;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verus.rewriter.extract.CallGraphAccumulator;
import com.verus.rewriter.extract.ExtractionListener;
import com.verus.rewriter.extract.ExtractionRules;
import com.verus.rewriter.extract.MalformedInputException;
import com.verus.rewriter.model.CstNode;
import com.verus.rewriter.model.CstNodes;
import com.verus.rewriter.parser.ParseException;
import com.verus.rewriter.parser.VerusParser;
import com.verus.rewriter.reconstruct.ProgramAccumulator;
import com.verus.rewriter.reconstruct.ReconstructionRules;
import com.verus.rewriter.report.ExtractionReportRenderer;
import com.verus.rewriter.traversal.RuleRegistry;
import com.verus.rewriter.traversal.Traversal;

import freemarker.template.TemplateException;

/**
 * Entry point for rewriting: runs the reconstruction or extraction rule set
 * over a CST, or over whole source files.
 */
public class RewriteService {
    private static final Logger log = LoggerFactory.getLogger(RewriteService.class);

    public static final String OUTPUT_SUFFIX = ".rewritten";

    private final RewriterConfig config;
    private final RuleRegistry<ProgramAccumulator> reconstructionRules;
    private final RuleRegistry<CallGraphAccumulator> extractionRules;
    private final ExtractionReportRenderer reportRenderer;

    public RewriteService(RewriterConfig config) {
        this.config = config;
        this.reconstructionRules = ReconstructionRules.registry();
        this.extractionRules = ExtractionRules.registry();
        this.reportRenderer = new ExtractionReportRenderer();
    }

    /**
     * Canonicalized program text for the tree.
     *
     * @throws MalformedInputException if the tree is deeper than the configured limit
     */
    public String reconstruct(CstNode root) {
        checkDepth(root);
        ProgramAccumulator accumulator = new ProgramAccumulator();
        Traversal.visit(accumulator, root, reconstructionRules);
        return accumulator.getProgram();
    }

    /**
     * Program text, function table and call sites for the tree. A fatal
     * condition aborts the traversal; no partial result is returned.
     *
     * @throws MalformedInputException if the tree is too deep or a function has no name
     */
    public ExtractionResult extract(CstNode root) {
        return runExtraction(root, extractionRules);
    }

    public ExtractionResult extract(CstNode root, ExtractionListener listener) {
        return runExtraction(root, ExtractionRules.registry(listener));
    }

    private ExtractionResult runExtraction(CstNode root, RuleRegistry<CallGraphAccumulator> rules) {
        checkDepth(root);
        CallGraphAccumulator accumulator = new CallGraphAccumulator();
        Traversal.visit(accumulator, root, rules);
        log.debug("Extracted {} functions and {} call sites", accumulator.getFnMap().size(),
                accumulator.getCallSiteCount());
        return new ExtractionResult(accumulator.getProgram(), accumulator.getFnMap(), accumulator.getFnCalls());
    }

    /**
     * Rewrite every input file. Failures are isolated per file: a failing file
     * produces no output and is reported in the result, the others proceed.
     */
    public RewriteResult rewrite(List<Path> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            return RewriteResult.failure("No input files given");
        }

        log.info("Starting rewrite of {} file(s) in {} mode...", inputs.size(), config.getMode());
        RewriteDiagnostics diagnostics = new RewriteDiagnostics();
        List<RewrittenFile> files = new ArrayList<>();

        for (Path input : inputs) {
            try {
                files.add(rewriteFile(input));
            } catch (ParseException | MalformedInputException e) {
                log.error("Failed to rewrite {}: {}", input, e.getMessage());
                diagnostics.getErrors().add(input + ": " + e.getMessage());
            } catch (IOException e) {
                log.error("I/O error while rewriting {}", input, e);
                diagnostics.getErrors().add(input + ": " + describe(e));
            }
        }

        Path reportFile = null;
        if (config.getMode() == RewriteMode.EXTRACT && config.getReportFile() != null) {
            reportFile = writeReport(files, diagnostics);
        }

        int functions = 0;
        int callSites = 0;
        for (RewrittenFile file : files) {
            if (file.getExtraction() != null) {
                functions += file.getExtraction().getFunctionCount();
                callSites += file.getExtraction().getCallSiteCount();
            }
        }

        return RewriteResult.builder()
                .success(!diagnostics.hasErrors())
                .errorMessage(diagnostics.hasErrors()
                        ? String.join(System.lineSeparator(), diagnostics.getErrors())
                        : null)
                .filesProcessed(files.size())
                .filesFailed(inputs.size() - files.size())
                .functionsExtracted(functions)
                .callSitesExtracted(callSites)
                .reportFile(reportFile)
                .files(files)
                .errors(List.copyOf(diagnostics.getErrors()))
                .warnings(List.copyOf(diagnostics.getWarnings()))
                .build();
    }

    /**
     * Where the rewritten text of {@code input} goes.
     */
    public Path outputPathFor(Path input) {
        Path dir = config.getOutputDir() != null
                ? config.getOutputDir()
                : input.toAbsolutePath().getParent();
        return dir.resolve(input.getFileName().toString() + OUTPUT_SUFFIX);
    }

    private RewrittenFile rewriteFile(Path input) throws IOException {
        log.info("Rewriting {}", input);
        String source = Files.readString(input, StandardCharsets.UTF_8);
        CstNode root = new VerusParser(source, input.toString(), config.getMaxNestingDepth()).parse();

        ExtractionResult extraction = null;
        String program;
        if (config.getMode() == RewriteMode.EXTRACT) {
            extraction = extract(root);
            program = extraction.getProgram();
        } else {
            program = reconstruct(root);
        }

        Path output = null;
        if (config.isDryRun()) {
            log.info("Dry run, not writing output for {}", input);
        } else {
            output = outputPathFor(input);
            if (Files.exists(output) && !config.isForce()) {
                throw new FileAlreadyExistsException(output.toString(), null,
                        "output file already exists, use --force to overwrite");
            }
            writeString(output, program);
            log.info("Wrote {}", output);
        }

        return RewrittenFile.builder()
                .source(input)
                .output(output)
                .program(program)
                .extraction(extraction)
                .build();
    }

    private Path writeReport(List<RewrittenFile> files, RewriteDiagnostics diagnostics) {
        Path reportFile = config.getReportFile();
        if (files.isEmpty()) {
            diagnostics.getWarnings().add("No file was extracted, report not written: " + reportFile);
            return null;
        }
        if (config.isDryRun()) {
            log.info("Dry run, not writing report {}", reportFile);
            return null;
        }
        try {
            writeString(reportFile, reportRenderer.render(files));
            log.info("Wrote extraction report {}", reportFile);
            return reportFile;
        } catch (IOException | TemplateException e) {
            log.error("Failed to write extraction report {}", reportFile, e);
            diagnostics.getErrors().add("Report " + reportFile + ": " + describe(e));
            return null;
        }
    }

    private void checkDepth(CstNode root) {
        int depth = CstNodes.depth(root);
        if (depth > config.getMaxNestingDepth()) {
            throw new MalformedInputException(
                    "CST nesting depth " + depth + " exceeds limit of " + config.getMaxNestingDepth(),
                    root.getLine(), root.getColumn());
        }
    }

    private static void writeString(Path file, String content) throws IOException {
        Path parentDir = file.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
