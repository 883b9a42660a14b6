package com.verus.rewriter.rewrite;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Result of a rewrite run over a set of input files.
 */
@Data
@Builder
public class RewriteResult {
    private boolean success;
    private String errorMessage;

    private int filesProcessed;
    private int filesFailed;
    private int functionsExtracted;
    private int callSitesExtracted;
    private Path reportFile;

    @Singular
    private List<RewrittenFile> files;
    private List<String> errors;
    private List<String> warnings;

    public static RewriteResult failure(String errorMessage) {
        return RewriteResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errors(List.of(errorMessage))
                .warnings(List.of())
                .build();
    }
}
