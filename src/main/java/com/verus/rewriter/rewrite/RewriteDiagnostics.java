package com.verus.rewriter.rewrite;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Errors and warnings accumulated during a rewrite run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class RewriteDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
