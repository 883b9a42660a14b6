package com.verus.rewriter.extract;

import java.util.List;
import java.util.Map;

import com.verus.rewriter.traversal.Accumulator;

/**
 * Accumulator capable of recording function bodies and call sites in addition
 * to building the program text.
 */
public interface ExtractionAccumulator extends Accumulator {

    /**
     * Record the full verbatim text of a function definition. A later
     * definition with the same name replaces the earlier one.
     */
    void recordFunction(String name, String sourceText);

    /**
     * Append one call site (raw argument texts, left to right) for {@code callee}.
     */
    void recordCallSite(String callee, List<String> arguments);

    Map<String, String> getFnMap();

    Map<String, List<List<String>>> getFnCalls();
}
