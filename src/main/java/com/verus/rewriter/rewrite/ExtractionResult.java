package com.verus.rewriter.rewrite;

import java.util.List;
import java.util.Map;

import lombok.Value;

/**
 * Outcome of one extraction traversal: the reconstructed program, the
 * function table and the call-site table.
 */
@Value
public class ExtractionResult {
    String program;
    Map<String, String> fnMap;
    Map<String, List<List<String>>> fnCalls;

    public int getFunctionCount() {
        return fnMap.size();
    }

    public int getCallSiteCount() {
        return fnCalls.values().stream().mapToInt(List::size).sum();
    }
}
