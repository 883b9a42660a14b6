package com.verus.rewriter.extract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.verus.rewriter.reconstruct.ProgramAccumulator;

/**
 * Program buffer plus the function table and call-site table of one extraction
 * traversal. Tables keep first-insertion order so results are deterministic.
 */
public class CallGraphAccumulator extends ProgramAccumulator implements ExtractionAccumulator {

    // names are assumed unique; a redefinition overwrites
    private final Map<String, String> fnMap = new LinkedHashMap<>();
    private final Map<String, List<List<String>>> fnCalls = new LinkedHashMap<>();

    @Override
    public CallGraphAccumulator append(CharSequence text) {
        super.append(text);
        return this;
    }

    @Override
    public CallGraphAccumulator append(char c) {
        super.append(c);
        return this;
    }

    @Override
    public void recordFunction(String name, String sourceText) {
        fnMap.put(name, sourceText);
    }

    @Override
    public void recordCallSite(String callee, List<String> arguments) {
        fnCalls.computeIfAbsent(callee, k -> new ArrayList<>()).add(List.copyOf(arguments));
    }

    @Override
    public Map<String, String> getFnMap() {
        return Collections.unmodifiableMap(fnMap);
    }

    @Override
    public Map<String, List<List<String>>> getFnCalls() {
        Map<String, List<List<String>>> copy = new LinkedHashMap<>();
        fnCalls.forEach((callee, sites) -> copy.put(callee, List.copyOf(sites)));
        return Collections.unmodifiableMap(copy);
    }

    public int getCallSiteCount() {
        return fnCalls.values().stream().mapToInt(List::size).sum();
    }
}
