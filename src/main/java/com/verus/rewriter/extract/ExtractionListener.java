package com.verus.rewriter.extract;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running report of extraction progress, notified each time a
 * {@code verus!} macro block has been fully traversed.
 */
@FunctionalInterface
public interface ExtractionListener {

    /**
     * @param functionNames functions discovered so far (immutable snapshot)
     * @param callSites     call sites discovered so far (immutable snapshot)
     */
    void onMacroBlockFinished(Set<String> functionNames, Map<String, List<List<String>>> callSites);

    static ExtractionListener logging() {
        Logger log = LoggerFactory.getLogger(ExtractionListener.class);
        return (functionNames, callSites) -> log.debug("Macro block finished: functions={}, calls={}",
                functionNames, callSites);
    }
}
