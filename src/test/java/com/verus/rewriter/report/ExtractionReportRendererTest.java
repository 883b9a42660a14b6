package com.verus.rewriter.report;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.verus.rewriter.rewrite.ExtractionResult;
import com.verus.rewriter.rewrite.RewrittenFile;

import static org.assertj.core.api.Assertions.*;

class ExtractionReportRendererTest {

    private final ExtractionReportRenderer renderer = new ExtractionReportRenderer();

    @Test
    void testRenderFunctionsAndCallSites() throws Exception {
        Map<String, List<List<String>>> calls = new LinkedHashMap<>();
        calls.put("bar", List.of(List.of("1", "2"), List.of("x", "y", "z")));
        calls.put("baz", List.of(List.of()));
        RewrittenFile file = extracted("src/foo.rs", Map.of("foo", "fn foo() {}"), calls);

        String report = renderer.render(List.of(file));

        assertThat(report)
                .startsWith("Verus extraction report")
                .contains("File: " + Path.of("src/foo.rs"))
                .contains("Functions (1):\n  - foo\n")
                .contains("Call sites (3):\n  - bar(1, 2)\n  - bar(x, y, z)\n  - baz()\n")
                .contains("Total: 1 functions, 3 call sites");
    }

    @Test
    void testEmptySectionsAndSkippedFiles() throws Exception {
        RewrittenFile empty = extracted("empty.rs", Map.of(), Map.of());
        RewrittenFile reconstructed = RewrittenFile.builder()
                .source(Path.of("plain.rs"))
                .program("x ")
                .build();

        String report = renderer.render(List.of(empty, reconstructed));

        assertThat(report)
                .contains("Functions (0):\n  (none)\n")
                .contains("Call sites (0):\n  (none)\n")
                .doesNotContain("plain.rs")
                .contains("Total: 0 functions, 0 call sites");
    }

    private static RewrittenFile extracted(String path, Map<String, String> fnMap,
            Map<String, List<List<String>>> fnCalls) {
        return RewrittenFile.builder()
                .source(Path.of(path))
                .program("")
                .extraction(new ExtractionResult("", fnMap, fnCalls))
                .build();
    }
}
