package com.verus.rewriter.report;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verus.rewriter.rewrite.ExtractionResult;
import com.verus.rewriter.rewrite.RewrittenFile;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the per-file function names and call sites of an extraction run as
 * a plain-text report.
 */
public class ExtractionReportRenderer {
    private static final Logger log = LoggerFactory.getLogger(ExtractionReportRenderer.class);

    static final String TEMPLATE_NAME = "extraction-report.ftl";

    private final Configuration freemarkerConfig;

    public ExtractionReportRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * Files without extraction data (reconstruct-only runs) are skipped.
     */
    public String render(List<RewrittenFile> files) throws IOException, TemplateException {
        List<Map<String, Object>> entries = new ArrayList<>();
        int totalFunctions = 0;
        int totalCallSites = 0;

        for (RewrittenFile file : files) {
            ExtractionResult extraction = file.getExtraction();
            if (extraction == null) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("path", file.getSource().toString());
            entry.put("functions", new ArrayList<>(extraction.getFnMap().keySet()));
            entry.put("calls", toCallEntries(extraction.getFnCalls()));
            entries.add(entry);

            totalFunctions += extraction.getFunctionCount();
            totalCallSites += extraction.getCallSiteCount();
        }

        Map<String, Object> model = new HashMap<>();
        model.put("files", entries);
        model.put("totalFunctions", totalFunctions);
        model.put("totalCallSites", totalCallSites);

        Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
        StringWriter out = new StringWriter();
        template.process(model, out);

        log.debug("Rendered extraction report for {} file(s)", entries.size());
        return out.toString();
    }

    private static List<Map<String, Object>> toCallEntries(Map<String, List<List<String>>> fnCalls) {
        List<Map<String, Object>> calls = new ArrayList<>();
        fnCalls.forEach((callee, sites) -> {
            for (List<String> arguments : sites) {
                Map<String, Object> call = new LinkedHashMap<>();
                call.put("callee", callee);
                call.put("arguments", arguments);
                calls.add(call);
            }
        });
        return calls;
    }
}
