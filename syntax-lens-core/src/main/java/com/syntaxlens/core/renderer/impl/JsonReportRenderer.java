package com.syntaxlens.core.renderer.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.syntaxlens.core.analyzer.AnalysisReport;
import com.syntaxlens.core.renderer.RenderContext;
import com.syntaxlens.core.renderer.ReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;

/**
 * Renderer that writes a report as JSON.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code json.indent} - spaces per level; "0" writes a single line (default: "2")</li>
 * </ul>
 */
public class JsonReportRenderer implements ReportRenderer {

    private static final Logger log = LoggerFactory.getLogger(JsonReportRenderer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public void render(AnalysisReport report, RenderContext context) {
        int indent = parseIndent(context.getSettingOrDefault("json.indent", "2"));
        try {
            context.out().println(writer(indent).writeValueAsString(report));
            context.out().flush();
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize report for " + report.source(), e);
        }
        log.debug("Rendered {} as JSON", report.source());
    }

    private static ObjectWriter writer(int indent) {
        if (indent <= 0) {
            return MAPPER.writer();
        }
        DefaultIndenter indenter = new DefaultIndenter(" ".repeat(indent), "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
            .withObjectIndenter(indenter)
            .withArrayIndenter(indenter);
        return MAPPER.writer(printer);
    }

    private static int parseIndent(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid json.indent '{}', using 2", value);
            return 2;
        }
    }
}
