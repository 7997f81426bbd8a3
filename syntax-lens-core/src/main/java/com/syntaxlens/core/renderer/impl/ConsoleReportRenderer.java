package com.syntaxlens.core.renderer.impl;

import com.syntaxlens.core.analyzer.AnalysisReport;
import com.syntaxlens.core.analyzer.CssReport;
import com.syntaxlens.core.analyzer.JsReport;
import com.syntaxlens.core.model.ClassInfo;
import com.syntaxlens.core.model.ComplexityMetrics;
import com.syntaxlens.core.model.CssRule;
import com.syntaxlens.core.model.FunctionInfo;
import com.syntaxlens.core.model.MediaQuery;
import com.syntaxlens.core.renderer.RenderContext;
import com.syntaxlens.core.renderer.ReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;

/**
 * Renderer that prints a human-readable summary with optional ANSI color formatting.
 *
 * <p>Color support can be disabled for CI environments or when redirecting output.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "true")</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = new RenderContext(
 *     new PrintWriter(System.out, true),
 *     Map.of("console.colors", "false"));
 *
 * new ConsoleReportRenderer().render(report, context);
 * }</pre>
 */
public class ConsoleReportRenderer implements ReportRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleReportRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_RED = "\u001B[31m";

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(AnalysisReport report, RenderContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "true"));
        Style style = new Style(context.out(), useColors);

        style.header(report.source() + " (" + report.language().name().toLowerCase(Locale.ROOT) + ")");

        if (!report.success()) {
            for (String error : report.errors()) {
                style.line(ANSI_RED, "error: " + error);
            }
        } else if (report instanceof JsReport jsReport) {
            renderJavaScript(jsReport, style);
        } else if (report instanceof CssReport cssReport) {
            renderCss(cssReport, style);
        } else {
            logger.warn("No console layout for report type {}", report.getClass().getSimpleName());
        }

        for (String warning : report.warnings()) {
            style.line(ANSI_YELLOW, "warning: " + warning);
        }
        context.out().flush();
    }

    private void renderJavaScript(JsReport report, Style style) {
        ComplexityMetrics metrics = report.metrics();
        style.section("Summary");
        style.field("Source type", report.sourceType());
        style.field("Module type", report.moduleType().label());
        style.field("Lines", metrics.lines());
        style.field("Statements", metrics.statements());
        style.field("Loops", metrics.loops());
        style.field("Conditionals", metrics.conditionals());
        style.field("Max depth", metrics.maxDepth());

        style.section("Functions (" + report.functions().size() + ")");
        for (FunctionInfo function : report.functions()) {
            String name = function.hasName() ? function.name() : "<anonymous>";
            String prefix = (function.isAsync() ? "async " : "") + (function.isGenerator() ? "*" : "");
            style.item(prefix + name + "(" + String.join(", ", function.params()) + ") "
                + function.kind().nodeType());
        }

        style.section("Variables (" + report.variables().size() + ")");
        report.variables().forEach(variable ->
            style.item(variable.declKind().keyword() + " " + (variable.name() != null ? variable.name() : "<pattern>")));

        style.section("Classes (" + report.classes().size() + ")");
        for (ClassInfo info : report.classes()) {
            String name = info.name() != null ? info.name() : "<anonymous>";
            style.item(info.superclassName() != null ? name + " extends " + info.superclassName() : name);
        }

        style.section("Dependencies");
        report.dependencies().imports().forEach(source -> style.item("import " + source));
        report.dependencies().requires().forEach(source -> style.item("require " + source));

        style.field("Exports", report.exports().size());
        style.field("Comments", report.comments().size());
    }

    private void renderCss(CssReport report, Style style) {
        style.section("Summary");
        style.field("Rules", report.rules().size());
        style.field("Style rules", report.rules().stream().filter(CssRule.class::isInstance).count());
        style.field("Media queries", report.mediaQueries().size());

        style.section("Selectors (" + report.selectors().size() + ")");
        report.selectors().forEach(style::item);

        style.section("Colors (" + report.colors().size() + ")");
        report.colors().forEach(style::item);

        if (!report.mediaQueries().isEmpty()) {
            style.section("Media");
            for (MediaQuery query : report.mediaQueries()) {
                List<String> selectors = query.ruleSelectors();
                style.item("@media " + query.condition() + " -> " + String.join(", ", selectors));
            }
        }
    }

    /**
     * Line writer that applies colors only when enabled.
     */
    private static final class Style {
        private final PrintWriter out;
        private final boolean colors;

        private Style(PrintWriter out, boolean colors) {
            this.out = out;
            this.colors = colors;
        }

        void header(String text) {
            line(ANSI_BOLD + ANSI_GREEN, text);
        }

        void section(String text) {
            out.println();
            line(ANSI_BOLD + ANSI_CYAN, text);
        }

        void field(String name, Object value) {
            out.println("  " + name + ": " + value);
        }

        void item(String text) {
            out.println("  - " + text);
        }

        void line(String color, String text) {
            out.println(colors ? color + text + ANSI_RESET : text);
        }
    }
}
