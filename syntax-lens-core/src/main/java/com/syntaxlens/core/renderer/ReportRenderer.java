package com.syntaxlens.core.renderer;

import com.syntaxlens.core.analyzer.AnalysisReport;

/**
 * Writes analysis reports in one output format.
 *
 * <p>Discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.syntaxlens.core.renderer.ReportRenderer}
 */
public interface ReportRenderer {

    /**
     * Returns unique identifier for this renderer (e.g., "console", "json").
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Renders a report.
     *
     * @param report report to render
     * @param context destination and renderer settings
     */
    void render(AnalysisReport report, RenderContext context);
}
