package com.syntaxlens.core.analyzer;

import com.syntaxlens.core.renderer.ReportRenderer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Validates SPI registration of analyzers and renderers.
 *
 * <p>Guards against typos in {@code META-INF/services} and constructor failures
 * during instantiation.
 */
class AnalyzerServiceLoaderTest {

    @Test
    void serviceLoader_discoversAllRegisteredAnalyzers() {
        List<SourceAnalyzer> analyzers = ServiceLoader.load(SourceAnalyzer.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        assertThat(analyzers)
            .extracting(SourceAnalyzer::getId)
            .containsExactlyInAnyOrder("css", "javascript")
            .doesNotHaveDuplicates();
    }

    @Test
    void serviceLoader_discoversAllRegisteredRenderers() {
        List<ReportRenderer> renderers = ServiceLoader.load(ReportRenderer.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        assertThat(renderers)
            .extracting(ReportRenderer::getId)
            .containsExactlyInAnyOrder("console", "json");
    }

    @Test
    void analyzers_haveDisplayNamesAndExtensions() {
        for (SourceAnalyzer analyzer : ServiceLoader.load(SourceAnalyzer.class)) {
            assertThat(analyzer.getDisplayName()).as(analyzer.getId()).isNotBlank();
            assertThat(analyzer.getSupportedExtensions()).as(analyzer.getId()).isNotEmpty();
        }
    }
}
