package com.syntaxlens.core.config;

import com.syntaxlens.core.javascript.JsParseOptions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AnalyzerConfig}.
 */
class AnalyzerConfigTest {

    @Test
    void constructor_nullSections_useDefaults() {
        AnalyzerConfig config = new AnalyzerConfig(null, null, null);

        assertThat(config).isEqualTo(AnalyzerConfig.defaults());
        assertThat(config.output().format()).isEqualTo("console");
        assertThat(config.css().indent()).isEqualTo("  ");
    }

    @Test
    void outputConfig_blankFormat_fallsBackToConsole() {
        assertThat(new AnalyzerConfig.OutputConfig("  ", null, null).format()).isEqualTo("console");
    }

    @Test
    void toParseOptions_carriesJsxAndTolerance() {
        JsParseOptions options = new AnalyzerConfig.JavaScriptConfig(true, false).toParseOptions();

        assertThat(options.jsx()).isTrue();
        assertThat(options.tolerant()).isFalse();
        assertThat(options.range()).isTrue();
        assertThat(options.loc()).isTrue();
    }

    @Test
    void rendererSettings_flattensOutputSection() {
        AnalyzerConfig config = new AnalyzerConfig(null, null, new AnalyzerConfig.OutputConfig("json", 0, false));

        assertThat(config.rendererSettings())
            .containsEntry("console.colors", "false")
            .containsEntry("json.indent", "0");
    }
}
