package com.syntaxlens.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.syntaxlens.core.javascript.JsParseOptions;

import java.util.Map;

/**
 * Root configuration for syntax-lens.
 *
 * <p>Loaded from {@code syntaxlens.yaml}. Sections that are missing fall back to
 * their defaults, so a file holding only {@code output.format} is valid.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * javascript:
 *   jsx: true
 *   tolerant: true
 *
 * css:
 *   indent: "    "
 *   browserCompliant: true
 *
 * output:
 *   format: json
 *   jsonIndent: 2
 *   colors: false
 * }</pre>
 *
 * @param javascript JavaScript parsing settings
 * @param css CSS parsing and formatting settings
 * @param output report output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzerConfig(
    @JsonProperty("javascript") JavaScriptConfig javascript,
    @JsonProperty("css") CssConfig css,
    @JsonProperty("output") OutputConfig output
) {
    public AnalyzerConfig {
        if (javascript == null) {
            javascript = JavaScriptConfig.defaults();
        }
        if (css == null) {
            css = CssConfig.defaults();
        }
        if (output == null) {
            output = OutputConfig.defaults();
        }
    }

    /**
     * @return tolerant, non-JSX JavaScript; two-space CSS indent; colored console output
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(JavaScriptConfig.defaults(), CssConfig.defaults(), OutputConfig.defaults());
    }

    /**
     * Flattens the output section into renderer settings.
     *
     * @return settings keyed the way renderers read them
     */
    public Map<String, String> rendererSettings() {
        return Map.of(
            "console.colors", String.valueOf(output.colors()),
            "json.indent", String.valueOf(output.jsonIndent()));
    }

    /**
     * @param jsx accept JSX elements
     * @param tolerant recover from local syntax errors
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record JavaScriptConfig(
        @JsonProperty("jsx") Boolean jsx,
        @JsonProperty("tolerant") Boolean tolerant
    ) {
        public JavaScriptConfig {
            if (jsx == null) {
                jsx = false;
            }
            if (tolerant == null) {
                tolerant = true;
            }
        }

        public static JavaScriptConfig defaults() {
            return new JavaScriptConfig(false, true);
        }

        public JsParseOptions toParseOptions() {
            return JsParseOptions.defaults().withJsx(jsx).withTolerant(tolerant);
        }
    }

    /**
     * @param indent prefix of declaration lines when formatting
     * @param browserCompliant skip malformed constructs like a browser does
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CssConfig(
        @JsonProperty("indent") String indent,
        @JsonProperty("browserCompliant") Boolean browserCompliant
    ) {
        public CssConfig {
            if (indent == null) {
                indent = "  ";
            }
            if (browserCompliant == null) {
                browserCompliant = true;
            }
        }

        public static CssConfig defaults() {
            return new CssConfig("  ", true);
        }
    }

    /**
     * @param format renderer id, e.g. "console" or "json"
     * @param jsonIndent spaces per JSON level; zero or less for a single line
     * @param colors ANSI colors in console output
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("format") String format,
        @JsonProperty("jsonIndent") Integer jsonIndent,
        @JsonProperty("colors") Boolean colors
    ) {
        public OutputConfig {
            if (format == null || format.isBlank()) {
                format = "console";
            }
            if (jsonIndent == null) {
                jsonIndent = 2;
            }
            if (colors == null) {
                colors = true;
            }
        }

        public static OutputConfig defaults() {
            return new OutputConfig("console", 2, true);
        }
    }
}
