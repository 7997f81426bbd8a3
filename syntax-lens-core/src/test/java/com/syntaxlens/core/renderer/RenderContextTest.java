package com.syntaxlens.core.renderer;

import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RenderContext}.
 */
class RenderContextTest {

    private final PrintWriter out = new PrintWriter(new StringWriter());

    @Test
    void constructor_nullOut_throwsException() {
        assertThatThrownBy(() -> new RenderContext(null, Map.of()))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("out must not be null");
    }

    @Test
    void constructor_nullSettings_convertsToEmptyMap() {
        RenderContext context = new RenderContext(out, null);

        assertThat(context.settings()).isEmpty();
    }

    @Test
    void getSetting_missingKey_returnsNull() {
        RenderContext context = new RenderContext(out, Map.of("json.indent", "4"));

        assertThat(context.getSetting("json.indent")).isEqualTo("4");
        assertThat(context.getSetting("console.colors")).isNull();
    }

    @Test
    void getSettingOrDefault_missingKey_returnsDefault() {
        RenderContext context = new RenderContext(out, Map.of());

        assertThat(context.getSettingOrDefault("console.colors", "true")).isEqualTo("true");
    }
}
