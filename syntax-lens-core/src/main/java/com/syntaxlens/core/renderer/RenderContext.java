package com.syntaxlens.core.renderer;

import java.io.PrintWriter;
import java.util.Map;
import java.util.Objects;

/**
 * Context provided to renderers during execution.
 *
 * @param out destination; renderers flush but never close it
 * @param settings renderer-specific settings (e.g., "console.colors", "json.indent")
 */
public record RenderContext(
    PrintWriter out,
    Map<String, String> settings
) {
    public RenderContext {
        Objects.requireNonNull(out, "out must not be null");
        if (settings == null) {
            settings = Map.of();
        }
    }

    /**
     * Gets a setting value.
     *
     * @param key setting key
     * @return setting value, or null if not present
     */
    public String getSetting(String key) {
        return settings.get(key);
    }

    /**
     * Gets a setting value with a default.
     *
     * @param key setting key
     * @param defaultValue default value if not present
     * @return setting value or default
     */
    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
