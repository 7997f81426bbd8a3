package com.syntaxlens.core.model;

import java.util.Locale;
import java.util.Set;

/**
 * Languages the engine understands, keyed by file extension.
 */
public enum SourceLanguage {
    CSS(Set.of("css")),
    JAVASCRIPT(Set.of("js", "mjs", "cjs", "jsx")),
    UNKNOWN(Set.of());

    private final Set<String> extensions;

    SourceLanguage(Set<String> extensions) {
        this.extensions = extensions;
    }

    public Set<String> extensions() {
        return extensions;
    }

    /**
     * Resolves a language from a file extension.
     *
     * @param extension extension without the dot, any case
     * @return matching language or {@link #UNKNOWN}
     */
    public static SourceLanguage fromExtension(String extension) {
        if (extension == null) {
            return UNKNOWN;
        }
        String normalized = extension.toLowerCase(Locale.ROOT);
        for (SourceLanguage language : values()) {
            if (language.extensions.contains(normalized)) {
                return language;
            }
        }
        return UNKNOWN;
    }
}
