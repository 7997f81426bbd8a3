package com.syntaxlens.core.model;

import java.util.Objects;

/**
 * An ES module export declaration.
 *
 * @param kind default, named or all
 * @param source re-export source module, or null for local exports
 */
public record ExportInfo(
    ExportKind kind,
    String source
) {
    public ExportInfo {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * @return true for {@code export ... from '...'}
     */
    public boolean isReExport() {
        return source != null;
    }
}
