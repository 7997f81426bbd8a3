package com.syntaxlens.core.javascript;

import com.syntaxlens.core.model.ModuleType;

/**
 * Guesses the module system of a source file from plain substrings.
 *
 * <p>Not grammar-aware: keywords inside strings or comments count too.
 */
public final class ModuleTypeDetector {

    private static final String IMPORT = "import ";
    private static final String FROM = " from ";
    private static final String EXPORT = "export ";

    private ModuleTypeDetector() {
    }

    /**
     * @param code source text
     * @return {@code ES6} for {@code import ... from} or any {@code export };
     *         {@code COMMONJS} for {@code require(}, {@code module.exports} or {@code exports.};
     *         {@code NONE} otherwise
     */
    public static ModuleType detect(String code) {
        if (code == null || code.isEmpty()) {
            return ModuleType.NONE;
        }

        int importAt = code.indexOf(IMPORT);
        boolean importFrom = importAt >= 0 && code.indexOf(FROM, importAt + IMPORT.length()) >= 0;
        if (importFrom || code.contains(EXPORT)) {
            return ModuleType.ES6;
        }

        if (code.contains("require(") || code.contains("module.exports") || code.contains("exports.")) {
            return ModuleType.COMMONJS;
        }
        return ModuleType.NONE;
    }
}
