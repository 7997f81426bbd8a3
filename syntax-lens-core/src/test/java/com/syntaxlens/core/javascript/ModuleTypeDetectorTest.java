package com.syntaxlens.core.javascript;

import com.syntaxlens.core.model.ModuleType;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ModuleTypeDetector}.
 */
class ModuleTypeDetectorTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
        "import a from 'b';                    | ES6",
        "export const x = 1;                   | ES6",
        "const a = require('b');               | COMMONJS",
        "module.exports = {};                  | COMMONJS",
        "exports.run = function () {};         | COMMONJS",
        "const a = 1;                          | NONE"
    })
    void detect_sampleSources_returnsModuleType(String code, ModuleType expected) {
        assertThat(ModuleTypeDetector.detect(code)).isEqualTo(expected);
    }

    @Test
    void detect_importAndRequire_prefersEs6() {
        assertThat(ModuleTypeDetector.detect("import a from 'b'; const c = require('d');"))
            .isEqualTo(ModuleType.ES6);
    }

    @Test
    void detect_fromBeforeImport_isNotEs6() {
        // " from " must follow "import "
        assertThat(ModuleTypeDetector.detect("const s = ' from '; import('x');"))
            .isEqualTo(ModuleType.NONE);
    }

    @Test
    void detect_keywordsInsideStrings_stillCount() {
        assertThat(ModuleTypeDetector.detect("const s = 'export default';"))
            .isEqualTo(ModuleType.ES6);
    }

    @Test
    void detect_emptyOrNull_returnsNone() {
        assertThat(ModuleTypeDetector.detect("")).isEqualTo(ModuleType.NONE);
        assertThat(ModuleTypeDetector.detect(null)).isEqualTo(ModuleType.NONE);
    }
}
