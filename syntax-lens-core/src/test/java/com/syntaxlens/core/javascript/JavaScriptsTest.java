package com.syntaxlens.core.javascript;

import com.syntaxlens.core.model.FunctionInfo;
import com.syntaxlens.core.model.VariableInfo;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link JavaScripts}.
 */
class JavaScriptsTest {

    @Test
    void parseJavaScript_jsxEnabled_returnsProgram() {
        assertThat(JavaScripts.parseJavaScript("const a = <i/>;", true).type()).isEqualTo("Program");
    }

    @Test
    void validateJavaScript_invalidCode_isInvalid() {
        assertThat(JavaScripts.validateJavaScript("let = ;").valid()).isFalse();
    }

    @Test
    void extractors_returnNamedEntries() {
        assertThat(JavaScripts.extractFunctions("function a() {}")).extracting(FunctionInfo::name).containsExactly("a");
        assertThat(JavaScripts.extractVariables("let b;")).extracting(VariableInfo::name).containsExactly("b");
    }

    @Test
    void getDependencies_commonJs_returnsRequires() {
        assertThat(JavaScripts.getDependencies("require('x')").requires()).containsExactly("x");
    }
}
