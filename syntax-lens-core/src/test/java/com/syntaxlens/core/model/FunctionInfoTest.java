package com.syntaxlens.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FunctionInfo}.
 */
class FunctionInfoTest {

    @Test
    void constructor_arrow_forcesNoNameAndNoGenerator() {
        FunctionInfo arrow = new FunctionInfo(FunctionKind.ARROW, "ignored", List.of("a"), true, true);

        assertThat(arrow.name()).isNull();
        assertThat(arrow.hasName()).isFalse();
        assertThat(arrow.isGenerator()).isFalse();
        assertThat(arrow.isAsync()).isTrue();
    }

    @Test
    void constructor_copiesParams() {
        List<String> params = new ArrayList<>(List.of("x"));
        FunctionInfo function = new FunctionInfo(FunctionKind.DECLARATION, "f", params, false, false);

        params.add("y");

        assertThat(function.params()).containsExactly("x");
    }

    @Test
    void constructor_nullParams_becomeEmpty() {
        assertThat(new FunctionInfo(FunctionKind.EXPRESSION, null, null, false, false).params()).isEmpty();
    }

    @Test
    void constructor_nullKind_throwsException() {
        assertThatThrownBy(() -> new FunctionInfo(null, "f", List.of(), false, false))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("kind");
    }

    @Test
    void fromNodeType_knownTypes_resolve() {
        assertThat(FunctionKind.fromNodeType("ArrowFunctionExpression")).isEqualTo(FunctionKind.ARROW);
    }
}
