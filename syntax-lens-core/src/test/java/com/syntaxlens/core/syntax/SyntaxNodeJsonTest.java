package com.syntaxlens.core.syntax;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SyntaxNodeJson}.
 */
class SyntaxNodeJsonTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void fromJson_estreeObject_usesTypeAsDiscriminant() throws Exception {
        // Given
        JsonNode json = MAPPER.readTree("""
            {"type": "VariableDeclaration", "kind": "const",
             "declarations": [{"type": "VariableDeclarator", "id": {"type": "Identifier", "name": "x"}, "init": null}]}
            """);

        // When
        SyntaxNode node = SyntaxNodeJson.fromJson(json);

        // Then
        assertThat(node.type()).isEqualTo("VariableDeclaration");
        assertThat(node.has("type")).isFalse();
        assertThat(node.string("kind")).isEqualTo("const");
        List<SyntaxNode> declarators = node.nodes("declarations");
        assertThat(declarators).hasSize(1);
        assertThat(declarators.get(0).nestedName("id")).isEqualTo("x");
        assertThat(declarators.get(0).fields()).containsKey("init");
        assertThat(declarators.get(0).get("init")).isNull();
    }

    @Test
    void fromJson_scalarsAndUntypedObjects_keptAsIs() throws Exception {
        JsonNode json = MAPPER.readTree("""
            {"type": "Literal", "value": 42, "raw": "42", "regex": null, "flag": true,
             "range": [0, 2], "loc": {"start": {"line": 1, "column": 0}}}
            """);

        SyntaxNode node = SyntaxNodeJson.fromJson(json);

        assertThat(((Number) node.get("value")).intValue()).isEqualTo(42);
        assertThat(node.bool("flag")).isTrue();
        assertThat(node.list("range")).hasSize(2);
        assertThat(node.node("loc").hasType()).isFalse();
        assertThat(node.node("loc").node("start").get("line")).isEqualTo(1);
    }

    @Test
    void fromJson_nonObjectRoot_throwsIllegalArgumentException() throws Exception {
        JsonNode json = MAPPER.readTree("[1, 2]");

        assertThatThrownBy(() -> SyntaxNodeJson.fromJson(json))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toJson_zeroIndent_writesSingleLineWithTypeFirst() throws Exception {
        SyntaxNode node = SyntaxNodeJson.fromJson(MAPPER.readTree(
            "{\"name\": \"x\", \"type\": \"Identifier\"}"));

        String json = SyntaxNodeJson.toJson(node, 0);

        assertThat(json).doesNotContain("\n");
        assertThat(json).startsWith("{\"type\":\"Identifier\"");
        assertThat(MAPPER.readTree(json).get("name").asText()).isEqualTo("x");
    }

    @Test
    void toJson_positiveIndent_writesOneFieldPerLine() throws Exception {
        String source = "{\"type\": \"Program\", \"body\": [{\"type\": \"EmptyStatement\"}], \"sourceType\": \"script\"}";
        SyntaxNode node = SyntaxNodeJson.fromJson(MAPPER.readTree(source));

        String json = SyntaxNodeJson.toJson(node, 4);

        assertThat(json).contains("\n    \"body\"");
        assertThat(MAPPER.readTree(json)).isEqualTo(MAPPER.readTree(source));
    }
}
