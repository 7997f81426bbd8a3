package com.syntaxlens.core.syntax;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between {@link SyntaxNode} trees and JSON.
 *
 * <p>The JSON shape is the ESTree one: every object carries its fields, typed
 * objects lead with {@code "type"}.
 */
public final class SyntaxNodeJson {

    private static final JsonFactory JSON_FACTORY = new JsonFactory();
    private static final String TYPE_FIELD = "type";

    private SyntaxNodeJson() {
        // Utility class
    }

    /**
     * Builds a tree from parsed JSON. Objects become nodes (their {@code "type"}
     * string becomes the discriminant), arrays become lists, scalars stay scalars.
     *
     * @param json JSON object
     * @return the tree root
     * @throws IllegalArgumentException if {@code json} is not an object
     */
    public static SyntaxNode fromJson(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("Syntax tree root must be a JSON object");
        }
        return readObject((ObjectNode) json);
    }

    private static SyntaxNode readObject(ObjectNode object) {
        JsonNode typeNode = object.get(TYPE_FIELD);
        String type = typeNode != null && typeNode.isTextual() ? typeNode.asText() : "";

        Map<String, Object> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = object.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (TYPE_FIELD.equals(entry.getKey()) && !type.isEmpty()) {
                continue;
            }
            fields.put(entry.getKey(), readValue(entry.getValue()));
        }
        return SyntaxNode.of(type, fields);
    }

    private static Object readValue(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isObject()) {
            return readObject((ObjectNode) value);
        }
        if (value.isArray()) {
            List<Object> items = new ArrayList<>(value.size());
            for (JsonNode item : value) {
                items.add(readValue(item));
            }
            return items;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.numberValue();
        }
        return value.asText();
    }

    /**
     * Writes a tree as JSON text.
     *
     * @param node tree root
     * @param indent spaces per nesting level; zero or less writes a single line
     * @return JSON text
     */
    public static String toJson(SyntaxNode node, int indent) {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = JSON_FACTORY.createGenerator(out)) {
            if (indent > 0) {
                DefaultIndenter indenter = new DefaultIndenter(" ".repeat(indent), "\n");
                generator.setPrettyPrinter(new DefaultPrettyPrinter()
                    .withObjectIndenter(indenter)
                    .withArrayIndenter(indenter));
            }
            writeNode(generator, node);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize syntax tree", e);
        }
        return out.toString();
    }

    private static void writeNode(JsonGenerator generator, SyntaxNode node) throws IOException {
        generator.writeStartObject();
        if (node.hasType()) {
            generator.writeStringField(TYPE_FIELD, node.type());
        }
        for (Map.Entry<String, Object> field : node.fields().entrySet()) {
            generator.writeFieldName(field.getKey());
            writeValue(generator, field.getValue());
        }
        generator.writeEndObject();
    }

    private static void writeValue(JsonGenerator generator, Object value) throws IOException {
        if (value == null) {
            generator.writeNull();
        } else if (value instanceof SyntaxNode child) {
            writeNode(generator, child);
        } else if (value instanceof List<?> items) {
            generator.writeStartArray();
            for (Object item : items) {
                writeValue(generator, item);
            }
            generator.writeEndArray();
        } else if (value instanceof Boolean bool) {
            generator.writeBoolean(bool);
        } else if (value instanceof Integer number) {
            generator.writeNumber(number);
        } else if (value instanceof Long number) {
            generator.writeNumber(number);
        } else if (value instanceof BigInteger number) {
            generator.writeNumber(number);
        } else if (value instanceof BigDecimal number) {
            generator.writeNumber(number);
        } else if (value instanceof Number number) {
            generator.writeNumber(number.doubleValue());
        } else {
            generator.writeString(value.toString());
        }
    }
}
