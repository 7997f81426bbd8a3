package com.syntaxlens.core.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only node of a parsed syntax tree.
 *
 * <p>A node carries a type discriminant (e.g., {@code "FunctionDeclaration"}) and an
 * ordered set of named fields. Field values are one of:
 * <ul>
 *   <li>{@link SyntaxNode} - a nested object</li>
 *   <li>{@link List} - a sequence whose elements follow these same rules</li>
 *   <li>{@link String}, {@link Number} or {@link Boolean} - a scalar</li>
 *   <li>{@code null}</li>
 * </ul>
 *
 * <p>Helper objects that have no discriminant in the source tree (source locations,
 * for instance) are nodes with an empty type. They still count as object descents
 * for depth measurements.
 *
 * <p>Instances are built by the grammar adapters and shared read-only by every
 * extractor; nothing in the engine mutates a tree after it is built.
 */
public final class SyntaxNode {

    private final String type;
    private final Map<String, Object> fields;

    private SyntaxNode(String type, Map<String, Object> fields) {
        this.type = type;
        this.fields = fields;
    }

    /**
     * Creates a node. Lists among the field values are copied so the tree cannot change
     * through references held by the caller.
     *
     * @param type type discriminant; null is stored as the empty string
     * @param fields field values in source order (without the type itself)
     * @return new node
     */
    public static SyntaxNode of(String type, Map<String, ?> fields) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((name, value) -> copy.put(
                Objects.requireNonNull(name, "field name must not be null"), freeze(value)));
        }
        return new SyntaxNode(type != null ? type : "", Collections.unmodifiableMap(copy));
    }

    private static Object freeze(Object value) {
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(freeze(item));
            }
            return Collections.unmodifiableList(items);
        }
        return value;
    }

    public String type() {
        return type;
    }

    /**
     * @return true if this node carries a type discriminant
     */
    public boolean hasType() {
        return !type.isEmpty();
    }

    public boolean is(String nodeType) {
        return type.equals(nodeType);
    }

    /**
     * @return unmodifiable view of all fields in source order
     */
    public Map<String, Object> fields() {
        return fields;
    }

    public boolean has(String name) {
        return fields.get(name) != null;
    }

    public Object get(String name) {
        return fields.get(name);
    }

    /**
     * @param name field name
     * @return the nested node, or null if absent or not an object
     */
    public SyntaxNode node(String name) {
        return fields.get(name) instanceof SyntaxNode child ? child : null;
    }

    /**
     * @param name field name
     * @return the list value, or an empty list if absent or not a list
     */
    public List<Object> list(String name) {
        if (fields.get(name) instanceof List<?> list) {
            @SuppressWarnings("unchecked")
            List<Object> items = (List<Object>) list;
            return items;
        }
        return List.of();
    }

    /**
     * @param name field name
     * @return only the object elements of a list field, in order
     */
    public List<SyntaxNode> nodes(String name) {
        List<SyntaxNode> result = new ArrayList<>();
        for (Object item : list(name)) {
            if (item instanceof SyntaxNode child) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * @param name field name
     * @return the string value, or null if absent or not a string
     */
    public String string(String name) {
        return fields.get(name) instanceof String value ? value : null;
    }

    /**
     * @param name field name
     * @return the boolean value; false if absent or not a boolean
     */
    public boolean bool(String name) {
        return fields.get(name) instanceof Boolean value && value;
    }

    /**
     * Reads {@code name} of a nested node, the common ESTree shape for identifiers.
     *
     * @param field field holding the nested node (e.g., "id")
     * @return {@code field.name}, or null if either step is missing
     */
    public String nestedName(String field) {
        SyntaxNode child = node(field);
        return child != null ? child.string("name") : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SyntaxNode other)) {
            return false;
        }
        return type.equals(other.type) && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, fields);
    }

    @Override
    public String toString() {
        return hasType() ? type + fields.keySet() : "{" + String.join(", ", fields.keySet()) + "}";
    }
}
