package io.formulaxform.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between Jackson trees and the plain values formulas compute with: {@code Long}, {@code
 * Double}, {@code Boolean}, {@code String}, {@code List}, {@code Map} and {@code null}.
 *
 * <p>Thread-safe; stateless utility class.
 */
public final class JsonValues {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonValues() {}

    /**
     * Converts a JSON node to a formula value.
     *
     * <ul>
     *   <li>{@code null}, {@code NullNode}, {@code MissingNode} → {@code null}
     *   <li>integral numbers → {@code Long} ({@code Double} beyond long range)
     *   <li>other numbers → {@code Double}
     *   <li>arrays and objects → unmodifiable {@code List} and {@code Map}
     * </ul>
     */
    public static Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? node.longValue() : node.doubleValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isArray()) {
            List<Object> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(toValue(item));
            }
            return Collections.unmodifiableList(items);
        }
        if (node.isObject()) {
            return Collections.unmodifiableMap(toBindings(node));
        }
        return node.asText();
    }

    /** The fields of a JSON object as a binding map, in document order. Empty for non-objects. */
    public static Map<String, Object> toBindings(JsonNode record) {
        Map<String, Object> bindings = new LinkedHashMap<>();
        if (record == null || !record.isObject()) {
            return bindings;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            bindings.put(field.getKey(), toValue(field.getValue()));
        }
        return bindings;
    }

    /** Converts a formula result back to a JSON node. Unknown types are written as text. */
    public static JsonNode toJson(Object value) {
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        if (value instanceof Boolean b) {
            return NODES.booleanNode(b);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return NODES.numberNode(((Number) value).longValue());
        }
        if (value instanceof BigInteger big) {
            return NODES.numberNode(big);
        }
        if (value instanceof BigDecimal dec) {
            return NODES.numberNode(dec);
        }
        if (value instanceof Number n) {
            return NODES.numberNode(n.doubleValue());
        }
        if (value instanceof List<?> list) {
            ArrayNode array = NODES.arrayNode();
            for (Object item : list) {
                array.add(toJson(item));
            }
            return array;
        }
        if (value instanceof Map<?, ?> map) {
            ObjectNode object = NODES.objectNode();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                object.set(String.valueOf(entry.getKey()), toJson(entry.getValue()));
            }
            return object;
        }
        return NODES.textNode(String.valueOf(value));
    }
}
