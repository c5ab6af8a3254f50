package de.bsommerfeld.scratchdb.agent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Structural summary of a JSON document, stored next to a cached tool result
 * so the agent can write {@code json_extract} paths without reading the
 * payload first.
 *
 * <p>
 * Objects list the shape of each key, arrays carry their length and the shape
 * of their first element. Nesting below {@link #MAX_DEPTH} is reported by
 * type only.
 */
final class JsonShapes {

    static final int MAX_DEPTH = 3;
    static final int MAX_TOP_KEYS = 20;

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonShapes() {
    }

    static ObjectNode infer(JsonNode node) {
        return infer(node, 0);
    }

    private static ObjectNode infer(JsonNode node, int depth) {
        ObjectNode shape = NODES.objectNode();
        shape.put("type", typeOf(node));
        if (depth >= MAX_DEPTH)
            return shape;

        if (node.isObject()) {
            ObjectNode keys = shape.putObject("keys");
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                keys.set(field.getKey(), infer(field.getValue(), depth + 1));
            }
        } else if (node.isArray()) {
            shape.put("length", node.size());
            if (node.size() > 0)
                shape.set("items", infer(node.get(0), depth + 1));
        }
        return shape;
    }

    static String typeOf(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode())
            return "null";
        if (node.isObject())
            return "object";
        if (node.isArray())
            return "array";
        if (node.isTextual())
            return "string";
        if (node.isBoolean())
            return "boolean";
        if (node.isNumber())
            return "number";
        return "unknown";
    }

    /**
     * Keys of the document, or of the first array element when the document
     * is an array of objects.
     */
    static List<String> topKeys(JsonNode node) {
        JsonNode source = node;
        if (node.isArray() && node.size() > 0)
            source = node.get(0);

        List<String> keys = new ArrayList<>();
        if (!source.isObject())
            return keys;
        Iterator<String> names = source.fieldNames();
        while (names.hasNext() && keys.size() < MAX_TOP_KEYS)
            keys.add(names.next());
        return keys;
    }
}
