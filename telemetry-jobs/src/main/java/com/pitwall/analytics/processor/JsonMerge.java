package com.pitwall.analytics.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Deep merge over Jackson trees. Recurses only where both sides are objects; any other incoming
 * value, arrays included, replaces the existing one wholesale.
 */
public final class JsonMerge {
    private JsonMerge() {}

    public static void mergeDeep(ObjectNode target, ObjectNode patch) {
        Iterator<Map.Entry<String, JsonNode>> fields = patch.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode incoming = field.getValue();
            JsonNode existing = target.get(key);
            if (incoming.isObject() && existing != null && existing.isObject()) {
                mergeDeep((ObjectNode) existing, (ObjectNode) incoming);
            } else {
                target.set(key, incoming.deepCopy());
            }
        }
    }

    /**
     * Shallow overlay: each top-level key of {@code patch} replaces the key in {@code target}.
     */
    public static void overlay(ObjectNode target, ObjectNode patch) {
        Iterator<Map.Entry<String, JsonNode>> fields = patch.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            target.set(field.getKey(), field.getValue().deepCopy());
        }
    }
}
