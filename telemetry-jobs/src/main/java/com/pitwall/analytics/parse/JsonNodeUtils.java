package com.pitwall.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Shared JSON helper methods for reading optional feed fields with safe defaults.
 */
public final class JsonNodeUtils {
    private static final Pattern SLOT_KEY = Pattern.compile("^\\d{1,6}$");

    private JsonNodeUtils() {}

    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    public static String asNullableText(JsonNode node) {
        if (isAbsent(node) || node.isContainerNode()) {
            return null;
        }
        String value = node.asText();
        return value == null || value.isEmpty() ? null : value;
    }

    public static Integer asNullableInt(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToInt() ? node.asInt() : null;
        }
        if (node.isNumber()) {
            double value = node.asDouble();
            return Double.isFinite(value) && value == Math.rint(value)
                    && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE ? (int) value : null;
        }
        if (node.isTextual()) {
            String raw = node.asText().trim();
            if (raw.isEmpty()) {
                return null;
            }
            try {
                return Integer.parseInt(raw);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    public static Double asNullableDouble(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isNumber()) {
            double value = node.asDouble();
            return Double.isFinite(value) ? value : null;
        }
        if (node.isTextual()) {
            return TimingValueParser.parsePlainNumber(node.asText());
        }
        return null;
    }

    /**
     * JavaScript-style truthiness for feed flags: {@code true}, non-zero numbers and non-empty strings.
     */
    public static boolean isTruthy(JsonNode node) {
        if (isAbsent(node)) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.asDouble() != 0.0;
        }
        if (node.isTextual()) {
            return !node.asText().isEmpty();
        }
        return true;
    }

    public static Instant parseInstant(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    /**
     * Elements of an array, or values of an index-keyed object in slot order ("0", "1", ...) followed
     * by any non-numeric keys in insertion order. Anything else yields an empty list.
     */
    public static List<JsonNode> indexedValues(JsonNode container) {
        List<JsonNode> out = new ArrayList<>();
        if (container == null) {
            return out;
        }
        if (container.isArray()) {
            container.forEach(out::add);
            return out;
        }
        if (!container.isObject()) {
            return out;
        }
        TreeMap<Integer, JsonNode> slots = new TreeMap<>();
        List<JsonNode> others = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = container.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (SLOT_KEY.matcher(field.getKey()).matches()) {
                slots.put(Integer.parseInt(field.getKey()), field.getValue());
            } else {
                others.add(field.getValue());
            }
        }
        out.addAll(slots.values());
        out.addAll(others);
        return out;
    }
}
