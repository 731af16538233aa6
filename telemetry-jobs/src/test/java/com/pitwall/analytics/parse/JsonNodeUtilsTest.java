package com.pitwall.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.pitwall.analytics.util.JsonSupport;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonNodeUtilsTest {

    @Test
    void nullableReadersNeverCoerceAbsenceToZero() {
        assertNull(JsonNodeUtils.asNullableInt(NullNode.getInstance()));
        assertNull(JsonNodeUtils.asNullableInt(MissingNode.getInstance()));
        assertNull(JsonNodeUtils.asNullableInt(TextNode.valueOf("")));
        assertNull(JsonNodeUtils.asNullableInt(DoubleNode.valueOf(1.5)));
        assertEquals(7, JsonNodeUtils.asNullableInt(TextNode.valueOf(" 7 ")));
        assertNull(JsonNodeUtils.asNullableInt(LongNode.valueOf(4_294_967_297L)));
        assertNull(JsonNodeUtils.asNullableInt(DoubleNode.valueOf(3.0e10)));
        assertEquals(57, JsonNodeUtils.asNullableInt(LongNode.valueOf(57L)));
        assertNull(JsonNodeUtils.asNullableDouble(TextNode.valueOf("n/a")));
        assertEquals(1.5, JsonNodeUtils.asNullableDouble(TextNode.valueOf("1.5")), 1e-9);
        assertNull(JsonNodeUtils.asNullableText(JsonSupport.newObject()));
        assertNull(JsonNodeUtils.asNullableText(TextNode.valueOf("")));
    }

    @Test
    void truthinessFollowsFeedFlagConventions() {
        assertTrue(JsonNodeUtils.isTruthy(BooleanNode.TRUE));
        assertTrue(JsonNodeUtils.isTruthy(IntNode.valueOf(1)));
        assertTrue(JsonNodeUtils.isTruthy(TextNode.valueOf("x")));
        assertFalse(JsonNodeUtils.isTruthy(BooleanNode.FALSE));
        assertFalse(JsonNodeUtils.isTruthy(IntNode.valueOf(0)));
        assertFalse(JsonNodeUtils.isTruthy(TextNode.valueOf("")));
        assertFalse(JsonNodeUtils.isTruthy(null));
    }

    @Test
    void indexedValuesOrdersSlotsNumerically() throws Exception {
        JsonNode slots = JsonSupport.MAPPER.readTree("{\"10\":\"c\",\"2\":\"b\",\"0\":\"a\",\"extra\":\"z\"}");

        List<JsonNode> values = JsonNodeUtils.indexedValues(slots);

        assertEquals(4, values.size());
        assertEquals("a", values.get(0).asText());
        assertEquals("b", values.get(1).asText());
        assertEquals("c", values.get(2).asText());
        assertEquals("z", values.get(3).asText());
        assertTrue(JsonNodeUtils.indexedValues(TextNode.valueOf("x")).isEmpty());
    }

    @Test
    void parseInstantReturnsNullForGarbage() {
        assertEquals(Instant.parse("2024-03-02T15:00:00Z"), JsonNodeUtils.parseInstant("2024-03-02T15:00:00Z"));
        assertNull(JsonNodeUtils.parseInstant("yesterday"));
        assertNull(JsonNodeUtils.parseInstant(" "));
    }
}
