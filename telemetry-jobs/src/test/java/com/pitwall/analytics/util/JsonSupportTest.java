package com.pitwall.analytics.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.pitwall.analytics.model.AnalysisPayloads;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonSupportTest {

    @Test
    void serializesResultPayloadsByPublicFields() {
        AnalysisPayloads.PitEvent event = new AnalysisPayloads.PitEvent();
        event.driver = "44";
        event.lap = 18;
        event.type = AnalysisPayloads.PitEventType.PIT_IN;

        String json = JsonSupport.toJson(event);

        assertTrue(json.contains("\"driver\":\"44\""));
        assertTrue(json.contains("\"lap\":18"));
        assertTrue(json.contains("\"type\":\"PIT_IN\""));
    }

    @Test
    void parseReadsTreesAndRejectsBrokenText() throws Exception {
        assertEquals(57, JsonSupport.parse("{\"TotalLaps\":57}").get("TotalLaps").asInt());
        assertTrue(JsonSupport.parse("  ").isMissingNode());
        assertThrows(JsonProcessingException.class, () -> JsonSupport.parse("{\"TotalLaps\":"));
    }
}
