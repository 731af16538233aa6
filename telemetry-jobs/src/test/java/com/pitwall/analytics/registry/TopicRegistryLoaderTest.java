package com.pitwall.analytics.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.pitwall.analytics.util.JsonSupport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TopicRegistryLoaderTest {

    @Test
    void loadDefaultRegistryIsSharedAndVersioned() {
        TopicRegistry first = TopicRegistryLoader.loadDefault();

        assertSame(first, TopicRegistryLoader.loadDefault());
        assertEquals("2024.1", first.version());
        assertEquals(20, first.size());
    }

    @Test
    void parseRegistrySkipsBlankTopicsAndReadsAvailability() throws Exception {
        JsonNode root = JsonSupport.MAPPER.readTree("{\"registry_version\":\"t\",\"topics\":["
                + "{\"topic\":\"LapCount\",\"availability\":\"race-only\",\"semantics\":\"replace\"},"
                + "{\"topic\":\"\"},"
                + "{\"topic\":\"CarData\",\"stream_name\":\"CarData.z\",\"aliases\":[\"CarData.z\",\"\"]}]}");

        TopicRegistry registry = TopicRegistryLoader.parseRegistry(root);

        assertEquals(2, registry.size());
        TopicDefinition lapCount = registry.definitionFor("LapCount");
        assertEquals(TopicDefinition.Availability.RACE_ONLY, lapCount.availability());
        assertEquals(TopicDefinition.UpdateSemantics.REPLACE, lapCount.semantics());
        assertEquals("LapCount", lapCount.streamName());
        assertEquals(1, registry.definitionFor("CarData").aliases().size());
        assertEquals(TopicDefinition.UpdateSemantics.PATCH, registry.definitionFor("CarData").semantics());
    }

    @Test
    void invalidRegistryFailsFast() throws Exception {
        assertThrows(IllegalStateException.class,
                () -> TopicRegistryLoader.parseRegistry(JsonSupport.MAPPER.readTree("{\"registry_version\":\"x\"}")));
        assertThrows(IllegalStateException.class,
                () -> TopicRegistryLoader.parseRegistry(JsonSupport.MAPPER.readTree("[]")));
    }

    @Test
    void missingClasspathResourceYieldsNull() {
        assertNull(TopicRegistryLoader.loadFromClasspath("reference/does_not_exist.json"));
    }
}
