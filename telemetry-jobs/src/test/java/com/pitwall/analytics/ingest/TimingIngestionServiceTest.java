package com.pitwall.analytics.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.pitwall.analytics.analysis.AnalysisIndex;
import com.pitwall.analytics.model.NormalizedEvent;
import com.pitwall.analytics.parse.MalformedEventException;
import com.pitwall.analytics.util.JsonSupport;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimingIngestionServiceTest {
    private static final Instant T0 = Instant.parse("2024-03-02T15:00:00Z");

    @Test
    void eventsReachTheirDedicatedProcessor() throws Exception {
        TimingIngestionService service = new TimingIngestionService();

        service.enqueue("DriverList", "{\"1\":{\"Tla\":\"VER\"}}", T0);
        service.enqueue("TimingData", "{\"Lines\":{\"1\":{\"NumberOfLaps\":1,\"Position\":\"1\"}}}", T0.plusSeconds(95));

        assertEquals("VER", service.processors().driverList.nameFor("1"));
        assertEquals(1, service.processors().timingData.lapNumbers().size());
        assertNull(service.processors().trackStatus.latest());
        assertEquals(2, service.eventCount());
        assertEquals(T0.plusSeconds(95), service.lastEventTimestamp());
    }

    @Test
    void compressedAliasLandsOnCanonicalTopic() {
        TimingIngestionService service = new TimingIngestionService();
        JsonNode batch = json("{'Position':[{'Timestamp':'t1','Entries':{'44':{'X':1}}}]}");

        NormalizedEvent event = service.enqueue("Position.z", batch, T0);

        assertEquals("Position", event.topic);
        assertEquals(1, service.processors().position.entryFor("44").get("X").asInt());
        assertSame(service.processors().position.latest(), service.latest("Position.z"));
    }

    @Test
    void unmodeledTopicGetsGenericMergeState() {
        TimingIngestionService service = new TimingIngestionService();

        service.enqueue("OvertakeSeries", json("{'Overtakes':{'1':{'Count':1}}}"), T0);
        service.enqueue("OvertakeSeries", json("{'Overtakes':{'44':{'Count':2}}}"), T0.plusSeconds(1));

        assertTrue(service.unmodeledProcessors().containsKey("OvertakeSeries"));
        JsonNode state = service.latest("OvertakeSeries");
        assertEquals(1, state.path("Overtakes").path("1").path("Count").asInt());
        assertEquals(2, state.path("Overtakes").path("44").path("Count").asInt());
        assertNull(service.latest("NeverSeen"));
    }

    @Test
    void unparseableLapTimesDoNotHaltIngestionOrIndexing() {
        TimingIngestionService service = new TimingIngestionService();
        String overflowing = "99999999999999999999:00.000";

        service.enqueue("TimingData", json("{'Lines':{'1':{'NumberOfLaps':1,'Position':'1',"
                + "'BestLapTime':{'Value':'" + overflowing + "'},'LastLapTime':{'Value':'" + overflowing + "'}}}}"), T0);
        service.enqueue("TimingData", json("{'Lines':{'1':{'NumberOfLaps':2,'LastLapTime':{'Value':'1:31.000'}}}}"),
                T0.plusSeconds(91));

        assertNull(service.processors().timingData.bestLap("1"));
        AnalysisIndex index = service.buildIndex();
        assertNull(index.recordAt("1", 1).lapTimeMs);
        assertEquals(91_000.0, index.recordAt("1", 2).lapTimeMs, 1e-9);
    }

    @Test
    void malformedPayloadIsRejectedWithoutTouchingState() throws Exception {
        TimingIngestionService service = new TimingIngestionService();
        service.enqueue("TrackStatus", "{\"Status\":\"1\",\"Message\":\"AllClear\"}", T0);

        MalformedEventException ex = assertThrows(MalformedEventException.class,
                () -> service.enqueue("TrackStatus", "{\"Status\":", T0.plusSeconds(1)));

        assertEquals("TrackStatus", ex.eventType());
        assertEquals(1, service.eventCount());
        assertEquals("1", service.latest("TrackStatus").get("Status").asText());
    }

    @Test
    void serviceInstancesDoNotShareState() {
        TimingIngestionService first = new TimingIngestionService();
        TimingIngestionService second = new TimingIngestionService();

        first.enqueue("LapCount", json("{'CurrentLap':3,'TotalLaps':57}"), T0);

        assertNotNull(first.latest("LapCount"));
        assertNull(second.latest("LapCount"));
        assertEquals(0, second.eventCount());
    }

    private static JsonNode json(String singleQuoted) {
        try {
            return JsonSupport.MAPPER.readTree(singleQuoted.replace('\'', '"'));
        } catch (com.fasterxml.jackson.core.JsonProcessingException ex) {
            throw new IllegalArgumentException(ex);
        }
    }
}
