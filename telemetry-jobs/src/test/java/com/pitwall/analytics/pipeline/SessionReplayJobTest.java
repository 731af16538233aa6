package com.pitwall.analytics.pipeline;

import com.pitwall.analytics.analysis.AnalysisIndex;
import com.pitwall.analytics.capture.SessionCaptureReader;
import com.pitwall.analytics.ingest.TimingIngestionService;
import com.pitwall.analytics.model.AnalysisPayloads;
import com.pitwall.analytics.model.RawEvent;
import com.pitwall.analytics.parse.EventNormalizer;
import com.pitwall.analytics.registry.TopicRegistry;
import com.pitwall.analytics.registry.TopicRegistryLoader;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionReplayJobTest {

    private static Path fixture() throws URISyntaxException {
        return Paths.get(SessionReplayJobTest.class.getClassLoader().getResource("captures/sample_live.jsonl").toURI());
    }

    @Test
    void replaysCaptureIntoAnalysisIndex() throws Exception {
        TopicRegistry registry = TopicRegistryLoader.loadDefault();
        ReplayConfig config = ReplayConfig.fromEnv(Map.of());
        List<RawEvent> events = new SessionCaptureReader(registry).read(fixture());
        TimingIngestionService service = new TimingIngestionService(new EventNormalizer(registry));

        AnalysisIndex index = SessionReplayJob.replay(service, events, config);

        assertEquals(7, service.eventCount());
        assertEquals(List.of(1, 2), index.lapNumbers());
        assertTrue(service.unmodeledProcessors().containsKey("OvertakeSeries"));
        assertEquals(1250, service.processors().position.entryFor("1").get("X").asInt());
        assertFalse(service.latest("TrackStatus").has("_kf"));

        AnalysisPayloads.SessionSummary summary = index.summary();
        assertEquals("1", summary.winnerNumber);
        assertEquals("Max VERSTAPPEN", summary.winnerName);
        assertEquals("1:31.200", summary.fastestLapTime);
        assertEquals(57, summary.totalLaps);

        assertEquals(0.0, index.recordAt("1", 2).gapToLeaderSec, 1e-9);
        assertEquals(400.0, index.compareDrivers("44", "1").summary.avgDeltaMs, 1e-9);
        assertNull(index.getUndercutWindow("44", "1", config.pitLossMs).lapsToCover);
        assertEquals(23.3, index.simulateRejoin("44", config.pitLossMs, 2).projectedGapToLeaderSec, 1e-9);
    }

    @Test
    void highlightsHandleFullAndEmptySessions() throws Exception {
        ReplayConfig config = ReplayConfig.fromEnv(Map.of());
        TimingIngestionService service = new TimingIngestionService();
        List<RawEvent> events = new SessionCaptureReader(TopicRegistryLoader.loadDefault()).read(fixture());
        AnalysisIndex index = SessionReplayJob.replay(service, events, config);

        assertDoesNotThrow(() -> SessionReplayJob.logHighlights(index, config));
        assertDoesNotThrow(() -> SessionReplayJob.logHighlights(new TimingIngestionService().buildIndex(), config));
    }
}
