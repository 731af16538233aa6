package com.pitwall.analytics.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pitwall.analytics.analysis.AnalysisIndex;
import com.pitwall.analytics.analysis.RaceEngineerMetrics;
import com.pitwall.analytics.analysis.ResolvedCursor;
import com.pitwall.analytics.analysis.TimeCursor;
import com.pitwall.analytics.capture.SessionCaptureReader;
import com.pitwall.analytics.ingest.TimingIngestionService;
import com.pitwall.analytics.model.AnalysisPayloads;
import com.pitwall.analytics.model.LapRecord;
import com.pitwall.analytics.model.RawEvent;
import com.pitwall.analytics.parse.EventNormalizer;
import com.pitwall.analytics.registry.TopicRegistry;
import com.pitwall.analytics.registry.TopicRegistryLoader;
import com.pitwall.analytics.util.BuildMetadata;
import com.pitwall.analytics.util.JsonSupport;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Replays a recorded session capture through ingestion and logs the headline analysis.
 */
public class SessionReplayJob {
    private static final Logger LOG = LoggerFactory.getLogger(SessionReplayJob.class);

    public static void main(String[] args) throws Exception {
        ReplayConfig config = ReplayConfig.fromEnv();
        Path capture = Paths.get(args.length > 0 ? args[0] : config.capturePath);
        LOG.info("Starting session replay: build={}, {}", BuildMetadata.current().identity(), config);

        TopicRegistry registry = TopicRegistryLoader.loadDefault();
        Set<String> streams = registry.streamNamesForSessionKind(config.sessionKind);
        LOG.info("Streams for session kind {}: {}", config.sessionKind, streams);

        List<RawEvent> events = new SessionCaptureReader(registry, config.maxInflatedBytes).read(capture);
        TimingIngestionService service = new TimingIngestionService(new EventNormalizer(registry));
        AnalysisIndex index = replay(service, events, config);
        logHighlights(index, config);
    }

    static AnalysisIndex replay(TimingIngestionService service, List<RawEvent> events, ReplayConfig config) {
        for (RawEvent event : events) {
            service.enqueue(event);
        }
        AnalysisIndex index = service.buildIndex(config.trafficThresholds);
        LOG.info("Replay finished: events={} laps={} drivers={} unmodeledTopics={}",
                service.eventCount(), index.lapNumbers().size(), index.drivers().size(),
                service.unmodeledProcessors().keySet());
        return index;
    }

    static void logHighlights(AnalysisIndex index, ReplayConfig config) {
        AnalysisPayloads.SessionSummary summary = index.summary();
        LOG.info("Session summary: winner={} ({}), fastestLap={} by {} ({}), totalLaps={}",
                summary.winnerName, summary.winnerNumber, summary.fastestLapTime,
                summary.fastestLapName, summary.fastestLapNumber, summary.totalLaps);

        for (AnalysisPayloads.PitEvent event : index.getPitEvents()) {
            LOG.info("Pit event: driver={} lap={} type={}", event.driver, event.lap, event.type.label());
        }
        LOG.info("Pit lane times: {}", JsonSupport.toJson(
                index.getPitLaneTimeStats(RaceEngineerMetrics.METHOD_MEDIAN, null, null, null)));

        ResolvedCursor latest = index.resolveAsOf(TimeCursor.latest());
        if (latest.lap == null) {
            return;
        }
        List<LapRecord> order = new ArrayList<>(index.recordsForLap(latest.lap).values());
        order.removeIf(record -> record.position == null);
        order.sort((a, b) -> Integer.compare(a.position, b.position));
        if (order.size() < 2) {
            return;
        }
        // Leader against the car in second.
        String leader = order.get(0).driver;
        String chaser = order.get(1).driver;
        AnalysisPayloads.UndercutWindow undercut = index.getUndercutWindow(chaser, leader, config.pitLossMs);
        LOG.info("Undercut {} on {}: avgDeltaMs={} lapsToCover={}",
                chaser, leader, undercut.avgDeltaMs, undercut.lapsToCover);
        AnalysisPayloads.RejoinProjection rejoin = index.simulateRejoin(chaser, config.pitLossMs, latest.lap);
        LOG.info("Rejoin {} as of lap {}: gapToLeaderSec={} projected={}",
                chaser, rejoin.asOfLap, rejoin.gapToLeaderSec, rejoin.projectedGapToLeaderSec);
    }
}
