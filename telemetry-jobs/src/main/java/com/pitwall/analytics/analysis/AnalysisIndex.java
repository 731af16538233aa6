package com.pitwall.analytics.analysis;

import com.fasterxml.jackson.databind.JsonNode;

import com.pitwall.analytics.ingest.ProcessorSet;
import com.pitwall.analytics.model.AnalysisPayloads;
import com.pitwall.analytics.model.LapRecord;
import com.pitwall.analytics.model.TrafficLabel;
import com.pitwall.analytics.parse.JsonNodeUtils;
import com.pitwall.analytics.parse.TimingValueParser;
import com.pitwall.analytics.processor.TimingDataProcessor;
import com.pitwall.analytics.processor.TrackStatusProcessor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Read-only lap-by-lap view of a session, built once from the processors' state.
 *
 * <p>The index copies what it needs at build time and never observes later ingestion; build a new
 * one to see new events. Safe for concurrent readers.</p>
 */
public final class AnalysisIndex {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(AnalysisIndex.class);

    private final List<Integer> lapNumbers;
    private final List<String> drivers;
    private final Map<String, List<LapRecord>> byDriver;
    private final Map<Integer, Map<String, LapRecord>> byLap;
    private final Map<Integer, Instant> lapTimes;
    private final Map<String, String> driverNames;
    private final JsonNode pitLaneState;
    private final AnalysisPayloads.SessionSummary summary;

    private AnalysisIndex(
            List<Integer> lapNumbers,
            List<String> drivers,
            Map<String, List<LapRecord>> byDriver,
            Map<Integer, Map<String, LapRecord>> byLap,
            Map<Integer, Instant> lapTimes,
            Map<String, String> driverNames,
            JsonNode pitLaneState,
            AnalysisPayloads.SessionSummary summary) {
        this.lapNumbers = lapNumbers;
        this.drivers = drivers;
        this.byDriver = byDriver;
        this.byLap = byLap;
        this.lapTimes = lapTimes;
        this.driverNames = driverNames;
        this.pitLaneState = pitLaneState;
        this.summary = summary;
    }

    public static AnalysisIndex build(ProcessorSet processors) {
        return build(processors, TrafficThresholds.DEFAULTS);
    }

    public static AnalysisIndex build(ProcessorSet processors, TrafficThresholds thresholds) {
        TimingDataProcessor timing = processors.timingData;
        TrackStatusProcessor trackStatus = processors.trackStatus;
        JsonNode timingApp = processors.timingAppData.latest();

        Map<String, List<LapRecord>> byDriver = new LinkedHashMap<>();
        Map<Integer, Map<String, LapRecord>> byLap = new TreeMap<>();
        Map<Integer, Instant> lapTimes = new HashMap<>();
        Set<String> drivers = new LinkedHashSet<>();
        List<Integer> lapNumbers = timing.lapNumbers();

        for (Integer lap : lapNumbers) {
            Map<String, TimingDataProcessor.LapSnapshot> snapshots = timing.lapSnapshots(lap);
            Map<String, JsonNode> lines = new LinkedHashMap<>();
            for (TimingDataProcessor.LapSnapshot snapshot : snapshots.values()) {
                lines.put(snapshot.driver, snapshot.line);
            }
            List<Map.Entry<String, JsonNode>> ordered = TimingLineSemantics.orderedLines(lines);
            Map<String, Double> gapBehind = new HashMap<>();
            for (int i = 0; i < ordered.size(); i++) {
                JsonNode following = i + 1 < ordered.size() ? ordered.get(i + 1).getValue() : null;
                gapBehind.put(ordered.get(i).getKey(), following == null
                        ? null
                        : TimingValueParser.parseIntervalSeconds(following.path("IntervalToPositionAhead").get("Value")));
            }

            Map<String, LapRecord> lapRecords = new LinkedHashMap<>();
            for (TimingDataProcessor.LapSnapshot snapshot : snapshots.values()) {
                drivers.add(snapshot.driver);
                Instant at = snapshot.timestamp;
                if (at != null) {
                    lapTimes.merge(lap, at, (current, candidate) -> candidate.isBefore(current) ? candidate : current);
                }
                LapRecord record = toRecord(snapshot, ordered, gapBehind.get(snapshot.driver),
                        trackStatus, timingApp, thresholds);
                lapRecords.put(snapshot.driver, record);
                byDriver.computeIfAbsent(snapshot.driver, driver -> new ArrayList<>()).add(record);
            }
            byLap.put(lap, Collections.unmodifiableMap(lapRecords));
        }

        Map<String, List<LapRecord>> frozen = new LinkedHashMap<>();
        for (Map.Entry<String, List<LapRecord>> entry : byDriver.entrySet()) {
            entry.getValue().sort((a, b) -> Integer.compare(a.lap, b.lap));
            frozen.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));
        }

        Map<String, String> names = new HashMap<>();
        for (String number : processors.driverList.driverNumbers()) {
            String name = processors.driverList.nameFor(number);
            if (name != null) {
                names.put(number, name);
            }
        }
        JsonNode pitLane = processors.pitLaneTimeCollection.latest();

        AnalysisIndex index = new AnalysisIndex(
                Collections.unmodifiableList(new ArrayList<>(lapNumbers)),
                Collections.unmodifiableList(new ArrayList<>(drivers)),
                Collections.unmodifiableMap(frozen),
                Collections.unmodifiableMap(byLap),
                Collections.unmodifiableMap(lapTimes),
                Collections.unmodifiableMap(names),
                pitLane == null ? null : pitLane.deepCopy(),
                SessionSummaryDerivation.fromProcessors(processors, names, lapTimes));
        LOG.debug("Built analysis index: laps={} drivers={}", index.lapNumbers.size(), index.drivers.size());
        return index;
    }

    private static LapRecord toRecord(
            TimingDataProcessor.LapSnapshot snapshot,
            List<Map.Entry<String, JsonNode>> ordered,
            Double gapBehindSec,
            TrackStatusProcessor trackStatus,
            JsonNode timingApp,
            TrafficThresholds thresholds) {
        JsonNode line = snapshot.line;
        JsonNode track = snapshot.timestamp != null ? trackStatus.stateAt(snapshot.timestamp) : trackStatus.latest();
        LapRecord.TrackStatusSnapshot status = null;
        boolean green = true;
        if (track != null) {
            String statusText = JsonNodeUtils.asNullableText(track.get("Status"));
            String message = JsonNodeUtils.asNullableText(track.get("Message"));
            green = TrackStatusSemantics.isGreen(statusText, message);
            status = new LapRecord.TrackStatusSnapshot(statusText, message, green);
        }

        Long lapTime = TimingLineSemantics.extractLapTimeMs(line);
        Double lapTimeMs = lapTime == null ? null : lapTime.doubleValue();
        Double intervalToAheadSec = TimingValueParser.parseIntervalSeconds(line.path("IntervalToPositionAhead").get("Value"));
        Integer position = TimingValueParser.parsePosition(line.get("Position"));
        if (position == null) {
            position = TimingValueParser.parsePosition(line.get("Line"));
        }
        TrafficLabel traffic = TrafficClassifier.classify(intervalToAheadSec, gapBehindSec, lapTimeMs, green, thresholds);

        return new LapRecord(
                snapshot.driver,
                snapshot.lap,
                snapshot.timestamp,
                lapTimeMs,
                TimingLineSemantics.smartGapToLeaderSeconds(ordered, snapshot.driver),
                intervalToAheadSec,
                position,
                traffic,
                status,
                JsonNodeUtils.isTruthy(line.get("IsPitLap")),
                JsonNodeUtils.isTruthy(line.get("PitIn")),
                JsonNodeUtils.isTruthy(line.get("PitOut")),
                JsonNodeUtils.isTruthy(line.get("InPit")),
                stintFor(timingApp, snapshot.driver, snapshot.lap));
    }

    /**
     * Stint covering {@code lap}: laps {@code StartLaps + 1} through {@code StartLaps + TotalLaps}.
     * Falls back to the driver's last stint when none covers it.
     */
    static LapRecord.StintInfo stintFor(JsonNode timingApp, String driver, int lap) {
        if (timingApp == null) {
            return null;
        }
        JsonNode stints = timingApp.path("Lines").path(driver).get("Stints");
        if (stints == null || !stints.isContainerNode() || stints.size() == 0) {
            return null;
        }
        List<JsonNode> items = JsonNodeUtils.indexedValues(stints);
        JsonNode match = null;
        for (JsonNode stint : items) {
            Double start = numberOrZero(stint.get("StartLaps"));
            Double total = numberOrZero(stint.get("TotalLaps"));
            if (start == null || total == null) {
                continue;
            }
            if (lap >= start + 1 && lap <= start + total) {
                match = stint;
                break;
            }
        }
        if (match == null) {
            match = items.get(items.size() - 1);
        }
        return new LapRecord.StintInfo(
                JsonNodeUtils.asNullableText(match.get("Compound")),
                JsonNodeUtils.asNullableInt(match.get("TyreAge")),
                JsonNodeUtils.asNullableInt(match.get("Stint")));
    }

    private static Double numberOrZero(JsonNode node) {
        return JsonNodeUtils.isAbsent(node) ? Double.valueOf(0.0) : JsonNodeUtils.asNullableDouble(node);
    }

    public List<Integer> lapNumbers() {
        return lapNumbers;
    }

    public List<String> drivers() {
        return drivers;
    }

    public List<LapRecord> lapsFor(String driver) {
        List<LapRecord> records = byDriver.get(driver);
        return records == null ? Collections.emptyList() : records;
    }

    public LapRecord recordAt(String driver, int lap) {
        return recordsForLap(lap).get(driver);
    }

    public Map<String, LapRecord> recordsForLap(int lap) {
        Map<String, LapRecord> records = byLap.get(lap);
        return records == null ? Collections.emptyMap() : records;
    }

    /** Representative timestamp per lap: the earliest snapshot recorded for it. */
    public Map<Integer, Instant> lapTimes() {
        return lapTimes;
    }

    public String driverName(String driver) {
        return driverNames.get(driver);
    }

    public AnalysisPayloads.SessionSummary summary() {
        return summary;
    }

    public ResolvedCursor resolveAsOf(TimeCursor cursor) {
        return TimeCursorResolver.resolve(lapTimes, lapNumbers, cursor);
    }

    /**
     * One event per pit-flagged record, ordered by driver then lap. Pit-in wins over pit-out, which
     * wins over the generic pit-lap flag.
     */
    public List<AnalysisPayloads.PitEvent> getPitEvents() {
        List<AnalysisPayloads.PitEvent> events = new ArrayList<>();
        for (Map.Entry<String, List<LapRecord>> entry : byDriver.entrySet()) {
            for (LapRecord record : entry.getValue()) {
                if (!record.pit) {
                    continue;
                }
                AnalysisPayloads.PitEvent event = new AnalysisPayloads.PitEvent();
                event.driver = entry.getKey();
                event.lap = record.lap;
                if (record.pitIn) {
                    event.type = AnalysisPayloads.PitEventType.PIT_IN;
                } else if (record.pitOut) {
                    event.type = AnalysisPayloads.PitEventType.PIT_OUT;
                } else {
                    event.type = AnalysisPayloads.PitEventType.PIT;
                }
                events.add(event);
            }
        }
        return events;
    }

    public List<AnalysisPayloads.PositionChange> getPositionChanges() {
        List<AnalysisPayloads.PositionChange> changes = new ArrayList<>();
        for (Map.Entry<String, List<LapRecord>> entry : byDriver.entrySet()) {
            List<LapRecord> records = entry.getValue();
            for (int i = 1; i < records.size(); i++) {
                LapRecord previous = records.get(i - 1);
                LapRecord current = records.get(i);
                if (Objects.equals(previous.position, current.position)) {
                    continue;
                }
                AnalysisPayloads.PositionChange change = new AnalysisPayloads.PositionChange();
                change.driver = entry.getKey();
                change.fromLap = previous.lap;
                change.toLap = current.lap;
                change.fromPosition = previous.position;
                change.toPosition = current.position;
                changes.add(change);
            }
        }
        return changes;
    }

    public AnalysisPayloads.StintPace getStintPace(String driver) {
        return getStintPace(driver, null, null);
    }

    /**
     * Average lap time and least-squares trend over the driver's timed laps in the optional window.
     * The slope is {@code null} below two samples or when every sample is on the same lap.
     */
    public AnalysisPayloads.StintPace getStintPace(String driver, Integer startLap, Integer endLap) {
        List<LapRecord> records = timedLaps(driver, startLap, endLap);
        AnalysisPayloads.StintPace pace = new AnalysisPayloads.StintPace();
        pace.driver = driver;
        pace.samples = records.size();
        if (records.isEmpty()) {
            return pace;
        }
        double sumX = 0.0;
        double sumY = 0.0;
        for (LapRecord record : records) {
            sumX += record.lap;
            sumY += record.lapTimeMs;
            pace.laps.add(record.lap);
        }
        double meanX = sumX / records.size();
        double meanY = sumY / records.size();
        pace.avgLapMs = meanY;
        if (records.size() < 2) {
            return pace;
        }
        double covariance = 0.0;
        double variance = 0.0;
        for (LapRecord record : records) {
            double dx = record.lap - meanX;
            covariance += dx * (record.lapTimeMs - meanY);
            variance += dx * dx;
        }
        pace.slopeMsPerLap = variance == 0.0 ? null : covariance / variance;
        return pace;
    }

    public AnalysisPayloads.DriverComparison compareDrivers(String driverA, String driverB) {
        return compareDrivers(driverA, driverB, null, null);
    }

    /**
     * Per-lap delta {@code A - B} over laps where both drivers have a lap time; negative means A was
     * faster. The summary is {@code null} when the drivers share no timed lap.
     */
    public AnalysisPayloads.DriverComparison compareDrivers(String driverA, String driverB, Integer startLap, Integer endLap) {
        AnalysisPayloads.DriverComparison comparison = new AnalysisPayloads.DriverComparison();
        comparison.driverA = driverA;
        comparison.driverB = driverB;

        Map<Integer, Double> timesB = new HashMap<>();
        for (LapRecord record : timedLaps(driverB, startLap, endLap)) {
            timesB.put(record.lap, record.lapTimeMs);
        }
        double total = 0.0;
        for (LapRecord record : timedLaps(driverA, startLap, endLap)) {
            Double other = timesB.get(record.lap);
            if (other == null) {
                continue;
            }
            AnalysisPayloads.LapDelta delta = new AnalysisPayloads.LapDelta();
            delta.lap = record.lap;
            delta.deltaMs = record.lapTimeMs - other;
            comparison.laps.add(delta);
            total += delta.deltaMs;
        }
        if (!comparison.laps.isEmpty()) {
            comparison.summary = new AnalysisPayloads.ComparisonSummary();
            comparison.summary.avgDeltaMs = total / comparison.laps.size();
        }
        return comparison;
    }

    /**
     * Laps driver A needs to recover {@code pitLossMs} from its average pace advantage over B.
     * {@code null} when A has no advantage, the drivers share no laps, or the pit loss is unknown.
     */
    public AnalysisPayloads.UndercutWindow getUndercutWindow(String driverA, String driverB, Double pitLossMs) {
        AnalysisPayloads.DriverComparison comparison = compareDrivers(driverA, driverB);
        AnalysisPayloads.UndercutWindow window = new AnalysisPayloads.UndercutWindow();
        window.driverA = driverA;
        window.driverB = driverB;
        window.pitLossMs = pitLossMs;
        window.avgDeltaMs = comparison.summary == null ? null : comparison.summary.avgDeltaMs;
        if (window.avgDeltaMs == null || window.avgDeltaMs >= 0.0 || pitLossMs == null || !Double.isFinite(pitLossMs)) {
            return window;
        }
        window.lapsToCover = pitLossMs / Math.abs(window.avgDeltaMs);
        return window;
    }

    /**
     * Projects the driver's gap to the leader after a stop costing {@code pitLossMs}. An
     * {@code asOfLap} without records resolves to the nearest known lap.
     */
    public AnalysisPayloads.RejoinProjection simulateRejoin(String driver, double pitLossMs, int asOfLap) {
        Integer lap = byLap.containsKey(asOfLap) ? Integer.valueOf(asOfLap) : resolveAsOf(TimeCursor.lap(asOfLap)).lap;
        LapRecord record = lap == null ? null : recordAt(driver, lap);

        AnalysisPayloads.RejoinProjection projection = new AnalysisPayloads.RejoinProjection();
        projection.driver = driver;
        projection.asOfLap = lap;
        projection.lossMs = pitLossMs;
        projection.gapToLeaderSec = record == null ? null : record.gapToLeaderSec;
        projection.projectedGapToLeaderSec = projection.gapToLeaderSec == null
                ? null
                : projection.gapToLeaderSec + pitLossMs / 1000.0;
        return projection;
    }

    public AnalysisPayloads.GapTrainReport getGapTrains(int lap, double thresholdSec, int minCars, boolean requireGreen) {
        return RaceEngineerMetrics.gapTrainsForLap(lap, recordsForLap(lap), thresholdSec, minCars, requireGreen, driverNames::get);
    }

    public AnalysisPayloads.ScVscDeltaReport getScVscDeltas(int startLap, int endLap, String driver, boolean includePitLaps) {
        return RaceEngineerMetrics.scVscDeltas(byLap, startLap, endLap, driver, includePitLaps);
    }

    public AnalysisPayloads.PitLaneTimeStats getPitLaneTimeStats(String method, String driver, Integer startLap, Integer endLap) {
        return RaceEngineerMetrics.pitLaneTimeStats(pitLaneState, method, driver, startLap, endLap, driverNames::get);
    }

    private List<LapRecord> timedLaps(String driver, Integer startLap, Integer endLap) {
        List<LapRecord> out = new ArrayList<>();
        for (LapRecord record : lapsFor(driver)) {
            if (startLap != null && record.lap < startLap) {
                continue;
            }
            if (endLap != null && record.lap > endLap) {
                continue;
            }
            if (record.lapTimeMs != null) {
                out.add(record);
            }
        }
        return out;
    }
}
