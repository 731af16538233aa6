package com.pitwall.analytics.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.pitwall.analytics.model.NormalizedEvent;
import com.pitwall.analytics.parse.JsonNodeUtils;
import com.pitwall.analytics.parse.TimingValueParser;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Timing lines per car. Besides the merged {@code Lines} state it keeps a per-lap trail: whenever a
 * patch carries {@code NumberOfLaps} for a car, a copy of that car's merged line is stored under
 * the lap number. The last such write for a (driver, lap) wins.
 */
public class TimingDataProcessor extends MergeProcessor {
    public static final String TOPIC = "TimingData";

    private final TreeMap<Integer, Map<String, LapSnapshot>> driversByLap = new TreeMap<>();
    private final Map<String, BestLap> bestLaps = new HashMap<>();

    public TimingDataProcessor() {
        super(TOPIC);
    }

    @Override
    protected void apply(NormalizedEvent event) {
        super.apply(event);
        JsonNode patchLines = event.payload == null ? null : event.payload.get("Lines");
        JsonNode mergedLines = state.get("Lines");
        if (patchLines == null || !patchLines.isObject() || mergedLines == null || !mergedLines.isObject()) {
            return;
        }
        JsonNode sessionPart = state.get("SessionPart");

        Iterator<Map.Entry<String, JsonNode>> fields = patchLines.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String driver = field.getKey();
            JsonNode partial = field.getValue();
            JsonNode mergedNode = mergedLines.get(driver);
            if (mergedNode == null || !mergedNode.isObject()) {
                continue;
            }
            ObjectNode merged = (ObjectNode) mergedNode;

            if (!JsonNodeUtils.isAbsent(sessionPart) && !sessionPart.equals(merged.get("SessionPart"))) {
                merged.set("SessionPart", sessionPart.deepCopy());
            }
            updatePitLapFlag(merged, partial);

            JsonNode lapNumber = partial.get("NumberOfLaps");
            if (lapNumber != null && lapNumber.isIntegralNumber()) {
                driversByLap.computeIfAbsent(lapNumber.asInt(), lap -> new LinkedHashMap<>())
                        .put(driver, new LapSnapshot(driver, lapNumber.asInt(), merged.deepCopy(), event.timestamp));
            }

            trackBestLap(driver, merged);
        }
    }

    private static void updatePitLapFlag(ObjectNode merged, JsonNode partial) {
        if (JsonNodeUtils.isTruthy(partial.get("PitOut")) || JsonNodeUtils.isTruthy(partial.get("InPit"))) {
            merged.put("IsPitLap", true);
        } else if (JsonNodeUtils.isTruthy(merged.get("IsPitLap"))
                && !JsonNodeUtils.isTruthy(merged.get("PitOut"))
                && !JsonNodeUtils.isTruthy(merged.get("InPit"))) {
            merged.put("IsPitLap", false);
        }
    }

    private void trackBestLap(String driver, ObjectNode merged) {
        String time = JsonNodeUtils.asNullableText(merged.path("BestLapTime").get("Value"));
        if (time == null) {
            return;
        }
        Long ms = TimingValueParser.parseLapTimeMs(time);
        if (ms == null) {
            return;
        }
        BestLap current = bestLaps.get(driver);
        if (current == null || ms < current.timeMs) {
            bestLaps.put(driver, new BestLap(driver, time, ms));
        }
    }

    public List<Integer> lapNumbers() {
        return new ArrayList<>(driversByLap.keySet());
    }

    /** Snapshots recorded for a lap, in first-seen driver order. */
    public Map<String, LapSnapshot> lapSnapshots(int lap) {
        Map<String, LapSnapshot> drivers = driversByLap.get(lap);
        return drivers == null ? Collections.emptyMap() : Collections.unmodifiableMap(drivers);
    }

    public LapSnapshot lapSnapshot(String driver, int lap) {
        return lapSnapshots(lap).get(driver);
    }

    public List<LapSnapshot> lapHistory(String driver) {
        List<LapSnapshot> history = new ArrayList<>();
        for (Map<String, LapSnapshot> drivers : driversByLap.values()) {
            LapSnapshot snapshot = drivers.get(driver);
            if (snapshot != null) {
                history.add(snapshot);
            }
        }
        return history;
    }

    public BestLap bestLap(String driver) {
        return bestLaps.get(driver);
    }

    public Map<String, BestLap> bestLaps() {
        return Collections.unmodifiableMap(bestLaps);
    }

    /** Merged timing line of a car, or {@code null}. */
    public JsonNode line(String driver) {
        if (state == null) {
            return null;
        }
        JsonNode line = state.path("Lines").get(driver);
        return line != null && line.isObject() ? line : null;
    }

    public static final class LapSnapshot {
        public final String driver;
        public final int lap;
        public final JsonNode line;
        public final Instant timestamp;

        LapSnapshot(String driver, int lap, JsonNode line, Instant timestamp) {
            this.driver = driver;
            this.lap = lap;
            this.line = line;
            this.timestamp = timestamp;
        }
    }

    public static final class BestLap {
        public final String driver;
        public final String time;
        public final long timeMs;

        BestLap(String driver, String time, long timeMs) {
            this.driver = driver;
            this.time = time;
            this.timeMs = timeMs;
        }
    }
}
