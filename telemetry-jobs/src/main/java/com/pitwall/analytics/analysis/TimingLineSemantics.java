package com.pitwall.analytics.analysis;

import com.fasterxml.jackson.databind.JsonNode;

import com.pitwall.analytics.parse.JsonNodeUtils;
import com.pitwall.analytics.parse.TimingValueParser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Field extraction rules for a single timing line and for the running order of a set of lines.
 */
public final class TimingLineSemantics {
    private static final double UNPLACED = 999.0;
    private static final int SECTOR_COUNT = 3;

    private TimingLineSemantics() {}

    /**
     * Lines sorted by {@code Line}, then {@code Position}; lines with neither sort last. Stable for
     * equal keys.
     */
    public static List<Map.Entry<String, JsonNode>> orderedLines(Map<String, JsonNode> lines) {
        List<Map.Entry<String, JsonNode>> ordered = new ArrayList<>(lines.entrySet());
        ordered.sort(Comparator.comparingDouble(entry -> orderKey(entry.getValue())));
        return ordered;
    }

    private static double orderKey(JsonNode line) {
        if (line == null) {
            return UNPLACED;
        }
        JsonNode raw = !JsonNodeUtils.isAbsent(line.get("Line")) ? line.get("Line") : line.get("Position");
        Double value = JsonNodeUtils.asNullableDouble(raw);
        return value == null ? UNPLACED : value;
    }

    /**
     * Lap time of a line: {@code LastLapTime.Value}, then {@code LapTime.Value}, then the sum of the
     * three sector times (previous values preferred). {@code null} when none parses.
     */
    public static Long extractLapTimeMs(JsonNode line) {
        if (line == null) {
            return null;
        }
        Long lastLap = TimingValueParser.parseLapTimeMs(JsonNodeUtils.asNullableText(line.path("LastLapTime").get("Value")));
        if (lastLap != null) {
            return lastLap;
        }
        Long lapTime = TimingValueParser.parseLapTimeMs(JsonNodeUtils.asNullableText(line.path("LapTime").get("Value")));
        if (lapTime != null) {
            return lapTime;
        }
        List<Long> sectors = extractSectorTimesMs(line);
        if (sectors == null) {
            return null;
        }
        long total = 0L;
        for (Long sector : sectors) {
            total += sector;
        }
        return total;
    }

    static List<Long> extractSectorTimesMs(JsonNode line) {
        List<String> values = new ArrayList<>();
        for (JsonNode sector : JsonNodeUtils.indexedValues(line.get("Sectors"))) {
            String previous = JsonNodeUtils.asNullableText(sector.get("PreviousValue"));
            String value = previous != null ? previous : JsonNodeUtils.asNullableText(sector.get("Value"));
            if (value != null) {
                values.add(value);
            }
        }
        if (values.size() < SECTOR_COUNT) {
            return null;
        }
        List<Long> times = new ArrayList<>();
        for (String value : values) {
            Long ms = TimingValueParser.parseLapTimeMs(value);
            if (ms == null) {
                return null;
            }
            times.add(ms);
        }
        return times;
    }

    /**
     * Gap to the leader. Uses the line's own {@code GapToLeader} unless it reads as lapped; a lapped
     * car's gap is rebuilt from the nearest unlapped car ahead plus every interval in between.
     */
    public static Double smartGapToLeaderSeconds(List<Map.Entry<String, JsonNode>> ordered, String driver) {
        int index = -1;
        for (int i = 0; i < ordered.size(); i++) {
            if (ordered.get(i).getKey().equals(driver)) {
                index = i;
                break;
            }
        }
        if (index < 0 || ordered.get(index).getValue() == null) {
            return null;
        }
        JsonNode line = ordered.get(index).getValue();
        String gapText = JsonNodeUtils.asNullableText(line.get("GapToLeader"));
        if (gapText != null && !isLapped(gapText)) {
            return TimingValueParser.parseGapSeconds(gapText);
        }
        if (JsonNodeUtils.asNullableText(line.path("IntervalToPositionAhead").get("Value")) == null) {
            return null;
        }

        int lastUnlapped = -1;
        Double baseGap = null;
        for (int i = index; i >= 0; i--) {
            String candidate = JsonNodeUtils.asNullableText(ordered.get(i).getValue().get("GapToLeader"));
            if (candidate == null || isLapped(candidate)) {
                continue;
            }
            baseGap = TimingValueParser.parseGapSeconds(candidate);
            if (baseGap != null) {
                lastUnlapped = i;
                break;
            }
        }
        if (lastUnlapped < 0) {
            return null;
        }
        double summed = baseGap;
        for (int i = lastUnlapped + 1; i <= index; i++) {
            Double interval = TimingValueParser.parseIntervalSeconds(
                    ordered.get(i).getValue().path("IntervalToPositionAhead").get("Value"));
            if (interval != null) {
                summed += interval;
            }
        }
        return summed;
    }

    private static boolean isLapped(String gapText) {
        return gapText.toLowerCase(Locale.ROOT).contains(" l");
    }
}
