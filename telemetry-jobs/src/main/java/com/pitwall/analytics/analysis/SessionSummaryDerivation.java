package com.pitwall.analytics.analysis;

import com.fasterxml.jackson.databind.JsonNode;

import com.pitwall.analytics.ingest.ProcessorSet;
import com.pitwall.analytics.model.AnalysisPayloads;
import com.pitwall.analytics.parse.JsonNodeUtils;
import com.pitwall.analytics.parse.TimingValueParser;
import com.pitwall.analytics.processor.TimingDataProcessor;

import java.time.Instant;
import java.util.Iterator;
import java.util.Map;

/**
 * Headline facts of a session: winner, fastest lap and scheduled lap count.
 *
 * <p>The winner is the car classified in position 1; without one the winner stays {@code null}.
 * Names fall back to the racing number.</p>
 */
final class SessionSummaryDerivation {
    private SessionSummaryDerivation() {}

    static AnalysisPayloads.SessionSummary fromProcessors(
            ProcessorSet processors,
            Map<String, String> driverNames,
            Map<Integer, Instant> lapTimes) {
        AnalysisPayloads.SessionSummary summary = new AnalysisPayloads.SessionSummary();

        JsonNode timing = processors.timingData.latest();
        JsonNode lines = timing == null ? null : timing.get("Lines");
        if (lines != null && lines.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = lines.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                Integer position = TimingValueParser.parsePosition(field.getValue().get("Position"));
                if (position != null && position == 1) {
                    summary.winnerNumber = field.getKey();
                    summary.winnerName = nameOrNumber(driverNames, field.getKey());
                    break;
                }
            }
        }

        TimingDataProcessor.BestLap fastest = null;
        for (TimingDataProcessor.BestLap bestLap : processors.timingData.bestLaps().values()) {
            if (fastest == null || bestLap.timeMs < fastest.timeMs) {
                fastest = bestLap;
            }
        }
        if (fastest != null) {
            summary.fastestLapNumber = fastest.driver;
            summary.fastestLapName = nameOrNumber(driverNames, fastest.driver);
            summary.fastestLapTime = fastest.time;
        }

        JsonNode lapCount = processors.lapCount.latest();
        summary.totalLaps = lapCount == null ? null : JsonNodeUtils.asNullableInt(lapCount.get("TotalLaps"));

        for (Instant at : lapTimes.values()) {
            if (summary.lastUpdate == null || at.isAfter(summary.lastUpdate)) {
                summary.lastUpdate = at;
            }
        }
        return summary;
    }

    private static String nameOrNumber(Map<String, String> driverNames, String number) {
        String name = driverNames.get(number);
        return name == null ? number : name;
    }
}
