package com.pitwall.analytics.analysis;

import com.pitwall.analytics.parse.JsonNodeUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Resolves a {@link TimeCursor} to a known lap number.
 *
 * <p>Semantics:
 * - no cursor, "latest", a non-finite lap or an unparseable instant: highest known lap
 * - lap cursor: nearest known lap, ties toward the lower lap
 * - instant cursor: lap whose timestamp is closest to the instant; laps without a timestamp are
 *   ignored, and when none has one the highest lap is returned as "latest"
 */
public final class TimeCursorResolver {
    private TimeCursorResolver() {}

    public static ResolvedCursor resolve(Map<Integer, Instant> lapTimes, Collection<Integer> lapNumbers, TimeCursor cursor) {
        List<Integer> sorted = new ArrayList<>();
        if (lapNumbers != null) {
            for (Integer lap : lapNumbers) {
                if (lap != null) {
                    sorted.add(lap);
                }
            }
        }
        if (sorted.isEmpty()) {
            return new ResolvedCursor(null, null, ResolvedCursor.Source.NONE);
        }
        Collections.sort(sorted);
        Map<Integer, Instant> times = lapTimes == null ? Collections.emptyMap() : lapTimes;

        if (cursor == null || cursor.isLatest()) {
            return latest(sorted, times);
        }
        if (cursor.lap() != null) {
            double target = cursor.lap();
            if (!Double.isFinite(target)) {
                return latest(sorted, times);
            }
            int lap = nearestLap(sorted, target);
            return new ResolvedCursor(lap, times.get(lap), ResolvedCursor.Source.LAP);
        }

        Instant target = JsonNodeUtils.parseInstant(cursor.iso());
        if (target == null) {
            return latest(sorted, times);
        }
        Integer bestLap = null;
        long bestDiff = Long.MAX_VALUE;
        for (Integer lap : sorted) {
            Instant at = times.get(lap);
            if (at == null) {
                continue;
            }
            long diff = Math.abs(at.toEpochMilli() - target.toEpochMilli());
            if (diff < bestDiff) {
                bestDiff = diff;
                bestLap = lap;
            }
        }
        if (bestLap == null) {
            return latest(sorted, times);
        }
        return new ResolvedCursor(bestLap, times.get(bestLap), ResolvedCursor.Source.TIME);
    }

    static int nearestLap(List<Integer> sorted, double target) {
        int best = sorted.get(0);
        double bestDiff = Math.abs(best - target);
        for (Integer lap : sorted) {
            double diff = Math.abs(lap - target);
            // Ascending scan, so strict comparison keeps the lower lap on ties.
            if (diff < bestDiff) {
                best = lap;
                bestDiff = diff;
            }
        }
        return best;
    }

    private static ResolvedCursor latest(List<Integer> sorted, Map<Integer, Instant> times) {
        int lap = sorted.get(sorted.size() - 1);
        return new ResolvedCursor(lap, times.get(lap), ResolvedCursor.Source.LATEST);
    }
}
