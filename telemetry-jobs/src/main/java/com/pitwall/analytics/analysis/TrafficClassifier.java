package com.pitwall.analytics.analysis;

import com.pitwall.analytics.model.TrafficLabel;

/**
 * Labels a lap by the air around the car.
 *
 * <p>Rules:
 * - unknown: lap time or either gap missing or non-finite
 * - traffic: gap ahead or gap behind at or below its traffic threshold
 * - clean: green lap with both gaps at or above their clean thresholds
 * - neutral: everything else
 */
public final class TrafficClassifier {
    private TrafficClassifier() {}

    public static TrafficLabel classify(Double gapAheadSec, Double gapBehindSec, Double lapTimeMs, boolean isGreen) {
        return classify(gapAheadSec, gapBehindSec, lapTimeMs, isGreen, TrafficThresholds.DEFAULTS);
    }

    public static TrafficLabel classify(
            Double gapAheadSec,
            Double gapBehindSec,
            Double lapTimeMs,
            boolean isGreen,
            TrafficThresholds thresholds) {
        if (!isFinite(lapTimeMs) || !isFinite(gapAheadSec) || !isFinite(gapBehindSec)) {
            return TrafficLabel.UNKNOWN;
        }
        TrafficThresholds t = thresholds == null ? TrafficThresholds.DEFAULTS : thresholds;
        double lapTimeSec = lapTimeMs / 1000.0;
        if (gapAheadSec <= t.trafficAheadSec(lapTimeSec) || gapBehindSec <= t.trafficBehindSec(lapTimeSec)) {
            return TrafficLabel.TRAFFIC;
        }
        if (isGreen && gapAheadSec >= t.cleanAheadSec(lapTimeSec) && gapBehindSec >= t.cleanBehindSec(lapTimeSec)) {
            return TrafficLabel.CLEAN;
        }
        return TrafficLabel.NEUTRAL;
    }

    private static boolean isFinite(Double value) {
        return value != null && Double.isFinite(value);
    }
}
