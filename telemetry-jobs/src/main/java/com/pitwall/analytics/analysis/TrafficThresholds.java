package com.pitwall.analytics.analysis;

/**
 * Base and lap-time factor for each of the four traffic gap thresholds. A threshold in seconds is
 * {@code max(base, factor * lapTimeSeconds)}.
 */
public final class TrafficThresholds {
    public static final TrafficThresholds DEFAULTS = new TrafficThresholds(
            1.0, 0.012,
            0.8, 0.010,
            1.7, 0.018,
            1.3, 0.014);

    public final double trafficAheadBase;
    public final double trafficAheadFactor;
    public final double trafficBehindBase;
    public final double trafficBehindFactor;
    public final double cleanAheadBase;
    public final double cleanAheadFactor;
    public final double cleanBehindBase;
    public final double cleanBehindFactor;

    public TrafficThresholds(
            double trafficAheadBase,
            double trafficAheadFactor,
            double trafficBehindBase,
            double trafficBehindFactor,
            double cleanAheadBase,
            double cleanAheadFactor,
            double cleanBehindBase,
            double cleanBehindFactor) {
        this.trafficAheadBase = trafficAheadBase;
        this.trafficAheadFactor = trafficAheadFactor;
        this.trafficBehindBase = trafficBehindBase;
        this.trafficBehindFactor = trafficBehindFactor;
        this.cleanAheadBase = cleanAheadBase;
        this.cleanAheadFactor = cleanAheadFactor;
        this.cleanBehindBase = cleanBehindBase;
        this.cleanBehindFactor = cleanBehindFactor;
    }

    double trafficAheadSec(double lapTimeSec) {
        return Math.max(trafficAheadBase, trafficAheadFactor * lapTimeSec);
    }

    double trafficBehindSec(double lapTimeSec) {
        return Math.max(trafficBehindBase, trafficBehindFactor * lapTimeSec);
    }

    double cleanAheadSec(double lapTimeSec) {
        return Math.max(cleanAheadBase, cleanAheadFactor * lapTimeSec);
    }

    double cleanBehindSec(double lapTimeSec) {
        return Math.max(cleanBehindBase, cleanBehindFactor * lapTimeSec);
    }

    @Override
    public String toString() {
        return "TrafficThresholds{trafficAhead=" + trafficAheadBase + "/" + trafficAheadFactor
                + ", trafficBehind=" + trafficBehindBase + "/" + trafficBehindFactor
                + ", cleanAhead=" + cleanAheadBase + "/" + cleanAheadFactor
                + ", cleanBehind=" + cleanBehindBase + "/" + cleanBehindFactor + "}";
    }
}
