package com.pitwall.analytics.model;

import java.time.Instant;

/**
 * One driver's derived state at a given lap. Immutable; owned by the analysis index that built it.
 *
 * <p>Numeric fields are {@code null} when the feed did not carry a parseable value.</p>
 */
public final class LapRecord {
    public final String driver;
    public final int lap;
    public final Instant timestamp;
    public final Double lapTimeMs;
    public final Double gapToLeaderSec;
    public final Double intervalToAheadSec;
    public final Integer position;
    public final TrafficLabel traffic;
    public final TrackStatusSnapshot trackStatus;
    // Any of the four pit markers below.
    public final boolean pit;
    public final boolean pitIn;
    public final boolean pitOut;
    public final boolean inPit;
    public final StintInfo stint;

    public LapRecord(
            String driver,
            int lap,
            Instant timestamp,
            Double lapTimeMs,
            Double gapToLeaderSec,
            Double intervalToAheadSec,
            Integer position,
            TrafficLabel traffic,
            TrackStatusSnapshot trackStatus,
            boolean isPitLap,
            boolean pitIn,
            boolean pitOut,
            boolean inPit,
            StintInfo stint) {
        this.driver = driver;
        this.lap = lap;
        this.timestamp = timestamp;
        this.lapTimeMs = lapTimeMs;
        this.gapToLeaderSec = gapToLeaderSec;
        this.intervalToAheadSec = intervalToAheadSec;
        this.position = position;
        this.traffic = traffic == null ? TrafficLabel.UNKNOWN : traffic;
        this.trackStatus = trackStatus;
        this.pit = isPitLap || pitIn || pitOut || inPit;
        this.pitIn = pitIn;
        this.pitOut = pitOut;
        this.inPit = inPit;
        this.stint = stint;
    }

    @Override
    public String toString() {
        return "LapRecord{driver=" + driver + ", lap=" + lap + ", lapTimeMs=" + lapTimeMs
                + ", position=" + position + ", traffic=" + traffic.label() + "}";
    }

    public static final class TrackStatusSnapshot {
        public final String status;
        public final String message;
        public final Boolean isGreen;

        public TrackStatusSnapshot(String status, String message, Boolean isGreen) {
            this.status = status;
            this.message = message;
            this.isGreen = isGreen;
        }
    }

    public static final class StintInfo {
        public final String compound;
        public final Integer tyreAge;
        public final Integer stint;

        public StintInfo(String compound, Integer tyreAge, Integer stint) {
            this.compound = compound;
            this.tyreAge = tyreAge;
            this.stint = stint;
        }
    }
}
