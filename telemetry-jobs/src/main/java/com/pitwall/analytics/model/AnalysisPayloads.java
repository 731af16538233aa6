package com.pitwall.analytics.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result shapes returned by analysis index queries. Each query returns fresh instances.
 */
public final class AnalysisPayloads {
    private AnalysisPayloads() {}

    public enum PitEventType {
        PIT_IN("pit-in"),
        PIT_OUT("pit-out"),
        PIT("pit");

        private final String label;

        PitEventType(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public static class PitEvent {
        public String driver;
        public int lap;
        public PitEventType type;
    }

    public static class PositionChange {
        public String driver;
        public int fromLap;
        public int toLap;
        public Integer fromPosition;
        public Integer toPosition;
    }

    public static class StintPace {
        public String driver;
        public int samples;
        public Double avgLapMs;
        public Double slopeMsPerLap;
        public List<Integer> laps = new ArrayList<>();
    }

    public static class LapDelta {
        public int lap;
        public double deltaMs;
    }

    public static class ComparisonSummary {
        // Negative when driver A is faster on average.
        public double avgDeltaMs;
    }

    public static class DriverComparison {
        public String driverA;
        public String driverB;
        public List<LapDelta> laps = new ArrayList<>();
        public ComparisonSummary summary;
    }

    public static class UndercutWindow {
        public String driverA;
        public String driverB;
        public Double avgDeltaMs;
        public Double pitLossMs;
        public Double lapsToCover;
    }

    public static class RejoinProjection {
        public String driver;
        public Integer asOfLap;
        public double lossMs;
        public Double gapToLeaderSec;
        public Double projectedGapToLeaderSec;
    }

    public static class GapTrainDriver {
        public String driver;
        public String driverName;
        public Integer position;
        public Double gapToLeaderSec;
        public Double intervalToAheadSec;
    }

    public static class GapTrain {
        public int size;
        public Double maxIntervalToAheadSec;
        public List<GapTrainDriver> drivers = new ArrayList<>();
    }

    public static class GapTrainReport {
        public int lap;
        public double thresholdSec;
        public int minCars;
        public boolean requireGreen;
        public TrackPhase phase = TrackPhase.UNKNOWN;
        public String trackStatus;
        public String trackMessage;
        public Boolean isGreen;
        public List<GapTrain> trains = new ArrayList<>();
        public boolean skipped;
        public String skippedReason;
    }

    public static class PhaseLapSample {
        public int lap;
        public TrackPhase phase;
        public Double lapTimeMs;
        // Drivers contributing to the sample; always 0 or 1 in per-driver mode.
        public int sampleCount;
        public String excludedReason;
        public String trackStatus;
        public String trackMessage;
    }

    public static class PhasePeriod {
        public TrackPhase phase;
        public int startLap;
        public int endLap;
        public int lapCount;
    }

    public static class PhaseStats {
        public int samples;
        public Double avgLapMs;
        public Double medianLapMs;
        public Double minLapMs;
        public Double maxLapMs;
        public Double deltaToGreenMs;
    }

    public static class ScVscDeltaReport {
        public String method;
        public String driver;
        public int startLap;
        public int endLap;
        public boolean includePitLaps;
        public PhaseStats baseline;
        public Map<TrackPhase, PhaseStats> phases = new EnumMap<>(TrackPhase.class);
        public List<PhasePeriod> periods = new ArrayList<>();
        public List<PhaseLapSample> laps = new ArrayList<>();
    }

    public static class DriverPitLaneTime {
        public String driver;
        public String driverName;
        public int samples;
        public Long pitLaneTimeMs;
        public Double pitLaneTimeSec;
    }

    public static class PitLaneTimeStats {
        public String method;
        public String driver;
        public Integer startLap;
        public Integer endLap;
        public int samples;
        public Long pitLaneTimeMs;
        public Double pitLaneTimeSec;
        public List<DriverPitLaneTime> byDriver = new ArrayList<>();
    }

    public static class SessionSummary {
        public String winnerNumber;
        public String winnerName;
        public String fastestLapNumber;
        public String fastestLapName;
        public String fastestLapTime;
        public Integer totalLaps;
        public Instant lastUpdate;
    }
}
