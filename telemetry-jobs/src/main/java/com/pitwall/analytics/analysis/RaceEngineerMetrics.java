package com.pitwall.analytics.analysis;

import com.fasterxml.jackson.databind.JsonNode;

import com.pitwall.analytics.model.AnalysisPayloads;
import com.pitwall.analytics.model.LapRecord;
import com.pitwall.analytics.model.TrackPhase;
import com.pitwall.analytics.parse.JsonNodeUtils;
import com.pitwall.analytics.parse.TimingValueParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IntSummaryStatistics;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Derived strategy metrics over lap records and pit lane timings.
 *
 * <p>Medians of an even sample count and all means are rounded to whole milliseconds.</p>
 */
public final class RaceEngineerMetrics {
    public static final String METHOD_DRIVER = "driver";
    public static final String METHOD_FIELD_MEDIAN = "field-median";
    public static final String METHOD_MEDIAN = "median";
    public static final String METHOD_MEAN = "mean";

    static final String EXCLUDED_MISSING_LAP = "missing-lap";
    static final String EXCLUDED_MISSING_DRIVER = "missing-driver";
    static final String EXCLUDED_PIT_LAP = "pit-lap";
    static final String EXCLUDED_MISSING_LAP_TIME = "missing-lap-time";
    static final String EXCLUDED_NO_LAP_TIMES = "no-lap-times";
    static final String EXCLUDED_NO_NONPIT_LAP_TIMES = "no-nonpit-lap-times";
    static final String SKIPPED_NON_GREEN = "non-green";

    private RaceEngineerMetrics() {}

    /**
     * Runs of consecutive cars, in position order, each within {@code thresholdSec} of the car ahead.
     * Only runs of at least {@code minCars} are reported.
     */
    public static AnalysisPayloads.GapTrainReport gapTrainsForLap(
            int lap,
            Map<String, LapRecord> lapRecords,
            double thresholdSec,
            int minCars,
            boolean requireGreen,
            Function<String, String> driverNames) {
        AnalysisPayloads.GapTrainReport report = new AnalysisPayloads.GapTrainReport();
        report.lap = lap;
        report.thresholdSec = thresholdSec;
        report.minCars = minCars;
        report.requireGreen = requireGreen;

        LapRecord.TrackStatusSnapshot status = firstTrackStatus(lapRecords.values());
        if (status != null) {
            report.trackStatus = status.status;
            report.trackMessage = status.message;
            report.isGreen = status.isGreen;
            report.phase = TrackStatusSemantics.classifyPhase(status.status, status.message);
        }
        if (requireGreen && Boolean.FALSE.equals(report.isGreen)) {
            report.skipped = true;
            report.skippedReason = SKIPPED_NON_GREEN;
            return report;
        }

        List<LapRecord> ordered = new ArrayList<>();
        for (LapRecord record : lapRecords.values()) {
            if (record.position != null) {
                ordered.add(record);
            }
        }
        ordered.sort(Comparator.comparingInt(record -> record.position));

        List<LapRecord> current = new ArrayList<>();
        for (int i = 1; i < ordered.size(); i++) {
            LapRecord record = ordered.get(i);
            Double gap = record.intervalToAheadSec;
            if (gap != null && Double.isFinite(gap) && gap <= thresholdSec) {
                LapRecord ahead = ordered.get(i - 1);
                if (current.isEmpty() || current.get(current.size() - 1) != ahead) {
                    current.add(ahead);
                }
                current.add(record);
                continue;
            }
            if (current.size() >= minCars) {
                report.trains.add(toTrain(current, driverNames));
            }
            current = new ArrayList<>();
        }
        if (current.size() >= minCars) {
            report.trains.add(toTrain(current, driverNames));
        }
        return report;
    }

    private static AnalysisPayloads.GapTrain toTrain(List<LapRecord> records, Function<String, String> driverNames) {
        AnalysisPayloads.GapTrain train = new AnalysisPayloads.GapTrain();
        for (LapRecord record : records) {
            AnalysisPayloads.GapTrainDriver driver = new AnalysisPayloads.GapTrainDriver();
            driver.driver = record.driver;
            driver.driverName = driverNames == null ? null : driverNames.apply(record.driver);
            driver.position = record.position;
            driver.gapToLeaderSec = record.gapToLeaderSec;
            driver.intervalToAheadSec = record.intervalToAheadSec;
            train.drivers.add(driver);
            if (record.intervalToAheadSec != null && Double.isFinite(record.intervalToAheadSec)
                    && (train.maxIntervalToAheadSec == null || record.intervalToAheadSec > train.maxIntervalToAheadSec)) {
                train.maxIntervalToAheadSec = record.intervalToAheadSec;
            }
        }
        train.size = train.drivers.size();
        return train;
    }

    /**
     * Lap time by track phase over {@code [startLap, endLap]}. With a driver the sample is that
     * driver's lap; without one it is the median over the field. Green-phase samples form the
     * baseline each phase is compared against. The window is clamped to the laps present in
     * {@code byLap}; gaps inside it are reported as missing laps.
     */
    public static AnalysisPayloads.ScVscDeltaReport scVscDeltas(
            Map<Integer, Map<String, LapRecord>> byLap,
            int startLap,
            int endLap,
            String driver,
            boolean includePitLaps) {
        AnalysisPayloads.ScVscDeltaReport report = new AnalysisPayloads.ScVscDeltaReport();
        report.method = driver == null ? METHOD_FIELD_MEDIAN : METHOD_DRIVER;
        report.driver = driver;
        report.startLap = startLap;
        report.endLap = endLap;
        report.includePitLaps = includePitLaps;

        IntSummaryStatistics known = byLap.keySet().stream().mapToInt(Integer::intValue).summaryStatistics();
        int firstLap = Math.max(startLap, known.getMin());
        int lastLap = Math.min(endLap, known.getMax());
        for (int lap = firstLap; lap <= lastLap; lap++) {
            Map<String, LapRecord> lapRecords = byLap.get(lap);
            AnalysisPayloads.PhaseLapSample sample = new AnalysisPayloads.PhaseLapSample();
            sample.lap = lap;
            if (lapRecords == null) {
                sample.phase = TrackPhase.UNKNOWN;
                sample.excludedReason = EXCLUDED_MISSING_LAP;
                report.laps.add(sample);
                continue;
            }
            LapRecord.TrackStatusSnapshot status = firstTrackStatus(lapRecords.values());
            sample.trackStatus = status == null ? null : status.status;
            sample.trackMessage = status == null ? null : status.message;
            sample.phase = TrackStatusSemantics.classifyPhase(sample.trackStatus, sample.trackMessage);

            if (driver != null) {
                fillDriverSample(sample, lapRecords.get(driver), includePitLaps);
            } else {
                fillFieldSample(sample, lapRecords.values(), includePitLaps);
            }
            report.laps.add(sample);
        }

        report.periods = phasePeriods(report.laps);

        Double baselineMedian = median(sampleValues(report.laps, TrackPhase.GREEN));
        for (TrackPhase phase : TrackPhase.values()) {
            report.phases.put(phase, phaseStats(sampleValues(report.laps, phase), baselineMedian));
        }
        report.baseline = baselineMedian == null ? null : report.phases.get(TrackPhase.GREEN);
        return report;
    }

    private static void fillDriverSample(AnalysisPayloads.PhaseLapSample sample, LapRecord record, boolean includePitLaps) {
        if (record == null) {
            sample.excludedReason = EXCLUDED_MISSING_DRIVER;
            return;
        }
        sample.sampleCount = 1;
        if (!includePitLaps && record.pit) {
            sample.excludedReason = EXCLUDED_PIT_LAP;
        } else if (record.lapTimeMs == null) {
            sample.excludedReason = EXCLUDED_MISSING_LAP_TIME;
        } else {
            sample.lapTimeMs = record.lapTimeMs;
        }
    }

    private static void fillFieldSample(
            AnalysisPayloads.PhaseLapSample sample,
            Iterable<LapRecord> records,
            boolean includePitLaps) {
        List<Double> values = new ArrayList<>();
        for (LapRecord record : records) {
            if (record.lapTimeMs == null || !Double.isFinite(record.lapTimeMs)) {
                continue;
            }
            if (!includePitLaps && record.pit) {
                continue;
            }
            values.add(record.lapTimeMs);
        }
        if (values.isEmpty()) {
            sample.excludedReason = includePitLaps ? EXCLUDED_NO_LAP_TIMES : EXCLUDED_NO_NONPIT_LAP_TIMES;
            return;
        }
        sample.lapTimeMs = median(values);
        sample.sampleCount = values.size();
    }

    /**
     * Collapses consecutive laps of the same phase into periods. A gap in lap numbers starts a new
     * period.
     */
    public static List<AnalysisPayloads.PhasePeriod> phasePeriods(List<AnalysisPayloads.PhaseLapSample> laps) {
        List<AnalysisPayloads.PhaseLapSample> ordered = new ArrayList<>(laps);
        ordered.sort(Comparator.comparingInt(sample -> sample.lap));
        List<AnalysisPayloads.PhasePeriod> periods = new ArrayList<>();
        AnalysisPayloads.PhasePeriod current = null;
        for (AnalysisPayloads.PhaseLapSample sample : ordered) {
            if (current != null && current.phase == sample.phase && sample.lap == current.endLap + 1) {
                current.endLap = sample.lap;
                current.lapCount++;
                continue;
            }
            current = new AnalysisPayloads.PhasePeriod();
            current.phase = sample.phase;
            current.startLap = sample.lap;
            current.endLap = sample.lap;
            current.lapCount = 1;
            periods.add(current);
        }
        return periods;
    }

    private static List<Double> sampleValues(List<AnalysisPayloads.PhaseLapSample> laps, TrackPhase phase) {
        List<Double> values = new ArrayList<>();
        for (AnalysisPayloads.PhaseLapSample sample : laps) {
            if (sample.excludedReason == null && sample.phase == phase && sample.lapTimeMs != null) {
                values.add(sample.lapTimeMs);
            }
        }
        return values;
    }

    static AnalysisPayloads.PhaseStats phaseStats(List<Double> values, Double baselineMedian) {
        AnalysisPayloads.PhaseStats stats = new AnalysisPayloads.PhaseStats();
        stats.samples = values.size();
        if (values.isEmpty()) {
            return stats;
        }
        stats.avgLapMs = mean(values);
        stats.medianLapMs = median(values);
        stats.minLapMs = Collections.min(values);
        stats.maxLapMs = Collections.max(values);
        stats.deltaToGreenMs = baselineMedian == null ? null : stats.medianLapMs - baselineMedian;
        return stats;
    }

    /**
     * Pit lane traversal time from the {@code PitTimesList} history, per driver and overall.
     * Durations cover the lane only, not the full stop loss including in and out laps.
     */
    public static AnalysisPayloads.PitLaneTimeStats pitLaneTimeStats(
            JsonNode pitLaneState,
            String method,
            String driver,
            Integer startLap,
            Integer endLap,
            Function<String, String> driverNames) {
        AnalysisPayloads.PitLaneTimeStats stats = new AnalysisPayloads.PitLaneTimeStats();
        stats.method = METHOD_MEAN.equals(method) ? METHOD_MEAN : METHOD_MEDIAN;
        stats.driver = driver;
        stats.startLap = startLap;
        stats.endLap = endLap;

        List<Double> all = new ArrayList<>();
        JsonNode history = pitLaneState == null ? null : pitLaneState.get("PitTimesList");
        if (history != null && history.isObject()) {
            List<String> drivers = new ArrayList<>();
            Iterator<String> names = history.fieldNames();
            while (names.hasNext()) {
                drivers.add(names.next());
            }
            drivers.sort(RaceEngineerMetrics::compareDriverNumbers);

            for (String number : drivers) {
                if (driver != null && !driver.equals(number)) {
                    continue;
                }
                JsonNode pits = history.get(number);
                if (!pits.isArray()) {
                    continue;
                }
                List<Double> durations = new ArrayList<>();
                for (JsonNode pit : pits) {
                    Integer lap = JsonNodeUtils.asNullableInt(pit.get("Lap"));
                    if (lap != null && ((startLap != null && lap < startLap) || (endLap != null && lap > endLap))) {
                        continue;
                    }
                    Long ms = TimingValueParser.parseDurationMs(pit.get("Duration"));
                    if (ms != null) {
                        durations.add(ms.doubleValue());
                    }
                }
                all.addAll(durations);

                AnalysisPayloads.DriverPitLaneTime entry = new AnalysisPayloads.DriverPitLaneTime();
                entry.driver = number;
                entry.driverName = driverNames == null ? null : driverNames.apply(number);
                entry.samples = durations.size();
                entry.pitLaneTimeMs = aggregate(durations, stats.method);
                entry.pitLaneTimeSec = entry.pitLaneTimeMs == null ? null : entry.pitLaneTimeMs / 1000.0;
                stats.byDriver.add(entry);
            }
        }
        stats.samples = all.size();
        stats.pitLaneTimeMs = aggregate(all, stats.method);
        stats.pitLaneTimeSec = stats.pitLaneTimeMs == null ? null : stats.pitLaneTimeMs / 1000.0;
        return stats;
    }

    private static Long aggregate(List<Double> values, String method) {
        Double value = METHOD_MEAN.equals(method) ? mean(values) : median(values);
        return value == null ? null : Math.round(value);
    }

    static Double mean(List<Double> values) {
        if (values.isEmpty()) {
            return null;
        }
        double sum = 0.0;
        for (Double value : values) {
            sum += value;
        }
        return (double) Math.round(sum / values.size());
    }

    static Double median(List<Double> values) {
        if (values.isEmpty()) {
            return null;
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(mid);
        }
        return (double) Math.round((sorted.get(mid - 1) + sorted.get(mid)) / 2.0);
    }

    private static LapRecord.TrackStatusSnapshot firstTrackStatus(Iterable<LapRecord> records) {
        for (LapRecord record : records) {
            if (record.trackStatus != null) {
                return record.trackStatus;
            }
        }
        return null;
    }

    private static int compareDriverNumbers(String a, String b) {
        Integer left = parseNumber(a);
        Integer right = parseNumber(b);
        if (left != null && right != null) {
            return Integer.compare(left, right);
        }
        if (left != null) {
            return -1;
        }
        if (right != null) {
            return 1;
        }
        return a.compareTo(b);
    }

    private static Integer parseNumber(String value) {
        if (value == null || value.isEmpty() || value.length() > 6) {
            return null;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return null;
            }
        }
        return Integer.parseInt(value);
    }
}
