package com.pitwall.analytics.ingest;

import com.pitwall.analytics.processor.CarDataProcessor;
import com.pitwall.analytics.processor.DriverListProcessor;
import com.pitwall.analytics.processor.MergeProcessor;
import com.pitwall.analytics.processor.PitLaneTimeProcessor;
import com.pitwall.analytics.processor.PositionProcessor;
import com.pitwall.analytics.processor.TimingDataProcessor;
import com.pitwall.analytics.processor.TopicProcessor;
import com.pitwall.analytics.processor.TrackStatusProcessor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The processors of one session. One instance per ingestion service; never shared across sessions.
 */
public final class ProcessorSet {
    public final MergeProcessor heartbeat = new MergeProcessor("Heartbeat");
    public final DriverListProcessor driverList = new DriverListProcessor();
    public final TimingDataProcessor timingData = new TimingDataProcessor();
    public final MergeProcessor timingAppData = new MergeProcessor("TimingAppData");
    public final MergeProcessor timingStats = new MergeProcessor("TimingStats");
    public final TrackStatusProcessor trackStatus = new TrackStatusProcessor();
    public final MergeProcessor lapCount = new MergeProcessor("LapCount");
    public final MergeProcessor weatherData = new MergeProcessor("WeatherData");
    public final MergeProcessor sessionInfo = new MergeProcessor("SessionInfo");
    public final MergeProcessor sessionData = new MergeProcessor("SessionData");
    public final MergeProcessor extrapolatedClock = new MergeProcessor("ExtrapolatedClock");
    public final MergeProcessor topThree = new MergeProcessor("TopThree");
    public final MergeProcessor raceControlMessages = new MergeProcessor("RaceControlMessages");
    public final MergeProcessor teamRadio = new MergeProcessor("TeamRadio");
    public final MergeProcessor championshipPrediction = new MergeProcessor("ChampionshipPrediction");
    public final MergeProcessor pitStopSeries = new MergeProcessor("PitStopSeries");
    public final MergeProcessor pitStop = new MergeProcessor("PitStop");
    public final PitLaneTimeProcessor pitLaneTimeCollection = new PitLaneTimeProcessor();
    public final CarDataProcessor carData = new CarDataProcessor();
    public final PositionProcessor position = new PositionProcessor();

    private final Map<String, TopicProcessor> byTopic;

    public ProcessorSet() {
        Map<String, TopicProcessor> map = new LinkedHashMap<>();
        for (TopicProcessor processor : List.of(
                heartbeat, driverList, timingData, timingAppData, timingStats, trackStatus, lapCount,
                weatherData, sessionInfo, sessionData, extrapolatedClock, topThree, raceControlMessages,
                teamRadio, championshipPrediction, pitStopSeries, pitStop, pitLaneTimeCollection,
                carData, position)) {
            map.put(processor.topic(), processor);
        }
        this.byTopic = Collections.unmodifiableMap(map);
    }

    public List<TopicProcessor> all() {
        return List.copyOf(byTopic.values());
    }

    public TopicProcessor forTopic(String topic) {
        return byTopic.get(topic);
    }

    public boolean handles(String topic) {
        return byTopic.containsKey(topic);
    }
}
