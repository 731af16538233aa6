package com.pitwall.analytics.ingest;

import com.fasterxml.jackson.databind.JsonNode;

import com.pitwall.analytics.analysis.AnalysisIndex;
import com.pitwall.analytics.analysis.TrafficThresholds;
import com.pitwall.analytics.model.NormalizedEvent;
import com.pitwall.analytics.model.RawEvent;
import com.pitwall.analytics.parse.EventNormalizer;
import com.pitwall.analytics.parse.MalformedEventException;
import com.pitwall.analytics.processor.MergeProcessor;
import com.pitwall.analytics.processor.TopicProcessor;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Owns the processors of one session and fans every normalized event out to all of them.
 *
 * <p>Not thread-safe: exactly one thread may drive ingestion. Topics without a dedicated processor
 * get a {@link MergeProcessor} on first sight.</p>
 */
public class TimingIngestionService {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(TimingIngestionService.class);

    private final EventNormalizer normalizer;
    private final ProcessorSet processors = new ProcessorSet();
    private final Map<String, MergeProcessor> unmodeled = new LinkedHashMap<>();
    private long eventCount;
    private Instant lastEventTimestamp;

    public TimingIngestionService() {
        this(new EventNormalizer());
    }

    public TimingIngestionService(EventNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public NormalizedEvent enqueue(RawEvent raw) {
        return ingest(normalizer.normalize(raw));
    }

    public NormalizedEvent enqueue(String type, JsonNode json, Instant timestamp) {
        return ingest(normalizer.normalize(type, json, timestamp));
    }

    /**
     * @throws MalformedEventException when {@code rawJson} cannot be parsed; state is left untouched
     */
    public NormalizedEvent enqueue(String type, String rawJson, Instant timestamp) throws MalformedEventException {
        return ingest(normalizer.normalize(type, rawJson, timestamp));
    }

    /** Fans an already normalized event out to every processor. */
    public NormalizedEvent ingest(NormalizedEvent event) {
        for (TopicProcessor processor : processors.all()) {
            processor.process(event);
        }
        if (!processors.handles(event.topic)) {
            unmodeled.computeIfAbsent(event.topic, topic -> {
                LOG.debug("No dedicated processor for topic {}, using generic merge", topic);
                return new MergeProcessor(topic);
            }).process(event);
        }
        eventCount++;
        lastEventTimestamp = event.timestamp;
        return event;
    }

    public ProcessorSet processors() {
        return processors;
    }

    /** Live state of any topic, dedicated or not; {@code null} if nothing arrived for it. */
    public JsonNode latest(String topic) {
        TopicProcessor processor = processors.forTopic(normalizer.registry().canonicalTopic(topic));
        if (processor == null) {
            processor = unmodeled.get(normalizer.registry().canonicalTopic(topic));
        }
        return processor == null ? null : processor.latest();
    }

    public Map<String, MergeProcessor> unmodeledProcessors() {
        return Collections.unmodifiableMap(unmodeled);
    }

    public long eventCount() {
        return eventCount;
    }

    public Instant lastEventTimestamp() {
        return lastEventTimestamp;
    }

    public AnalysisIndex buildIndex() {
        return AnalysisIndex.build(processors);
    }

    public AnalysisIndex buildIndex(TrafficThresholds thresholds) {
        return AnalysisIndex.build(processors, thresholds);
    }
}
