package com.pitwall.analytics.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Feed event keyed by its canonical topic. The payload is owned by this event and must not be mutated.
 *
 * <p>Events are expected in non-decreasing timestamp order; this is not checked.</p>
 */
public final class NormalizedEvent {
    public final String topic;
    public final JsonNode payload;
    public final Instant timestamp;

    public NormalizedEvent(String topic, JsonNode payload, Instant timestamp) {
        this.topic = topic;
        this.payload = payload;
        this.timestamp = timestamp;
    }

    public boolean isTopic(String candidate) {
        return topic != null && topic.equals(candidate);
    }

    @Override
    public String toString() {
        return "NormalizedEvent{topic=" + topic + ", timestamp=" + timestamp + "}";
    }
}
