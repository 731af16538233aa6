package com.pitwall.analytics.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One captured feed message as handed over by a loader: stream name, decoded payload, capture time.
 */
public final class RawEvent {
    public final String type;
    public final JsonNode json;
    public final Instant timestamp;

    public RawEvent(String type, JsonNode json, Instant timestamp) {
        this.type = type;
        this.json = json;
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "RawEvent{type=" + type + ", timestamp=" + timestamp + "}";
    }
}
