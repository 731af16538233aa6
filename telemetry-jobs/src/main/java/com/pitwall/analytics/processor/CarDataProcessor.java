package com.pitwall.analytics.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.pitwall.analytics.model.NormalizedEvent;
import com.pitwall.analytics.util.JsonSupport;

/**
 * Car telemetry channels. Only the last sample of the most recent batch is kept.
 */
public class CarDataProcessor extends AbstractTopicProcessor {
    public static final String TOPIC = "CarData";

    private ObjectNode state;

    public CarDataProcessor() {
        super(TOPIC);
    }

    @Override
    protected void apply(NormalizedEvent event) {
        if (state == null) {
            state = JsonSupport.newObject();
            state.putArray("Entries");
        }
        JsonNode entries = event.payload == null ? null : event.payload.get("Entries");
        if (entries == null || !entries.isArray() || entries.size() == 0) {
            return;
        }
        state.putArray("Entries").add(entries.get(entries.size() - 1).deepCopy());
    }

    @Override
    public JsonNode latest() {
        return state;
    }

    /** Channel map of the latest sample for a car, e.g. {@code {"0": rpm, "2": speed, ...}}. */
    public JsonNode channelsFor(String driverNumber) {
        if (state == null || state.get("Entries").size() == 0) {
            return null;
        }
        JsonNode channels = state.get("Entries").get(0).path("Cars").path(driverNumber).path("Channels");
        return channels.isObject() ? channels : null;
    }
}
