package com.pitwall.analytics.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.pitwall.analytics.model.NormalizedEvent;
import com.pitwall.analytics.parse.JsonNodeUtils;
import com.pitwall.analytics.util.JsonSupport;

/**
 * Car position snapshots. Keeps a single current entry: each batch's {@code Entries} are
 * overlaid car by car and the last {@code Timestamp} is kept. No per-batch history.
 *
 * <p>State shape: {@code {"Position": [{"Timestamp": ..., "Entries": {car: {X, Y, Z, Status}}}]}}.</p>
 */
public class PositionProcessor extends AbstractTopicProcessor {
    public static final String TOPIC = "Position";

    private ObjectNode state;
    private ObjectNode current;

    public PositionProcessor() {
        super(TOPIC);
    }

    @Override
    protected void apply(NormalizedEvent event) {
        if (state == null) {
            state = JsonSupport.newObject();
            current = JsonSupport.newObject();
            current.set("Entries", JsonSupport.newObject());
            ArrayNode snapshots = state.putArray("Position");
            snapshots.add(current);
        }
        JsonNode updates = event.payload == null ? null : event.payload.get("Position");
        if (updates == null || !updates.isArray()) {
            return;
        }
        for (JsonNode update : updates) {
            if (!update.isObject()) {
                continue;
            }
            JsonNode entries = update.get("Entries");
            if (entries != null && entries.isObject()) {
                JsonMerge.overlay((ObjectNode) current.get("Entries"), (ObjectNode) entries);
            }
            String timestamp = JsonNodeUtils.asNullableText(update.get("Timestamp"));
            if (timestamp != null) {
                current.put("Timestamp", timestamp);
            }
        }
    }

    @Override
    public JsonNode latest() {
        return state;
    }

    public JsonNode entryFor(String driverNumber) {
        return current == null ? null : current.get("Entries").get(driverNumber);
    }

    public String lastTimestamp() {
        return current == null ? null : JsonNodeUtils.asNullableText(current.get("Timestamp"));
    }
}
