package com.pitwall.analytics.processor;

import com.fasterxml.jackson.databind.JsonNode;

import com.pitwall.analytics.model.NormalizedEvent;
import com.pitwall.analytics.parse.JsonNodeUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Track status with a change history, so lap records can be matched to the status in force
 * when the lap was recorded.
 */
public class TrackStatusProcessor extends MergeProcessor {
    public static final String TOPIC = "TrackStatus";

    private final List<Entry> history = new ArrayList<>();

    public TrackStatusProcessor() {
        super(TOPIC);
    }

    @Override
    protected void apply(NormalizedEvent event) {
        super.apply(event);
        String status = textOf(state.get("Status"));
        String message = textOf(state.get("Message"));
        Entry last = history.isEmpty() ? null : history.get(history.size() - 1);
        if (last == null || !Objects.equals(last.status, status) || !Objects.equals(last.message, message)) {
            history.add(new Entry(event.timestamp, state.deepCopy(), status, message));
        }
    }

    /**
     * State in force at {@code at}: the last change at or before it, else the latest state.
     */
    public JsonNode stateAt(Instant at) {
        if (at != null) {
            for (int i = history.size() - 1; i >= 0; i--) {
                Entry entry = history.get(i);
                if (entry.at != null && !entry.at.isAfter(at)) {
                    return entry.value;
                }
            }
        }
        return state;
    }

    public List<Entry> history() {
        return Collections.unmodifiableList(history);
    }

    private static String textOf(JsonNode node) {
        if (JsonNodeUtils.isAbsent(node)) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    public static final class Entry {
        public final Instant at;
        public final JsonNode value;
        public final String status;
        public final String message;

        Entry(Instant at, JsonNode value, String status, String message) {
            this.at = at;
            this.value = value;
            this.status = status;
            this.message = message;
        }
    }
}
