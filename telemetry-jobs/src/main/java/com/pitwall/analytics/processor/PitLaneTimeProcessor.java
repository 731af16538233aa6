package com.pitwall.analytics.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.pitwall.analytics.model.NormalizedEvent;
import com.pitwall.analytics.util.JsonSupport;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Pit lane traversal times. Keeps the latest entry per driver in {@code PitTimes} and every entry
 * in arrival order in {@code PitTimesList}; the {@code _deleted} sentinel is skipped.
 */
public class PitLaneTimeProcessor extends AbstractTopicProcessor {
    public static final String TOPIC = "PitLaneTimeCollection";
    static final String DELETED_SENTINEL = "_deleted";

    private ObjectNode state;

    public PitLaneTimeProcessor() {
        super(TOPIC);
    }

    @Override
    protected void apply(NormalizedEvent event) {
        if (state == null) {
            state = JsonSupport.newObject();
            state.putObject("PitTimes");
            state.putObject("PitTimesList");
        }
        JsonNode pitTimes = event.payload == null ? null : event.payload.get("PitTimes");
        if (pitTimes == null || !pitTimes.isObject()) {
            return;
        }
        ObjectNode latest = (ObjectNode) state.get("PitTimes");
        ObjectNode history = (ObjectNode) state.get("PitTimesList");
        Iterator<Map.Entry<String, JsonNode>> fields = pitTimes.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String driver = field.getKey();
            if (DELETED_SENTINEL.equals(driver)) {
                continue;
            }
            JsonNode list = history.get(driver);
            ArrayNode entries = list != null && list.isArray() ? (ArrayNode) list : history.putArray(driver);
            entries.add(field.getValue().deepCopy());
            latest.set(driver, field.getValue().deepCopy());
        }
    }

    @Override
    public JsonNode latest() {
        return state;
    }

    public JsonNode latestFor(String driverNumber) {
        return state == null ? null : state.get("PitTimes").get(driverNumber);
    }

    public List<JsonNode> historyFor(String driverNumber) {
        List<JsonNode> out = new ArrayList<>();
        if (state == null) {
            return out;
        }
        JsonNode list = state.get("PitTimesList").get(driverNumber);
        if (list != null && list.isArray()) {
            list.forEach(out::add);
        }
        return out;
    }
}
