package com.pitwall.analytics.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.pitwall.analytics.model.NormalizedEvent;
import com.pitwall.analytics.model.RawEvent;
import com.pitwall.analytics.registry.TopicRegistry;
import com.pitwall.analytics.registry.TopicRegistryLoader;
import com.pitwall.analytics.util.JsonSupport;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Canonicalizes raw feed messages: resolves stream aliases to canonical topics and reshapes
 * payload arrays that the feed later patches by index into index-keyed objects.
 *
 * <p>The payload is deep-copied; the caller's tree is never modified.</p>
 */
public final class EventNormalizer {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(EventNormalizer.class);

    static final String KEYFRAME_MARKER = "_kf";
    static final String DELETED_SENTINEL = "_deleted";

    private final TopicRegistry registry;

    public EventNormalizer() {
        this(TopicRegistryLoader.loadDefault());
    }

    public EventNormalizer(TopicRegistry registry) {
        this.registry = registry;
    }

    public TopicRegistry registry() {
        return registry;
    }

    public NormalizedEvent normalize(RawEvent raw) {
        return normalize(raw.type, raw.json, raw.timestamp);
    }

    /**
     * Parses {@code rawJson} and normalizes it.
     *
     * @throws MalformedEventException when the text is not valid JSON
     */
    public NormalizedEvent normalize(String type, String rawJson, Instant timestamp) throws MalformedEventException {
        JsonNode json;
        try {
            json = rawJson == null ? NullNode.getInstance() : JsonSupport.parse(rawJson);
        } catch (JsonProcessingException ex) {
            throw new MalformedEventException(type, "Payload for " + type + " is not valid JSON: "
                    + ex.getOriginalMessage(), ex);
        }
        return normalize(type, json, timestamp);
    }

    public NormalizedEvent normalize(String type, JsonNode json, Instant timestamp) {
        String topic = registry.canonicalTopic(type);
        if (registry.definitionFor(type) == null) {
            LOG.debug("Unknown feed topic {}, passing through", type);
        }

        JsonNode payload = json == null || json.isMissingNode() ? NullNode.getInstance() : json.deepCopy();
        if (payload.isObject()) {
            reshape(topic, (ObjectNode) payload);
        }
        return new NormalizedEvent(topic, payload, timestamp);
    }

    private static void reshape(String topic, ObjectNode obj) {
        obj.remove(KEYFRAME_MARKER);
        switch (topic) {
            case "RaceControlMessages":
                indexArrayField(obj, "Messages");
                break;
            case "TeamRadio":
                indexArrayField(obj, "Captures");
                break;
            case "TimingData":
                forEachLine(obj, line -> {
                    indexArrayField(line, "Sectors");
                    JsonNode sectors = line.get("Sectors");
                    if (sectors != null && sectors.isObject()) {
                        for (JsonNode sector : sectors) {
                            if (sector.isObject()) {
                                indexArrayField((ObjectNode) sector, "Segments");
                            }
                        }
                    }
                });
                break;
            case "TimingAppData":
                forEachLine(obj, line -> indexArrayField(line, "Stints"));
                break;
            case "PitStopSeries":
                JsonNode pitTimes = obj.get("PitTimes");
                if (pitTimes != null && pitTimes.isObject()) {
                    List<String> drivers = new ArrayList<>();
                    pitTimes.fieldNames().forEachRemaining(drivers::add);
                    for (String driver : drivers) {
                        indexArrayField((ObjectNode) pitTimes, driver);
                    }
                }
                break;
            case "PitLaneTimeCollection":
                JsonNode laneTimes = obj.get("PitTimes");
                if (laneTimes != null && laneTimes.isObject()) {
                    ((ObjectNode) laneTimes).remove(DELETED_SENTINEL);
                }
                break;
            default:
                break;
        }
    }

    private static void forEachLine(ObjectNode obj, Consumer<ObjectNode> action) {
        JsonNode lines = obj.get("Lines");
        if (lines == null || !lines.isObject()) {
            return;
        }
        for (JsonNode line : lines) {
            if (line.isObject()) {
                action.accept((ObjectNode) line);
            }
        }
    }

    private static void indexArrayField(ObjectNode parent, String field) {
        JsonNode value = parent.get(field);
        if (value != null && value.isArray()) {
            parent.set(field, toIndexedObject(value));
        }
    }

    static ObjectNode toIndexedObject(JsonNode array) {
        ObjectNode out = JsonSupport.newObject();
        for (int i = 0; i < array.size(); i++) {
            out.set(String.valueOf(i), array.get(i));
        }
        return out;
    }
}
