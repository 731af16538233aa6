package com.pitwall.analytics.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.pitwall.analytics.model.NormalizedEvent;
import com.pitwall.analytics.util.JsonSupport;

/**
 * Generic processor for patch-style topics: the first payload is adopted as state, later
 * payloads are deep-merged into it.
 *
 * <p>Also serves as the fallback for topics without a dedicated processor.</p>
 */
public class MergeProcessor extends AbstractTopicProcessor {
    protected JsonNode state;

    public MergeProcessor(String topic) {
        super(topic);
    }

    @Override
    protected void apply(NormalizedEvent event) {
        JsonNode patch = event.payload == null || event.payload.isNull() || event.payload.isMissingNode()
                ? JsonSupport.newObject()
                : event.payload;
        if (state == null) {
            state = patch.deepCopy();
        } else if (patch.isObject() && state.isObject()) {
            JsonMerge.mergeDeep((ObjectNode) state, (ObjectNode) patch);
        } else {
            state = patch.deepCopy();
        }
    }

    @Override
    public JsonNode latest() {
        return state;
    }
}
