package com.pitwall.analytics.processor;

import com.fasterxml.jackson.databind.JsonNode;

import com.pitwall.analytics.model.NormalizedEvent;

/**
 * Cumulative state machine for one canonical topic.
 *
 * <p>Implementations ignore events of other topics and never throw on unexpected payload shapes.
 * They are mutated by a single ingestion thread.</p>
 */
public interface TopicProcessor {

    String topic();

    void process(NormalizedEvent event);

    /** Live cumulative state, or {@code null} before the first event of the topic. */
    JsonNode latest();
}
