package com.pitwall.analytics.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.pitwall.analytics.model.NormalizedEvent;
import com.pitwall.analytics.util.JsonSupport;

import java.io.UncheckedIOException;
import java.time.Instant;

final class ProcessorTestSupport {
    static final Instant T0 = Instant.parse("2024-03-02T15:00:00Z");

    private ProcessorTestSupport() {}

    static NormalizedEvent event(String topic, String singleQuotedJson) {
        return event(topic, singleQuotedJson, T0);
    }

    static NormalizedEvent event(String topic, String singleQuotedJson, Instant at) {
        return new NormalizedEvent(topic, json(singleQuotedJson), at);
    }

    static JsonNode json(String singleQuoted) {
        try {
            return JsonSupport.MAPPER.readTree(singleQuoted.replace('\'', '"'));
        } catch (com.fasterxml.jackson.core.JsonProcessingException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
