package com.pitwall.analytics.processor;

import com.fasterxml.jackson.databind.JsonNode;

import com.pitwall.analytics.parse.JsonNodeUtils;
import com.pitwall.analytics.util.StringSemantics;

import java.util.ArrayList;
import java.util.List;

/**
 * Driver roster keyed by racing number.
 */
public class DriverListProcessor extends MergeProcessor {
    public static final String TOPIC = "DriverList";

    public DriverListProcessor() {
        super(TOPIC);
    }

    /**
     * Display name for a driver: full name, then broadcast name, then three-letter code.
     */
    public String nameFor(String driverNumber) {
        if (state == null || driverNumber == null) {
            return null;
        }
        JsonNode entry = state.path(driverNumber);
        if (!entry.isObject()) {
            return null;
        }
        return StringSemantics.firstNonBlank(
                JsonNodeUtils.asNullableText(entry.get("FullName")),
                JsonNodeUtils.asNullableText(entry.get("BroadcastName")),
                JsonNodeUtils.asNullableText(entry.get("Tla")));
    }

    public List<String> driverNumbers() {
        List<String> numbers = new ArrayList<>();
        if (state != null && state.isObject()) {
            state.fields().forEachRemaining(field -> {
                if (field.getValue().isObject()) {
                    numbers.add(field.getKey());
                }
            });
        }
        return numbers;
    }
}
