package com.pitwall.analytics.registry;

import java.util.Collections;
import java.util.List;

/**
 * Immutable topic metadata entry resolved from the registry seed.
 */
public final class TopicDefinition {

    public enum Availability {
        ALL_SESSIONS,
        RACE_ONLY
    }

    public enum UpdateSemantics {
        PATCH,
        REPLACE,
        BATCHED
    }

    private final String topic;
    private final String streamName;
    private final List<String> aliases;
    private final Availability availability;
    private final UpdateSemantics semantics;
    private final String notes;

    public TopicDefinition(
            String topic,
            String streamName,
            List<String> aliases,
            Availability availability,
            UpdateSemantics semantics,
            String notes) {
        this.topic = topic;
        this.streamName = streamName == null || streamName.isBlank() ? topic : streamName;
        this.aliases = aliases == null ? Collections.emptyList() : List.copyOf(aliases);
        this.availability = availability == null ? Availability.ALL_SESSIONS : availability;
        this.semantics = semantics == null ? UpdateSemantics.PATCH : semantics;
        this.notes = notes;
    }

    /** Canonical topic name, without any compression suffix. */
    public String topic() {
        return topic;
    }

    /** Name of the downloadable stream; compressed topics keep their {@code .z} suffix. */
    public String streamName() {
        return streamName;
    }

    public List<String> aliases() {
        return aliases;
    }

    public Availability availability() {
        return availability;
    }

    public UpdateSemantics semantics() {
        return semantics;
    }

    public String notes() {
        return notes;
    }

    public boolean compressed() {
        return streamName.endsWith(TopicRegistry.COMPRESSED_SUFFIX);
    }

    boolean matches(String name) {
        return topic.equals(name) || streamName.equals(name) || aliases.contains(name);
    }

    @Override
    public String toString() {
        return "TopicDefinition{" + topic + ", stream=" + streamName + ", " + availability + "}";
    }
}
