package com.pitwall.analytics.registry;

import com.pitwall.analytics.util.StringSemantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only lookup of known feed topics, their stream aliases and session applicability.
 */
public final class TopicRegistry {
    public static final String COMPRESSED_SUFFIX = ".z";
    public static final String JSON_STREAM_SUFFIX = ".jsonStream";

    private final String version;
    private final List<TopicDefinition> definitions;

    public TopicRegistry(String version, List<TopicDefinition> definitions) {
        this.version = version == null || version.isBlank() ? "unknown" : version;
        this.definitions = List.copyOf(definitions);
    }

    public String version() {
        return version;
    }

    public int size() {
        return definitions.size();
    }

    public List<TopicDefinition> definitions() {
        return definitions;
    }

    /**
     * Resolves a canonical name, stream name or alias (optionally ending in {@code .jsonStream}).
     */
    public TopicDefinition definitionFor(String nameOrAlias) {
        if (nameOrAlias == null) {
            return null;
        }
        String normalized = StringSemantics.stripSuffix(nameOrAlias.trim(), JSON_STREAM_SUFFIX);
        for (TopicDefinition definition : definitions) {
            if (definition.matches(normalized)) {
                return definition;
            }
        }
        return null;
    }

    /**
     * Canonical topic for the given name; unknown names pass through unchanged.
     */
    public String canonicalTopic(String nameOrAlias) {
        TopicDefinition definition = definitionFor(nameOrAlias);
        return definition == null ? nameOrAlias : definition.topic();
    }

    public Set<String> topicsForSessionKind(String sessionKind) {
        Set<String> topics = new LinkedHashSet<>();
        for (TopicDefinition definition : applicable(sessionKind)) {
            topics.add(definition.topic());
        }
        return Collections.unmodifiableSet(topics);
    }

    public Set<String> streamNamesForSessionKind(String sessionKind) {
        Set<String> streams = new LinkedHashSet<>();
        for (TopicDefinition definition : applicable(sessionKind)) {
            streams.add(definition.streamName());
        }
        return Collections.unmodifiableSet(streams);
    }

    public static boolean isRaceKind(String sessionKind) {
        String kind = StringSemantics.lowerTrim(sessionKind);
        return "race".equals(kind) || "sprint".equals(kind);
    }

    private List<TopicDefinition> applicable(String sessionKind) {
        boolean race = isRaceKind(sessionKind);
        List<TopicDefinition> out = new ArrayList<>();
        for (TopicDefinition definition : definitions) {
            if (definition.availability() == TopicDefinition.Availability.ALL_SESSIONS
                    || (race && definition.availability() == TopicDefinition.Availability.RACE_ONLY)) {
                out.add(definition);
            }
        }
        return out;
    }
}
