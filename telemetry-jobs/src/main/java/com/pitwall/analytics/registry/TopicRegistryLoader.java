package com.pitwall.analytics.registry;

import com.fasterxml.jackson.databind.JsonNode;

import com.pitwall.analytics.util.JsonSupport;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads the topic registry seed from classpath or filesystem.
 *
 * Lookup order:
 * 1) JVM property `pitwall.topic.registry.path`
 * 2) classpath resource `reference/topic_registry.v1.json`
 *
 * The default registry is loaded once and shared; it is never mutated.
 */
public final class TopicRegistryLoader {
    public static final String REGISTRY_PROPERTY = "pitwall.topic.registry.path";
    public static final String DEFAULT_CLASSPATH_RESOURCE = "reference/topic_registry.v1.json";

    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(TopicRegistryLoader.class);

    private static volatile TopicRegistry defaultRegistry;

    private TopicRegistryLoader() {}

    public static TopicRegistry loadDefault() {
        TopicRegistry registry = defaultRegistry;
        if (registry == null) {
            synchronized (TopicRegistryLoader.class) {
                registry = defaultRegistry;
                if (registry == null) {
                    registry = resolveDefault();
                    defaultRegistry = registry;
                }
            }
        }
        return registry;
    }

    private static TopicRegistry resolveDefault() {
        String overridePath = System.getProperty(REGISTRY_PROPERTY);
        if (overridePath != null && !overridePath.isBlank()) {
            return loadFromFile(Path.of(overridePath));
        }
        TopicRegistry fromClasspath = loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
        if (fromClasspath == null) {
            throw new IllegalStateException("Topic registry resource not found: " + DEFAULT_CLASSPATH_RESOURCE);
        }
        return fromClasspath;
    }

    static TopicRegistry loadFromClasspath(String resourcePath) {
        try (InputStream in = TopicRegistryLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                return null;
            }
            TopicRegistry registry = parseRegistry(JsonSupport.MAPPER.readTree(in));
            LOG.info("Loaded topic registry version={} topics={} from classpath:{}",
                    registry.version(), registry.size(), resourcePath);
            return registry;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load topic registry from classpath: " + resourcePath, ex);
        }
    }

    static TopicRegistry loadFromFile(Path path) {
        try {
            if (!Files.exists(path)) {
                throw new IllegalStateException("Topic registry file not found: " + path);
            }
            TopicRegistry registry = parseRegistry(JsonSupport.MAPPER.readTree(path.toFile()));
            LOG.info("Loaded topic registry version={} topics={} from {}",
                    registry.version(), registry.size(), path);
            return registry;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load topic registry from file: " + path, ex);
        }
    }

    static TopicRegistry parseRegistry(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Topic registry is not a JSON object");
        }
        String version = root.path("registry_version").asText("unknown");
        JsonNode topics = root.path("topics");
        if (!topics.isArray()) {
            throw new IllegalStateException("Topic registry missing topics array");
        }

        List<TopicDefinition> definitions = new ArrayList<>();
        for (JsonNode entry : topics) {
            String topic = entry.path("topic").asText("");
            if (topic.isBlank()) {
                continue;
            }
            List<String> aliases = new ArrayList<>();
            for (JsonNode alias : entry.path("aliases")) {
                if (alias.isTextual() && !alias.asText().isBlank()) {
                    aliases.add(alias.asText());
                }
            }
            definitions.add(new TopicDefinition(
                    topic,
                    entry.path("stream_name").asText(topic),
                    aliases,
                    parseAvailability(entry.path("availability").asText("")),
                    parseSemantics(entry.path("semantics").asText("")),
                    entry.hasNonNull("notes") ? entry.get("notes").asText() : null));
        }
        return new TopicRegistry(version, definitions);
    }

    private static TopicDefinition.Availability parseAvailability(String raw) {
        return "race-only".equals(raw.trim().toLowerCase(Locale.ROOT))
                ? TopicDefinition.Availability.RACE_ONLY
                : TopicDefinition.Availability.ALL_SESSIONS;
    }

    private static TopicDefinition.UpdateSemantics parseSemantics(String raw) {
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "replace":
                return TopicDefinition.UpdateSemantics.REPLACE;
            case "batched":
                return TopicDefinition.UpdateSemantics.BATCHED;
            default:
                return TopicDefinition.UpdateSemantics.PATCH;
        }
    }
}
