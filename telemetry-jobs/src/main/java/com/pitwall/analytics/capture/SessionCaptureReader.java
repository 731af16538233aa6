package com.pitwall.analytics.capture;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import com.pitwall.analytics.model.RawEvent;
import com.pitwall.analytics.parse.JsonNodeUtils;
import com.pitwall.analytics.registry.TopicDefinition;
import com.pitwall.analytics.registry.TopicRegistry;
import com.pitwall.analytics.util.JsonSupport;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Loads a recorded session from a {@code live.jsonl} capture, one {@code {"type", "json", "dateTime"}}
 * object per line. Payloads of compressed streams are inflated on the way in, so callers always
 * receive decoded JSON.
 *
 * <p>A bad line never aborts the load: it is logged and skipped.</p>
 */
public class SessionCaptureReader {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(SessionCaptureReader.class);

    private final TopicRegistry registry;
    private final int maxInflatedBytes;
    private int skippedLines;

    public SessionCaptureReader(TopicRegistry registry) {
        this(registry, PayloadInflater.DEFAULT_MAX_OUTPUT_BYTES);
    }

    public SessionCaptureReader(TopicRegistry registry, int maxInflatedBytes) {
        this.registry = registry;
        this.maxInflatedBytes = maxInflatedBytes;
    }

    /**
     * Events of the capture ordered by timestamp; equal timestamps keep file order.
     *
     * @throws IOException when the file itself cannot be read
     */
    public List<RawEvent> read(Path capture) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(capture, StandardCharsets.UTF_8)) {
            List<RawEvent> events = read(reader);
            LOG.info("Loaded capture {}: events={} skipped={}", capture, events.size(), skippedLines);
            return events;
        }
    }

    public List<RawEvent> read(BufferedReader reader) throws IOException {
        skippedLines = 0;
        List<RawEvent> events = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            RawEvent event = parseLine(line, lineNumber);
            if (event == null) {
                skippedLines++;
                continue;
            }
            events.add(event);
        }
        events.sort(Comparator.comparing(event -> event.timestamp));
        return events;
    }

    public int skippedLines() {
        return skippedLines;
    }

    RawEvent parseLine(String line, int lineNumber) {
        JsonNode node;
        try {
            node = JsonSupport.parse(line);
        } catch (JsonProcessingException ex) {
            LOG.warn("Skipping capture line {}: invalid JSON ({})", lineNumber, ex.getOriginalMessage());
            return null;
        }
        String type = node == null ? null : JsonNodeUtils.asNullableText(node.get("type"));
        if (type == null) {
            LOG.warn("Skipping capture line {}: missing type", lineNumber);
            return null;
        }
        Instant timestamp = JsonNodeUtils.parseInstant(JsonNodeUtils.asNullableText(node.get("dateTime")));
        if (timestamp == null) {
            LOG.warn("Skipping capture line {}: missing or invalid dateTime for {}", lineNumber, type);
            return null;
        }
        JsonNode payload = node.get("json");
        if (payload != null && payload.isTextual() && isCompressed(type)) {
            try {
                payload = JsonSupport.parse(PayloadInflater.inflateBase64(payload.asText(), maxInflatedBytes));
            } catch (IOException ex) {
                LOG.warn("Skipping capture line {}: cannot decode {} payload ({})", lineNumber, type, ex.getMessage());
                return null;
            }
        }
        return new RawEvent(type, payload, timestamp);
    }

    private boolean isCompressed(String type) {
        if (type.endsWith(TopicRegistry.COMPRESSED_SUFFIX)) {
            return true;
        }
        TopicDefinition definition = registry == null ? null : registry.definitionFor(type);
        return definition != null && definition.compressed();
    }
}
