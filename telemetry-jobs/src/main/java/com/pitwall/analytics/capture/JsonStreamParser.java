package com.pitwall.analytics.capture;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import com.pitwall.analytics.model.RawEvent;
import com.pitwall.analytics.util.JsonSupport;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code .jsonStream} files: one message per line, each prefixed with its offset from the
 * session start as {@code HH:MM:SS.mmm}.
 */
public final class JsonStreamParser {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(JsonStreamParser.class);

    static final int OFFSET_LENGTH = 12;
    private static final Pattern OFFSET = Pattern.compile("^(\\d{2}):(\\d{2}):(\\d{2})\\.(\\d{3})$");
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private JsonStreamParser() {}

    /**
     * Offset in milliseconds, or {@code null} when the text is not {@code HH:MM:SS.mmm}.
     */
    public static Long parseOffsetMs(String offset) {
        if (offset == null) {
            return null;
        }
        Matcher matcher = OFFSET.matcher(offset);
        if (!matcher.matches()) {
            return null;
        }
        return Long.parseLong(matcher.group(1)) * 3_600_000L
                + Long.parseLong(matcher.group(2)) * 60_000L
                + Long.parseLong(matcher.group(3)) * 1000L
                + Long.parseLong(matcher.group(4));
    }

    /**
     * Parses every line of a stream. Lines with a bad offset or payload are logged and skipped.
     */
    public static List<RawEvent> parse(String type, String raw, Instant start) {
        List<RawEvent> events = new ArrayList<>();
        if (raw == null) {
            return events;
        }
        String[] lines = raw.split("\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (!line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
                line = line.substring(1);
            }
            if (line.isEmpty()) {
                continue;
            }
            RawEvent event = parseLine(type, line, start);
            if (event == null) {
                LOG.warn("Skipping unreadable {} stream line {}", type, i + 1);
                continue;
            }
            events.add(event);
        }
        return events;
    }

    static RawEvent parseLine(String type, String line, Instant start) {
        if (line.length() <= OFFSET_LENGTH) {
            return null;
        }
        Long offsetMs = parseOffsetMs(line.substring(0, OFFSET_LENGTH));
        if (offsetMs == null) {
            return null;
        }
        JsonNode payload;
        try {
            payload = JsonSupport.parse(line.substring(OFFSET_LENGTH));
        } catch (JsonProcessingException ex) {
            LOG.debug("Invalid JSON in {} stream line: {}", type, ex.getOriginalMessage());
            return null;
        }
        return new RawEvent(type, payload, start.plusMillis(offsetMs));
    }
}
