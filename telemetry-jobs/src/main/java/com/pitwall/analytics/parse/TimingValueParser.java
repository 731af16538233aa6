package com.pitwall.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsers for the timing feed's textual time, gap and duration formats.
 *
 * <p>Every method returns {@code null} for input it does not recognise; nothing here throws.</p>
 */
public final class TimingValueParser {
    private static final Pattern MINUTE_LAP_TIME = Pattern.compile("^(\\d+):(\\d{2})\\.(\\d{3})$");
    private static final Pattern SECOND_LAP_TIME = Pattern.compile("^(\\d+)\\.(\\d{3})$");
    private static final Pattern PLAIN_NUMBER = Pattern.compile("^[-+]?\\d+(\\.\\d+)?$");
    private static final Pattern UNSIGNED_SECONDS = Pattern.compile("^\\d+(\\.\\d+)?$");

    private TimingValueParser() {}

    /**
     * Parses {@code M:SS.mmm} or {@code SS.mmm} into milliseconds.
     */
    public static Long parseLapTimeMs(String value) {
        if (value == null) {
            return null;
        }
        String text = value.trim();
        try {
            Matcher minutes = MINUTE_LAP_TIME.matcher(text);
            if (minutes.matches()) {
                return Math.addExact(Math.multiplyExact(Long.parseLong(minutes.group(1)), 60_000L),
                        Long.parseLong(minutes.group(2)) * 1000L + Long.parseLong(minutes.group(3)));
            }
            Matcher seconds = SECOND_LAP_TIME.matcher(text);
            if (seconds.matches()) {
                return Math.addExact(Math.multiplyExact(Long.parseLong(seconds.group(1)), 1000L),
                        Long.parseLong(seconds.group(2)));
            }
        } catch (NumberFormatException | ArithmeticException ex) {
            return null;
        }
        return null;
    }

    /**
     * Gap to the leader in seconds. Lapped markers ("1 LAP", "LAP 12") read as zero.
     */
    public static Double parseGapSeconds(JsonNode node) {
        if (JsonNodeUtils.isAbsent(node) || node.isContainerNode()) {
            return null;
        }
        return parseGapSeconds(node.asText());
    }

    public static Double parseGapSeconds(String value) {
        if (value == null) {
            return null;
        }
        String text = value.trim();
        if (text.isEmpty()) {
            return null;
        }
        if (text.toLowerCase(Locale.ROOT).contains("lap")) {
            return 0.0;
        }
        return parsePlainNumber(text.replace("+", ""));
    }

    /**
     * Interval to the car ahead in seconds; same textual rules as {@link #parseGapSeconds(String)}.
     */
    public static Double parseIntervalSeconds(JsonNode node) {
        return parseGapSeconds(node);
    }

    public static Double parseIntervalSeconds(String value) {
        return parseGapSeconds(value);
    }

    /**
     * Pit lane durations: plain seconds ({@code "21.4"}, {@code 21.4}) or {@code [H:]M:SS(.s)}.
     */
    public static Long parseDurationMs(JsonNode node) {
        if (JsonNodeUtils.isAbsent(node) || node.isContainerNode()) {
            return null;
        }
        if (node.isNumber()) {
            double seconds = node.asDouble();
            return Double.isFinite(seconds) ? Math.round(seconds * 1000.0) : null;
        }
        return parseDurationMs(node.asText());
    }

    public static Long parseDurationMs(String value) {
        if (value == null) {
            return null;
        }
        String raw = value.trim();
        if (raw.isEmpty()) {
            return null;
        }
        String text = raw.startsWith("+") ? raw.substring(1) : raw;
        if (UNSIGNED_SECONDS.matcher(text).matches()) {
            return Math.round(Double.parseDouble(text) * 1000.0);
        }
        if (!text.contains(":")) {
            return null;
        }
        String[] parts = text.split(":", -1);
        Double[] numbers = new Double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            numbers[i] = parsePlainNumber(parts[i].trim());
            if (numbers[i] == null) {
                return null;
            }
        }
        double seconds = numbers[numbers.length - 1];
        if (parts.length == 2) {
            return Math.round((numbers[0] * 60.0 + seconds) * 1000.0);
        }
        if (parts.length == 3) {
            return Math.round((numbers[0] * 3600.0 + numbers[1] * 60.0 + seconds) * 1000.0);
        }
        return null;
    }

    /**
     * Position or line number as reported by the feed ({@code "3"} or {@code 3}).
     */
    public static Integer parsePosition(JsonNode node) {
        Integer value = JsonNodeUtils.asNullableInt(node);
        return value == null || value < 0 ? null : value;
    }

    static Double parsePlainNumber(String value) {
        if (value == null) {
            return null;
        }
        String text = value.trim();
        if (!PLAIN_NUMBER.matcher(text).matches()) {
            return null;
        }
        double parsed = Double.parseDouble(text);
        return Double.isFinite(parsed) ? parsed : null;
    }
}
