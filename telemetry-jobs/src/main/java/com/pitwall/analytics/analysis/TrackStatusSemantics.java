package com.pitwall.analytics.analysis;

import com.pitwall.analytics.model.TrackPhase;
import com.pitwall.analytics.util.StringSemantics;

import java.util.regex.Pattern;

/**
 * Canonical reading of track status codes and race-control messages.
 */
public final class TrackStatusSemantics {
    private static final Pattern VSC_WORD = Pattern.compile("\\bvsc\\b");
    private static final Pattern SC_WORD = Pattern.compile("\\bsc\\b");

    private TrackStatusSemantics() {}

    public static boolean isGreen(String status, String message) {
        String statusText = StringSemantics.lowerTrim(status);
        String messageText = StringSemantics.lowerTrim(message);
        if ("1".equals(statusText) || "green".equals(statusText)) {
            return true;
        }
        return messageText.contains("allclear") || messageText.contains("all clear");
    }

    /**
     * Status codes: 1 green, 2 yellow, 4 safety car, 5 red, 6 and 7 virtual safety car. Unmapped
     * codes fall back to keywords in the message.
     */
    public static TrackPhase classifyPhase(String status, String message) {
        switch (StringSemantics.lowerTrim(status)) {
            case "1":
            case "green":
                return TrackPhase.GREEN;
            case "2":
                return TrackPhase.YELLOW;
            case "4":
                return TrackPhase.SC;
            case "5":
                return TrackPhase.RED;
            case "6":
            case "7":
                return TrackPhase.VSC;
            default:
                break;
        }
        String messageText = StringSemantics.lowerTrim(message);
        if (messageText.contains("allclear") || messageText.contains("all clear")) {
            return TrackPhase.GREEN;
        }
        if (messageText.contains("virtual safety car") || VSC_WORD.matcher(messageText).find()) {
            return TrackPhase.VSC;
        }
        if (messageText.contains("safety car") || SC_WORD.matcher(messageText).find()) {
            return TrackPhase.SC;
        }
        if (messageText.contains("red")) {
            return TrackPhase.RED;
        }
        if (messageText.contains("yellow")) {
            return TrackPhase.YELLOW;
        }
        return TrackPhase.UNKNOWN;
    }
}
