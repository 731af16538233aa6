package com.pitwall.analytics.model;

import java.util.Locale;

/**
 * Coarse race-control phase derived from track status codes and messages.
 */
public enum TrackPhase {
    GREEN,
    YELLOW,
    SC,
    VSC,
    RED,
    UNKNOWN;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
