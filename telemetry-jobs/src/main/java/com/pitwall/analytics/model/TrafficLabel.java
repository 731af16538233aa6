package com.pitwall.analytics.model;

import java.util.Locale;

public enum TrafficLabel {
    TRAFFIC,
    CLEAN,
    NEUTRAL,
    UNKNOWN;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
