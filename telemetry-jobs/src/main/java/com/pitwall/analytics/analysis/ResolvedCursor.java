package com.pitwall.analytics.analysis;

import java.time.Instant;
import java.util.Locale;

/**
 * A cursor resolved against the laps actually recorded. {@code lap} is {@code null} only when no
 * lap is known, in which case the source is {@link Source#NONE}.
 */
public final class ResolvedCursor {
    public enum Source {
        LATEST,
        LAP,
        TIME,
        NONE;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public final Integer lap;
    public final Instant timestamp;
    public final Source source;

    ResolvedCursor(Integer lap, Instant timestamp, Source source) {
        this.lap = lap;
        this.timestamp = timestamp;
        this.source = source;
    }

    @Override
    public String toString() {
        return "ResolvedCursor{lap=" + lap + ", timestamp=" + timestamp + ", source=" + source.label() + "}";
    }
}
