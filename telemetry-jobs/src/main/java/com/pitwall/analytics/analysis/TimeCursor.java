package com.pitwall.analytics.analysis;

/**
 * An "as of" position in the session: the latest lap, a lap number, or an ISO-8601 instant.
 */
public final class TimeCursor {
    private static final TimeCursor LATEST = new TimeCursor(null, null);

    private final Double lap;
    private final String iso;

    private TimeCursor(Double lap, String iso) {
        this.lap = lap;
        this.iso = iso;
    }

    public static TimeCursor latest() {
        return LATEST;
    }

    public static TimeCursor lap(double lap) {
        return new TimeCursor(lap, null);
    }

    public static TimeCursor at(String iso) {
        return new TimeCursor(null, iso);
    }

    public boolean isLatest() {
        return lap == null && iso == null;
    }

    public Double lap() {
        return lap;
    }

    public String iso() {
        return iso;
    }

    @Override
    public String toString() {
        if (lap != null) {
            return "TimeCursor{lap=" + lap + "}";
        }
        if (iso != null) {
            return "TimeCursor{iso=" + iso + "}";
        }
        return "TimeCursor{latest}";
    }
}
