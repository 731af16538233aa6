package com.pitwall.analytics.pipeline;

import com.pitwall.analytics.analysis.TrafficThresholds;
import com.pitwall.analytics.capture.PayloadInflater;
import com.pitwall.analytics.util.StringSemantics;

import java.util.Map;

/**
 * Configuration for the session replay job, sourced from environment variables.
 */
public class ReplayConfig {
    public final String capturePath;
    public final String sessionKind;
    public final double pitLossMs;
    public final int maxInflatedBytes;
    public final TrafficThresholds trafficThresholds;

    ReplayConfig(
            String capturePath,
            String sessionKind,
            double pitLossMs,
            int maxInflatedBytes,
            TrafficThresholds trafficThresholds) {
        this.capturePath = capturePath;
        this.sessionKind = sessionKind;
        this.pitLossMs = pitLossMs;
        this.maxInflatedBytes = maxInflatedBytes;
        this.trafficThresholds = trafficThresholds;
    }

    public static ReplayConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static ReplayConfig fromEnv(Map<String, String> env) {
        String capturePath = env(env, "PITWALL_CAPTURE_PATH", "data/live.jsonl");
        String sessionKind = env(env, "PITWALL_SESSION_KIND", "Race");
        double pitLossMs = envDouble(env, "PITWALL_PIT_LOSS_MS", 22_000.0);
        int maxInflatedBytes = envInt(env, "PITWALL_MAX_INFLATED_BYTES", PayloadInflater.DEFAULT_MAX_OUTPUT_BYTES);

        TrafficThresholds defaults = TrafficThresholds.DEFAULTS;
        TrafficThresholds thresholds = new TrafficThresholds(
                envDouble(env, "PITWALL_TRAFFIC_AHEAD_BASE", defaults.trafficAheadBase),
                envDouble(env, "PITWALL_TRAFFIC_AHEAD_FACTOR", defaults.trafficAheadFactor),
                envDouble(env, "PITWALL_TRAFFIC_BEHIND_BASE", defaults.trafficBehindBase),
                envDouble(env, "PITWALL_TRAFFIC_BEHIND_FACTOR", defaults.trafficBehindFactor),
                envDouble(env, "PITWALL_TRAFFIC_CLEAN_AHEAD_BASE", defaults.cleanAheadBase),
                envDouble(env, "PITWALL_TRAFFIC_CLEAN_AHEAD_FACTOR", defaults.cleanAheadFactor),
                envDouble(env, "PITWALL_TRAFFIC_CLEAN_BEHIND_BASE", defaults.cleanBehindBase),
                envDouble(env, "PITWALL_TRAFFIC_CLEAN_BEHIND_FACTOR", defaults.cleanBehindFactor));

        return new ReplayConfig(capturePath, sessionKind, pitLossMs, maxInflatedBytes, thresholds);
    }

    private static String env(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return StringSemantics.isBlank(value) ? defaultValue : value.trim();
    }

    private static int envInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (StringSemantics.isBlank(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    private static double envDouble(Map<String, String> env, String key, double defaultValue) {
        String value = env.get(key);
        if (StringSemantics.isBlank(value)) {
            return defaultValue;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : defaultValue;
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "ReplayConfig{capturePath=" + capturePath + ", sessionKind=" + sessionKind
                + ", pitLossMs=" + pitLossMs + ", maxInflatedBytes=" + maxInflatedBytes + "}";
    }
}
