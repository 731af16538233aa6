package com.pitwall.analytics.util;

import java.util.Locale;

/**
 * Shared string semantics for blank handling, feed keyword matching and name suffixes.
 */
public final class StringSemantics {
    private StringSemantics() {}

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    /**
     * Returns the first non-blank value, or {@code null} when every candidate is blank.
     */
    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value;
            }
        }
        return null;
    }

    /**
     * Trimmed, lower-cased form used for keyword comparisons; {@code null} reads as empty.
     */
    public static String lowerTrim(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    public static String stripSuffix(String value, String suffix) {
        if (value == null || suffix == null || !value.endsWith(suffix)) {
            return value;
        }
        return value.substring(0, value.length() - suffix.length());
    }
}
