package org.airspace.dss.util;

import java.util.function.Function;

/**
 * Reads DSS_* settings: process environment first, then system properties.
 * Blank or unparseable values fall back to the caller's default.
 */
public final class Env {
    private Env() {}

    public static String get(String key, String defaultValue) {
        String value = firstNonBlank(System.getenv(key), System.getProperty(key));
        return value == null ? defaultValue : value;
    }

    public static int getInt(String key, int defaultValue) {
        return parsed(key, Integer::valueOf, defaultValue);
    }

    public static double getDouble(String key, double defaultValue) {
        return parsed(key, Double::valueOf, defaultValue);
    }

    private static <N extends Number> N parsed(String key, Function<String, N> parser, N defaultValue) {
        String raw = get(key, null);
        if (raw == null) return defaultValue;
        try {
            return parser.apply(raw.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String firstNonBlank(String primary, String fallback) {
        if (primary != null && !primary.isBlank()) return primary;
        if (fallback != null && !fallback.isBlank()) return fallback;
        return null;
    }
}
