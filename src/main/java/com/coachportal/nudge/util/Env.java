package com.coachportal.nudge.util;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Service configuration lookup.
 *
 * Each key is read from the environment first, then from a JVM system property of
 * the same name. Blank values count as unset. Lenient getters fall back to the
 * default on a malformed value; the {@code require*} getters throw
 * IllegalStateException naming the key, for startup validation.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = lookup(key);
        return value != null ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = lookup(key);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = lookup(key);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    /**
     * Whole seconds, e.g. SLACK_HTTP_TIMEOUT_SECONDS=10.
     */
    public static Duration getSeconds(String key, long defaultSeconds) {
        return Duration.ofSeconds(getInt(key, (int) defaultSeconds));
    }

    /**
     * Whole minutes, e.g. NUDGE_SCHEDULER_INTERVAL_MINUTES=60.
     */
    public static Duration getMinutes(String key, long defaultMinutes) {
        return Duration.ofMinutes(getInt(key, (int) defaultMinutes));
    }

    /**
     * IANA zone id; an unparseable id falls back to the default.
     */
    public static ZoneId getZone(String key, ZoneId defaultZone) {
        String value = lookup(key);
        if (value == null) return defaultZone;
        try {
            return ZoneId.of(value);
        } catch (DateTimeException e) {
            return defaultZone;
        }
    }

    /**
     * @throws IllegalStateException if the key is unset
     */
    public static String require(String key) {
        String value = lookup(key);
        if (value == null) {
            throw new IllegalStateException("INVALID CONFIG: " + key + " is not set");
        }
        return value;
    }

    /**
     * @throws IllegalStateException if the value is not an integer in [min, max]
     */
    public static int requireIntInRange(String key, int defaultValue, int min, int max) {
        String value = lookup(key);
        int parsed;
        try {
            parsed = value == null ? defaultValue : Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("INVALID CONFIG: " + key + " is not a number: " + value);
        }
        if (parsed < min || parsed > max) {
            throw new IllegalStateException(
                "INVALID CONFIG: " + key + " must be " + min + ".." + max + ", got " + parsed);
        }
        return parsed;
    }

    /**
     * @throws IllegalStateException if the value is not a valid zone id
     */
    public static ZoneId requireZone(String key, ZoneId defaultZone) {
        String value = lookup(key);
        if (value == null) return defaultZone;
        try {
            return ZoneId.of(value);
        } catch (DateTimeException e) {
            throw new IllegalStateException("INVALID CONFIG: " + key + " is not a valid zone id: " + value);
        }
    }

    private static String lookup(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isBlank() ? value.trim() : null;
    }

    private Env() {}
}
