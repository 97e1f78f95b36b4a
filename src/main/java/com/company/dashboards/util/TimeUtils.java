package com.company.dashboards.util;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.TemporalAccessor;

public class TimeUtils {

    /**
     * Whole seconds between {@code from} and {@code now}, or null when {@code from} is unknown.
     */
    public static Long stalenessSeconds(Instant from, Instant now) {
        if (from == null || now == null) return null;
        return Math.max(0, Duration.between(from, now).getSeconds());
    }

    public static String formatDuration(Long durationMs) {
        if (durationMs == null) return null;

        long minutes = durationMs / 60000;
        long seconds = (durationMs % 60000) / 1000;
        long millis = durationMs % 1000;

        if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        } else if (seconds > 0) {
            return String.format("%d.%03ds", seconds, millis);
        } else {
            return String.format("%dms", millis);
        }
    }

    /**
     * Temporal values from the engine are handed to charts as ISO-8601 strings; anything
     * else passes through untouched.
     */
    public static Object toJsonFriendly(Object value) {
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        return value;
    }
}
