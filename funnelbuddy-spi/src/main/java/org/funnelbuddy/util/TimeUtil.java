package org.funnelbuddy.util;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

public class TimeUtil {
    public static final int MINUTE = 60;
    public static final int HOUR = 3600;

    private TimeUtil() {
    }

    public static String formatDuration(double seconds) {
        if (seconds < MINUTE) {
            return Math.round(seconds) + "s";
        }
        if (seconds < HOUR) {
            return Math.round(seconds / MINUTE) + "m";
        }
        return Math.round(seconds / HOUR) + "h";
    }

    public static double secondsBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 1000.0;
    }

    public static Instant toInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toInstant();
        }
        if (value instanceof Number) {
            return Instant.ofEpochMilli(((Number) value).longValue());
        }
        throw new IllegalArgumentException("Unsupported timestamp value: " + value);
    }

    public static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
