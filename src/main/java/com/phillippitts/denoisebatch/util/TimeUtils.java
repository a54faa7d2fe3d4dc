package com.phillippitts.denoisebatch.util;

import java.time.Duration;

/**
 * Utility methods for elapsed-time measurement and human-readable durations.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Formats a duration for log lines and stats, e.g. {@code 42s}, {@code 3m 05s}, {@code 1h 02m 03s}.
     * A null duration renders as {@code unknown}.
     *
     * @param duration duration to format, may be null
     * @return compact representation
     */
    public static String formatDuration(Duration duration) {
        if (duration == null) {
            return "unknown";
        }
        long totalSeconds = Math.max(0, duration.getSeconds());
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;
        if (hours > 0) {
            return String.format("%dh %02dm %02ds", hours, minutes, seconds);
        }
        if (minutes > 0) {
            return String.format("%dm %02ds", minutes, seconds);
        }
        return seconds + "s";
    }
}
