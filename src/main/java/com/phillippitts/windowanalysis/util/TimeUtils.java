package com.phillippitts.windowanalysis.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for elapsed-time and deadline arithmetic.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Milliseconds left until a deadline, never negative.
     *
     * @param now      current instant
     * @param deadline deadline instant
     * @return remaining milliseconds, or 0 if the deadline has passed
     */
    public static long millisUntil(Instant now, Instant deadline) {
        return Math.max(0L, Duration.between(now, deadline).toMillis());
    }
}
