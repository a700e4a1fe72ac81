package com.phillippitts.voicecalc.util;

import java.time.Clock;
import java.time.Instant;

/**
 * Time conversions shared by the capture loop and the whisper process runner.
 *
 * @since 1.0
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Epoch seconds with millisecond precision, the timestamp format of outbound events.
     */
    public static double epochSeconds(Clock clock) {
        Instant now = clock.instant();
        return now.toEpochMilli() / 1000.0;
    }
}
