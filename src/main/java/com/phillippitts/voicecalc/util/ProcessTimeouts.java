package com.phillippitts.voicecalc.util;

import java.time.Duration;

/**
 * Timeouts for subprocess and capture thread cleanup.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /** Stream gobbler threads flushing buffered output after the process has exited. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Best-effort gobbler join during cleanup; the threads are daemons. */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** {@link Process#destroy()} grace period. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** {@link Process#destroyForcibly()} deadline. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
