package com.phillippitts.voicecalc.domain;

import java.util.Locale;

/**
 * Lifecycle state of the voice capture session.
 *
 * <pre>
 * IDLE → CALIBRATING → LISTENING → STOPPING → IDLE
 * any  → ERROR
 * ERROR → CALIBRATING (only via start)
 * </pre>
 */
public enum SessionState {
    IDLE,
    CALIBRATING,
    LISTENING,
    STOPPING,
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether a capture worker may be alive in this state.
     */
    public boolean isRunning() {
        return this == CALIBRATING || this == LISTENING;
    }
}
