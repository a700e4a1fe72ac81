package com.phillippitts.voicecalc.service.audio.capture;

import java.util.Objects;

/**
 * Outcome of one bounded segment acquisition. Timeouts and device loss are values, not
 * exceptions, so the capture loop can handle every case in one place.
 */
public sealed interface AcquireResult
        permits AcquireResult.Captured, AcquireResult.TimedOut, AcquireResult.DeviceLost {

    /** Speech was captured. */
    record Captured(AudioSegment segment) implements AcquireResult {
        public Captured {
            Objects.requireNonNull(segment, "segment must not be null");
        }
    }

    /** No speech started within the wait; not an error. */
    record TimedOut() implements AcquireResult {
    }

    /** The device stopped delivering audio; the session cannot continue. */
    record DeviceLost(String reason) implements AcquireResult {
        public DeviceLost {
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }

    static AcquireResult timedOut() {
        return new TimedOut();
    }
}
