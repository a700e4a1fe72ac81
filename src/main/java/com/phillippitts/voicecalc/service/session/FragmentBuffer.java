package com.phillippitts.voicecalc.service.session;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered expression fragments of the current burst plus the time of the last one.
 *
 * <p>Invariant: all buffered fragments were appended within {@code gapTimeout} of their
 * predecessor. An append that arrives later than that clears the buffer first.
 *
 * <p>Not thread-safe; owned by the capture worker.
 */
final class FragmentBuffer {

    private final Duration gapTimeout;
    private final List<String> fragments = new ArrayList<>();
    private Instant lastFragmentTime;

    FragmentBuffer(Duration gapTimeout) {
        this.gapTimeout = Objects.requireNonNull(gapTimeout, "gapTimeout");
    }

    /**
     * Appends a fragment and returns the space-joined burst.
     */
    String append(String fragment, Instant now) {
        if (lastFragmentTime != null && Duration.between(lastFragmentTime, now).compareTo(gapTimeout) > 0) {
            fragments.clear();
        }
        fragments.add(fragment);
        lastFragmentTime = now;
        return joined();
    }

    /**
     * Returns the space-joined burst (possibly empty) and resets the buffer.
     */
    String drain() {
        String joined = joined().strip();
        reset();
        return joined;
    }

    void reset() {
        fragments.clear();
        lastFragmentTime = null;
    }

    boolean isEmpty() {
        return fragments.isEmpty();
    }

    List<String> fragments() {
        return List.copyOf(fragments);
    }

    private String joined() {
        return String.join(" ", fragments);
    }
}
