package com.phillippitts.voicecalc.service.session;

import com.phillippitts.voicecalc.domain.SessionState;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe holder of the single {@link SessionState} of a voice session.
 *
 * <p><b>Transitions:</b>
 * <pre>
 * IDLE        → CALIBRATING (start)
 * CALIBRATING → LISTENING   (calibration done)
 * CALIBRATING → STOPPING    (stop during calibration)
 * LISTENING   → STOPPING    (stop, or a spoken stop command)
 * STOPPING    → IDLE        (worker exited)
 * ERROR       → CALIBRATING (start)
 * ERROR       → IDLE        (stop)
 * any         → ERROR       (fatal failure)
 * </pre>
 *
 * <p>All reads and writes happen under one {@link ReentrantLock}.
 *
 * @since 1.0
 */
public final class SessionStateMachine {

    private static final Map<SessionState, Set<SessionState>> ALLOWED = new EnumMap<>(SessionState.class);

    static {
        ALLOWED.put(SessionState.IDLE, EnumSet.of(SessionState.CALIBRATING, SessionState.ERROR));
        ALLOWED.put(SessionState.CALIBRATING,
                EnumSet.of(SessionState.LISTENING, SessionState.STOPPING, SessionState.ERROR));
        ALLOWED.put(SessionState.LISTENING, EnumSet.of(SessionState.STOPPING, SessionState.ERROR));
        ALLOWED.put(SessionState.STOPPING, EnumSet.of(SessionState.IDLE, SessionState.ERROR));
        ALLOWED.put(SessionState.ERROR,
                EnumSet.of(SessionState.CALIBRATING, SessionState.IDLE, SessionState.ERROR));
    }

    private final Lock lock = new ReentrantLock();
    private SessionState state = SessionState.IDLE;

    /**
     * Moves from {@code expected} to {@code target} if the machine is currently in
     * {@code expected}.
     *
     * @return {@code true} if the transition happened, {@code false} if the current state differs
     * @throws IllegalStateException if the transition is not part of the state graph
     */
    public boolean transition(SessionState expected, SessionState target) {
        if (!isAllowed(expected, target)) {
            throw new IllegalStateException("Illegal session transition " + expected + " -> " + target);
        }
        lock.lock();
        try {
            if (state != expected) {
                return false;
            }
            state = target;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enters {@link SessionState#ERROR} from any state.
     *
     * @return the state before the failure
     */
    public SessionState fail() {
        lock.lock();
        try {
            SessionState previous = state;
            state = SessionState.ERROR;
            return previous;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enters {@link SessionState#IDLE} if the current state allows it (STOPPING or ERROR).
     *
     * @return {@code true} if the machine is idle afterwards
     */
    public boolean settleIdle() {
        lock.lock();
        try {
            if (state == SessionState.IDLE) {
                return true;
            }
            if (isAllowed(state, SessionState.IDLE)) {
                state = SessionState.IDLE;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    public SessionState current() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public static boolean isAllowed(SessionState from, SessionState to) {
        Set<SessionState> targets = ALLOWED.get(from);
        return targets != null && targets.contains(to);
    }
}
