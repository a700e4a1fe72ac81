package com.phillippitts.voicecalc.service.session;

import com.phillippitts.voicecalc.domain.SessionState;

/**
 * Snapshot returned by {@link VoiceSession#status()}.
 *
 * @param state        current session state
 * @param micAvailable whether a capture device was found
 * @param micError     why no device is available, or {@code null}
 */
public record SessionStatus(SessionState state, boolean micAvailable, String micError) {
}
