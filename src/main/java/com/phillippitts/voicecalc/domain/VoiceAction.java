package com.phillippitts.voicecalc.domain;

import java.util.Locale;

/**
 * The single calculator command derived from one utterance.
 */
public enum VoiceAction {
    APPEND_EXPRESSION,
    CALCULATE,
    CLEAR,
    BACKSPACE,
    STOP,
    NOOP;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Actions after which the fragment buffer is discarded without being emitted.
     */
    public boolean resetsBuffer() {
        return this == CLEAR || this == BACKSPACE || this == STOP;
    }
}
