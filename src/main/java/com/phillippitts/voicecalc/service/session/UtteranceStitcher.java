package com.phillippitts.voicecalc.service.session;

import com.phillippitts.voicecalc.domain.IntentResult;
import com.phillippitts.voicecalc.domain.VoiceAction;

import java.time.Duration;
import java.time.Instant;

/**
 * Applies one interpreted utterance to the fragment buffer and decides what the emitted
 * result carries.
 *
 * <ul>
 *   <li>append: burst-join of all fragments (buffer cleared first after a long gap)</li>
 *   <li>calculate: burst-join, or the utterance's own expression when the buffer is empty; buffer cleared</li>
 *   <li>clear: no expression; buffer cleared</li>
 *   <li>backspace, stop: the utterance's own expression; buffer cleared</li>
 *   <li>noop: unchanged result, buffer untouched</li>
 * </ul>
 */
final class UtteranceStitcher {

    private final FragmentBuffer buffer;

    UtteranceStitcher(Duration gapTimeout) {
        this.buffer = new FragmentBuffer(gapTimeout);
    }

    IntentResult stitch(IntentResult result, Instant now) {
        VoiceAction action = result.action();
        if (action.resetsBuffer()) {
            buffer.reset();
        }
        switch (action) {
            case APPEND_EXPRESSION -> {
                if (result.expression() == null || result.expression().isEmpty()) {
                    return result;
                }
                return result.withAction(action, buffer.append(result.expression(), now));
            }
            case CALCULATE -> {
                String combined = buffer.drain();
                return result.withAction(action, combined.isEmpty() ? result.expression() : combined);
            }
            case CLEAR -> {
                return result.withAction(action, null);
            }
            default -> {
                return result;
            }
        }
    }

    void reset() {
        buffer.reset();
    }

    // Package-private for tests
    FragmentBuffer buffer() {
        return buffer;
    }
}
