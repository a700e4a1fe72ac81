package com.phillippitts.voicecalc.service.stt;

import java.util.Objects;

/**
 * Result of transcribing one segment. Exactly one of three kinds, so the capture loop can
 * decide between continuing and failing the session without catching exceptions.
 */
public sealed interface TranscriptionOutcome
        permits TranscriptionOutcome.Recognized, TranscriptionOutcome.Unintelligible,
                TranscriptionOutcome.ServiceError {

    /** Speech was recognized; text is trimmed and non-blank. */
    record Recognized(String text) implements TranscriptionOutcome {
        public Recognized {
            Objects.requireNonNull(text, "text must not be null");
            if (text.isBlank()) {
                throw new IllegalArgumentException("Recognized text must not be blank");
            }
        }
    }

    /** The service ran but heard nothing usable. Transient. */
    record Unintelligible() implements TranscriptionOutcome {
    }

    /** The service itself failed. Fatal for the session. */
    record ServiceError(String message) implements TranscriptionOutcome {
        public ServiceError {
            Objects.requireNonNull(message, "message must not be null");
        }
    }
}
