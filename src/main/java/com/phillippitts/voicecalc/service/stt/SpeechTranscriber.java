package com.phillippitts.voicecalc.service.stt;

import com.phillippitts.voicecalc.service.audio.capture.AudioSegment;

/**
 * Speech-to-text for single segments.
 *
 * <p>Implementations never throw for engine failures; they classify every failure as
 * {@link TranscriptionOutcome.Unintelligible} or {@link TranscriptionOutcome.ServiceError}.
 */
public interface SpeechTranscriber {

    TranscriptionOutcome transcribe(AudioSegment segment);

    /**
     * Short engine name for logs and metrics.
     */
    String name();
}
