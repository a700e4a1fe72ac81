/**
 * whisper.cpp subprocess transcription.
 *
 * <p>{@link com.phillippitts.voicecalc.service.stt.whisper.WhisperProcessManager} owns the
 * process lifecycle; {@link com.phillippitts.voicecalc.service.stt.whisper.WhisperTranscriber}
 * turns its output or failure into a
 * {@link com.phillippitts.voicecalc.service.stt.TranscriptionOutcome}.
 */
package com.phillippitts.voicecalc.service.stt.whisper;
