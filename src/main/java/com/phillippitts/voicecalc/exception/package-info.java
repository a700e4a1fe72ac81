/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.voicecalc.exception.VoiceCalcException} and map
 * to HTTP responses in the presentation layer:
 * <ul>
 *   <li>{@link com.phillippitts.voicecalc.exception.InvalidIntentLabelException} - 400</li>
 *   <li>{@link com.phillippitts.voicecalc.exception.MicrophoneUnavailableException} - 503</li>
 *   <li>{@link com.phillippitts.voicecalc.exception.TranscriptionException} - 503</li>
 *   <li>{@link com.phillippitts.voicecalc.exception.TrainingCorpusException} - 500</li>
 * </ul>
 *
 * <p>The capture loop never lets these escape: transcription and device failures are turned
 * into explicit outcome values before they reach the session.
 *
 * @since 1.0
 */
package com.phillippitts.voicecalc.exception;
