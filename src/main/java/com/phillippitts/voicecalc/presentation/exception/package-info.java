/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.voicecalc.exception.InvalidIntentLabelException},
 *       empty transcript, malformed body → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.voicecalc.exception.MicrophoneUnavailableException} → 503 Service Unavailable</li>
 *   <li>{@link com.phillippitts.voicecalc.exception.TranscriptionException} → 503 Service Unavailable (retry)</li>
 *   <li>{@link com.phillippitts.voicecalc.exception.TrainingCorpusException} → 500 Internal Server Error</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "microphone-unavailable",
 *   "message": "No microphone detected on server",
 *   "details": "No TargetDataLine supports 16 kHz mono PCM",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * <p>Stack traces and transcript text never reach clients.
 *
 * @see com.phillippitts.voicecalc.exception
 * @since 1.0
 */
package com.phillippitts.voicecalc.presentation.exception;
