/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /voice/start}, {@code POST /voice/stop} - capture lifecycle</li>
 *   <li>{@code GET /voice/status} - session state, supported intents, microphone availability</li>
 *   <li>{@code POST /voice/interpret} - synchronous interpretation of a typed transcript</li>
 *   <li>{@code POST /voice/reload-model} - retrain the intent classifier</li>
 *   <li>{@code GET|POST /voice/training-samples} - training corpus</li>
 *   <li>{@code GET /voice/stream} - server-sent event feed</li>
 * </ul>
 *
 * @see com.phillippitts.voicecalc.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.voicecalc.presentation.controller;
