/**
 * Presentation layer (REST API controllers, the event stream and exception handling).
 *
 * <p>This package contains the HTTP boundary of the voice calculator. Presentation depends on
 * service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - {@code /voice/*} endpoints</li>
 *   <li>{@code presentation.dto} - request bodies</li>
 *   <li>{@code presentation.stream} - server-sent event fan-out of session events</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters and never throw HTTP-specific exceptions; domain exceptions
 * are mapped by {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.voicecalc.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.voicecalc.presentation;
