package com.phillippitts.voicecalc.presentation.exception;

import com.phillippitts.voicecalc.exception.InvalidIntentLabelException;
import com.phillippitts.voicecalc.exception.MicrophoneUnavailableException;
import com.phillippitts.voicecalc.exception.TrainingCorpusException;
import com.phillippitts.voicecalc.exception.TranscriptionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    static final String MICROPHONE_UNAVAILABLE = "microphone-unavailable";

    /**
     * Client error - label outside the supported intent set (HTTP 400).
     */
    @ExceptionHandler(InvalidIntentLabelException.class)
    ResponseEntity<ApiError> handleInvalidLabel(InvalidIntentLabelException ex) {
        LOG.warn("Rejected unsupported intent label");
        return badRequest(ex.getClass().getSimpleName(), "Unsupported intent label", ex.getMessage());
    }

    /**
     * Client error - request body failed validation, e.g. an empty transcript (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        LOG.warn("Invalid request: {}", details);
        return badRequest("ValidationError", "Invalid request", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body");
        return badRequest("MalformedRequest", "Invalid request", "Request body is missing or malformed");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        LOG.warn("Invalid argument: {}", ex.getMessage());
        return badRequest(ex.getClass().getSimpleName(), "Invalid request", ex.getMessage());
    }

    /**
     * Host has no usable capture device (HTTP 503).
     */
    @ExceptionHandler(MicrophoneUnavailableException.class)
    ResponseEntity<ApiError> handleMicrophoneUnavailable(MicrophoneUnavailableException ex) {
        LOG.warn("Voice capture requested without a microphone: {}", ex.getDeviceError());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                MICROPHONE_UNAVAILABLE,
                ex.getMessage(),
                ex.getDeviceError() == null ? "No input device found" : ex.getDeviceError(),
                Instant.now()
            ));
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(TranscriptionException.class)
    ResponseEntity<ApiError> handleTranscriptionFailure(TranscriptionException ex) {
        LOG.error("Transcription failed: engine={}", ex.getEngineName(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Transcription service temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Training corpus could not be read, written or trained on (HTTP 500).
     */
    @ExceptionHandler(TrainingCorpusException.class)
    ResponseEntity<ApiError> handleCorpusFailure(TrainingCorpusException ex) {
        LOG.error("Training corpus failure", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Training corpus unavailable",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> badRequest(String code, String message, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
