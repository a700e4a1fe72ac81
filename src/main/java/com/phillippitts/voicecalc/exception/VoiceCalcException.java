package com.phillippitts.voicecalc.exception;

/**
 * Base exception for all voicecalc application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class VoiceCalcException extends RuntimeException {

    public VoiceCalcException(String message) {
        super(message);
    }

    public VoiceCalcException(String message, Throwable cause) {
        super(message, cause);
    }
}
