package com.phillippitts.voicecalc.exception;

/**
 * Thrown when a transcription call fails at the service level (engine crash, timeout,
 * non-zero exit). The capture loop converts it into a session-fatal outcome.
 */
public class TranscriptionException extends VoiceCalcException {

    private final String engineName;

    public TranscriptionException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public TranscriptionException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
