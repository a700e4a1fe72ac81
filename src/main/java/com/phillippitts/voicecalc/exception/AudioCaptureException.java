package com.phillippitts.voicecalc.exception;

/**
 * Thrown when the capture device cannot be opened or calibrated for a session.
 */
public class AudioCaptureException extends VoiceCalcException {

    private final String reason;

    public AudioCaptureException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /**
     * Short machine-readable reason such as {@code MIC_UNAVAILABLE}.
     */
    public String getReason() {
        return reason;
    }
}
