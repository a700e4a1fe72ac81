package com.phillippitts.voicecalc.exception;

/**
 * Thrown at the control boundary when capture is requested on a host without a usable
 * input device.
 */
public class MicrophoneUnavailableException extends VoiceCalcException {

    private final String deviceError;

    public MicrophoneUnavailableException(String deviceError) {
        super("No microphone detected on server");
        this.deviceError = deviceError;
    }

    public String getDeviceError() {
        return deviceError;
    }
}
