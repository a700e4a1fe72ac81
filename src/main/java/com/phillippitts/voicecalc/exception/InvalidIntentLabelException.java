package com.phillippitts.voicecalc.exception;

/**
 * Thrown when a training or append API receives a label outside the supported intent set.
 * The label is rejected synchronously and never coerced to a supported one.
 */
public class InvalidIntentLabelException extends VoiceCalcException {

    private final String label;

    public InvalidIntentLabelException(String label) {
        super("Unsupported label: " + label);
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
