package com.phillippitts.voicecalc.domain;

import com.phillippitts.voicecalc.exception.InvalidIntentLabelException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Closed set of coarse intent labels produced by the classifier.
 */
public enum IntentLabel {
    EXPRESSION,
    CALCULATE,
    CLEAR,
    BACKSPACE,
    STOP,
    NOOP;

    /**
     * Lower-case name used on the wire and in the training corpus.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire label. Unsupported labels are rejected, never coerced.
     *
     * @param value label such as {@code "calculate"}
     * @return matching label
     * @throws InvalidIntentLabelException if the value is null or not one of the supported labels
     */
    public static IntentLabel fromWire(String value) {
        if (value == null) {
            throw new InvalidIntentLabelException(null);
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (IntentLabel label : values()) {
            if (label.name().equals(normalized)) {
                return label;
            }
        }
        throw new InvalidIntentLabelException(value);
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(IntentLabel::wireName).toList();
    }
}
