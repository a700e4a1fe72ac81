package com.phillippitts.voicecalc.domain;

import java.util.Objects;

/**
 * Label and confidence returned by an intent classifier.
 *
 * @param label      predicted label
 * @param confidence confidence in [0, 1]
 */
public record ClassifierOutput(IntentLabel label, double confidence) {

    public ClassifierOutput {
        Objects.requireNonNull(label, "label must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    public static ClassifierOutput noop() {
        return new ClassifierOutput(IntentLabel.NOOP, 0.0);
    }
}
