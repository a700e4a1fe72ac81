package com.phillippitts.voicecalc.domain;

import java.util.Objects;

/**
 * One labeled transcript from the training corpus.
 */
public record TrainingSample(String text, IntentLabel label) {

    public TrainingSample {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(label, "label must not be null");
    }
}
