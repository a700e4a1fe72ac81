package com.phillippitts.voicecalc.exception;

/**
 * Thrown when the training corpus cannot be read, written or used for training.
 */
public class TrainingCorpusException extends VoiceCalcException {

    public TrainingCorpusException(String message) {
        super(message);
    }

    public TrainingCorpusException(String message, Throwable cause) {
        super(message, cause);
    }
}
