package com.phillippitts.voicecalc.service.intent;

/**
 * Builds a freshly trained {@link IntentClassifier} from the current training data.
 */
@FunctionalInterface
public interface IntentClassifierFactory {

    /**
     * @return a new, fully trained classifier (never null)
     * @throws com.phillippitts.voicecalc.exception.TrainingCorpusException if training data
     *         cannot be loaded or is empty
     */
    IntentClassifier create();
}
