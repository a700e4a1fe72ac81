package com.phillippitts.voicecalc.service.intent;

import com.phillippitts.voicecalc.domain.ClassifierOutput;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hot-swappable holder for the active intent classifier.
 *
 * <p>{@link #reload()} trains a complete replacement off to the side and publishes it with a
 * single atomic reference swap. A {@link #classify(String)} call already in progress finishes on
 * the instance it started with; the replaced instance is never mutated. If training fails the
 * current classifier stays active and the exception propagates.
 */
public final class IntentModel implements IntentClassifier {

    private static final Logger LOG = LogManager.getLogger(IntentModel.class);

    private final IntentClassifierFactory factory;
    private final AtomicReference<IntentClassifier> active;

    public IntentModel(IntentClassifierFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
        this.active = new AtomicReference<>(Objects.requireNonNull(factory.create(), "factory returned null"));
    }

    @Override
    public ClassifierOutput classify(String text) {
        return active.get().classify(text);
    }

    /**
     * Retrains from the factory and swaps the result in.
     */
    public void reload() {
        long start = System.nanoTime();
        IntentClassifier next = Objects.requireNonNull(factory.create(), "factory returned null");
        active.set(next);
        LOG.info("Intent model reloaded in {} ms", (System.nanoTime() - start) / 1_000_000L);
    }

    /**
     * Currently active classifier instance.
     */
    public IntentClassifier current() {
        return active.get();
    }
}
